package org.wikipedia.history.preprocessor;

import com.google.common.base.Preconditions;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.Streams;
import org.wikipedia.history.model.Article;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.stream.Stream;

/**
 * Splits a character source into blocks ending with a delimiter, usually {@code </page>}.
 * <p>
 * The source is read lazily: only the current block and a read buffer are kept in memory.
 * The delimiter is removed by the split and appended again to each returned block.
 * Text found after the last delimiter is returned as a last block.
 */
public final class CorpusReader implements AutoCloseable {

  private static final int BUFFER_SIZE = 8192;

  private final Reader reader;
  private final String delimiter;
  private final char[] buffer = new char[BUFFER_SIZE];
  private final StringBuilder pending = new StringBuilder();
  private int searchFrom = 0;

  public CorpusReader(Reader reader, String delimiter) {
    Preconditions.checkArgument(delimiter != null && !delimiter.isEmpty(), "The record delimiter should not be empty");
    this.reader = reader;
    this.delimiter = delimiter;
  }

  /**
   * @return the non empty blocks of the source, each one ending with the delimiter.
   * Closing the stream closes the source.
   * @throws UncheckedIOException while consuming the stream if the source can not be read
   */
  public Stream<String> readBlocks() {
    return Streams.stream(new AbstractIterator<String>() {
      @Override
      protected String computeNext() {
        try {
          String block = nextBlock();
          return (block == null) ? endOfData() : block;
        } catch (IOException e) {
          throw new UncheckedIOException(e);
        }
      }
    }).onClose(this::closeUnchecked);
  }

  /**
   * @return the articles of the source with at least one revision
   * @throws RecordParseException while consuming the stream if a block is malformed
   */
  public Stream<Article> toArticles() {
    return readBlocks()
            .map(ArticleParser::parse)
            .filter(article -> article.revisionCount() >= 1);
  }

  private String nextBlock() throws IOException {
    while (true) {
      int end = pending.indexOf(delimiter, searchFrom);
      if (end >= 0) {
        String chunk = pending.substring(0, end);
        pending.delete(0, end + delimiter.length());
        searchFrom = 0;
        if (!chunk.isEmpty()) {
          return chunk + delimiter;
        }
        continue;
      }
      //The delimiter may start in the part already scanned
      searchFrom = Math.max(0, pending.length() - delimiter.length() + 1);

      int read = reader.read(buffer);
      if (read < 0) {
        if (pending.length() == 0) {
          return null;
        }
        String chunk = pending.toString();
        pending.setLength(0);
        searchFrom = 0;
        return chunk + delimiter;
      }
      pending.append(buffer, 0, read);
    }
  }

  private void closeUnchecked() {
    try {
      close();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  @Override
  public void close() throws IOException {
    reader.close();
  }
}
