package org.wikipedia.history.preprocessor;

import com.google.common.base.Strings;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.wikipedia.history.model.Article;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

class CorpusReaderTest {

  @Test
  void testReadBlocks() {
    Assertions.assertEquals(
            Arrays.asList("<page>1</page>", "\n<page>2</page>", "\n</mediawiki>\n</page>"),
            readBlocks("<page>1</page>\n<page>2</page>\n</mediawiki>\n", "</page>")
    );
  }

  @Test
  void testEmptyBlocksAreDiscarded() {
    Assertions.assertEquals(
            Arrays.asList("a</page>", "b</page>"),
            readBlocks("</page>a</page></page></page>b</page>", "</page>")
    );
    Assertions.assertEquals(0, readBlocks("", "</page>").size());
  }

  @Test
  void testOtherDelimiter() {
    Assertions.assertEquals(
            Arrays.asList("a;;", "b;;"),
            readBlocks("a;;b", ";;")
    );
  }

  @Test
  void testDelimiterAcrossBufferBoundaries() {
    List<String> expected = new ArrayList<>();
    StringBuilder source = new StringBuilder();
    for (int i = 0; i < 200; i++) {
      String block = "<page><title>" + Strings.repeat("x", i * 97 % 9000) + "</title></page>";
      expected.add(block);
      source.append(block);
    }
    Assertions.assertEquals(expected, readBlocks(source.toString(), "</page>"));
  }

  @Test
  void testToArticles() throws IOException {
    try (
            CorpusReader corpusReader = new CorpusReader(sampleReader(), "</page>");
            Stream<Article> stream = corpusReader.toArticles()
    ) {
      List<Article> articles = stream.collect(Collectors.toList());
      Assertions.assertEquals(2, articles.size());
      Assertions.assertEquals("Albert Einstein", articles.get(0).getTitle());
      Assertions.assertEquals(736, articles.get(0).getId());
      Assertions.assertEquals(4, articles.get(0).revisionCount());
      Assertions.assertEquals(Arrays.asList(100L, 101L, 102L, 103L),
              articles.get(0).getRevisions().stream().map(revision -> revision.getId()).collect(Collectors.toList()));
      Assertions.assertEquals(Arrays.asList("Alice", "10.0.0.1", "Magioladitis", "Alice"), articles.get(0).contributors());
      Assertions.assertEquals("Zurich", articles.get(1).getTitle());
      Assertions.assertEquals(2, articles.get(1).revisionCount());
    }
  }

  @Test
  void testToArticlesIsLazy() throws IOException {
    String source = "<page><id>1</id><revision><timestamp>2013-05-01T00:00:00Z</timestamp></revision></page>" +
            "<page><revision><timestamp>broken</timestamp></revision></page>";
    try (CorpusReader corpusReader = new CorpusReader(new StringReader(source), "</page>")) {
      Assertions.assertEquals(1, corpusReader.toArticles().findFirst().get().getId());
    }
    try (CorpusReader corpusReader = new CorpusReader(new StringReader(source), "</page>")) {
      Assertions.assertThrows(RecordParseException.class, () -> corpusReader.toArticles().count());
    }
  }

  @Test
  void testReadFailure() {
    Reader failing = new Reader() {
      @Override
      public int read(char[] buffer, int offset, int length) throws IOException {
        throw new IOException("disk failure");
      }

      @Override
      public void close() {
      }
    };
    CorpusReader corpusReader = new CorpusReader(failing, "</page>");
    Assertions.assertThrows(UncheckedIOException.class, () -> corpusReader.readBlocks().count());
  }

  @Test
  void testEmptyDelimiter() {
    Assertions.assertThrows(IllegalArgumentException.class, () -> new CorpusReader(new StringReader(""), ""));
  }

  private static List<String> readBlocks(String source, String delimiter) {
    try (Stream<String> blocks = new CorpusReader(new StringReader(source), delimiter).readBlocks()) {
      return blocks.collect(Collectors.toList());
    }
  }

  private Reader sampleReader() {
    return new InputStreamReader(getClass().getResourceAsStream("/dump_sample.xml"), StandardCharsets.UTF_8);
  }
}
