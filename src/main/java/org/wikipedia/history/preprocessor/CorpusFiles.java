package org.wikipedia.history.preprocessor;

import org.apache.commons.compress.compressors.bzip2.BZip2CompressorInputStream;
import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wikipedia.history.model.Article;

import java.io.BufferedInputStream;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.GZIPInputStream;

/**
 * Access to dump files on the local file system.
 */
public final class CorpusFiles {

  private static final Logger LOGGER = LoggerFactory.getLogger(CorpusFiles.class);
  private static final List<String> DUMP_EXTENSIONS = Arrays.asList("xml", "bz2", "gz");

  private CorpusFiles() {
  }

  /**
   * Opens a dump file as UTF-8 text, decompressing .bz2 and .gz files.
   */
  public static Reader open(Path file) throws IOException {
    InputStream input = new BufferedInputStream(Files.newInputStream(file));
    try {
      switch (FilenameUtils.getExtension(file.toString())) {
        case "bz2":
          input = new BZip2CompressorInputStream(input, true);
          break;
        case "gz":
          input = new GZIPInputStream(input);
          break;
        default:
          break;
      }
    } catch (IOException e) {
      input.close();
      throw e;
    }
    return new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
  }

  /**
   * @return the file itself or the dump files contained in the directory, sorted by path
   */
  public static List<Path> list(Path corpus) throws IOException {
    if (!Files.isDirectory(corpus)) {
      if (!Files.exists(corpus)) {
        throw new IOException("The corpus " + corpus + " does not exist.");
      }
      return Collections.singletonList(corpus);
    }
    try (Stream<Path> files = Files.walk(corpus)) {
      return files
              .filter(Files::isRegularFile)
              .filter(file -> DUMP_EXTENSIONS.contains(FilenameUtils.getExtension(file.toString())))
              .sorted()
              .collect(Collectors.toList());
    }
  }

  /**
   * Lazily parses the articles of a single file, one block at a time.
   * The stream must be closed to close the file.
   *
   * @throws UncheckedIOException while consuming the stream if the file can not be read
   */
  public static Stream<Article> streamArticles(Path file, String delimiter) throws IOException {
    return new CorpusReader(open(file), delimiter).toArticles();
  }

  /**
   * Parses the articles of a single file.
   */
  public static List<Article> readArticles(Path file, String delimiter) throws IOException {
    try (Stream<Article> articles = streamArticles(file, delimiter)) {
      return articles.collect(Collectors.toList());
    } catch (UncheckedIOException e) {
      throw e.getCause();
    }
  }

  /**
   * Parses all the files of a corpus, one task per file, and returns the articles in file order.
   *
   * @throws RecordParseException if a block of one of the files is malformed
   */
  public static List<Article> readArticles(Path corpus, String delimiter, ExecutorService executorService) throws IOException, InterruptedException {
    List<Path> files = list(corpus);
    if (files.isEmpty()) {
      LOGGER.warn("No dump file found in " + corpus);
    }
    List<Callable<List<Article>>> tasks = files.stream()
            .map(file -> (Callable<List<Article>>) () -> {
              LOGGER.info("Reading " + file);
              List<Article> articles = readArticles(file, delimiter);
              LOGGER.info(articles.size() + " articles read from " + file);
              return articles;
            })
            .collect(Collectors.toList());

    List<Article> articles = new ArrayList<>();
    for (Future<List<Article>> result : executorService.invokeAll(tasks)) {
      try {
        articles.addAll(result.get());
      } catch (ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof IOException) {
          throw (IOException) cause;
        }
        if (cause instanceof RuntimeException) {
          throw (RuntimeException) cause;
        }
        throw new IllegalStateException(cause);
      }
    }
    return articles;
  }
}
