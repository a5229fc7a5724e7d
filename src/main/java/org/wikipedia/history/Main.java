package org.wikipedia.history;

import org.apache.commons.cli.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wikipedia.history.model.Article;
import org.wikipedia.history.preprocessor.CorpusFiles;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

public class Main {
  private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

  public static void main(String[] args) throws ParseException, IOException {
    Options options = QueryParameters.options();
    CommandLineParser parser = new DefaultParser();
    CommandLine line = parser.parse(options, args);
    if (line.hasOption("help")) {
      new HelpFormatter().printHelp("wikipedia-history-stats", options);
      return;
    }
    QueryParameters parameters = QueryParameters.fromCommandLine(line);

    ExecutorService executorService = Executors.newFixedThreadPool(parameters.getThreads());
    StatisticsReport report;
    try {
      List<Article> first = load(parameters.getCorpus(), parameters, executorService);
      List<Article> second = (parameters.getSecondCorpus() == null)
              ? null
              : load(parameters.getSecondCorpus(), parameters, executorService);
      report = new StatisticsQueries(parameters).run(first, second);
    } finally {
      executorService.shutdown();
    }

    if (parameters.getOutput() == null) {
      Writer writer = new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
      report.write(writer, parameters.getFormat());
      writer.flush();
    } else {
      try (Writer writer = Files.newBufferedWriter(parameters.getOutput(), StandardCharsets.UTF_8)) {
        report.write(writer, parameters.getFormat());
      }
      LOGGER.info("Report written to " + parameters.getOutput());
    }
  }

  private static List<Article> load(Path corpus, QueryParameters parameters, ExecutorService executorService) throws IOException {
    Timed<List<Article>> articles;
    try {
      articles = Timed.run("loading " + corpus, () -> {
        try {
          return CorpusFiles.readArticles(corpus, parameters.getDelimiter(), executorService);
        } catch (IOException e) {
          throw new UncheckedIOException(e);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new IllegalStateException("Interrupted while loading " + corpus, e);
        }
      });
    } catch (UncheckedIOException e) {
      throw e.getCause();
    }
    LOGGER.info(articles.toString());
    LOGGER.info(articles.getValue().size() + " articles loaded from " + corpus);
    return articles.getValue();
  }
}
