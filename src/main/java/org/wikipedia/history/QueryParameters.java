package org.wikipedia.history;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.MissingOptionException;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * The tunables of a statistics run, read from the command line.
 */
final class QueryParameters {

  static final String DEFAULT_DELIMITER = "</page>";

  private final Path corpus;
  private final Path secondCorpus;
  private final String delimiter;
  private final int minRevisions;
  private final int minContributors;
  private final int top;
  private final int year;
  private final String contributor;
  private final int contributorYear;
  private final int joinYear;
  private final boolean parallel;
  private final int threads;
  private final ReportFormat format;
  private final Path output;

  private QueryParameters(CommandLine line) throws ParseException {
    if (!line.hasOption("corpus")) {
      throw new MissingOptionException("The --corpus option is required");
    }
    corpus = Paths.get(line.getOptionValue("corpus"));
    secondCorpus = line.hasOption("second-corpus") ? Paths.get(line.getOptionValue("second-corpus")) : null;
    delimiter = line.getOptionValue("delimiter", DEFAULT_DELIMITER);
    if (delimiter.isEmpty()) {
      throw new ParseException("The record delimiter should not be empty");
    }
    minRevisions = intValue(line, "min-revisions", 100);
    minContributors = intValue(line, "min-contributors", 10);
    top = intValue(line, "top", 3);
    if (top <= 0) {
      throw new ParseException("The --top value should be positive");
    }
    year = intValue(line, "year", 2014);
    contributor = line.getOptionValue("contributor", "Magioladitis");
    contributorYear = intValue(line, "contributor-year", 2013);
    joinYear = intValue(line, "join-year", 2013);
    parallel = line.hasOption("parallel");
    threads = intValue(line, "threads", Runtime.getRuntime().availableProcessors());
    if (threads <= 0) {
      throw new ParseException("The --threads value should be positive");
    }
    try {
      format = ReportFormat.fromName(line.getOptionValue("format", "text"));
    } catch (IllegalArgumentException e) {
      throw new ParseException("Unknown report format " + line.getOptionValue("format"));
    }
    output = line.hasOption("output") ? Paths.get(line.getOptionValue("output")) : null;
  }

  static Options options() {
    Options options = new Options();
    options.addOption("h", "help", false, "Print this help");
    options.addOption("c", "corpus", true, "Dump file or directory of dump files to compute statistics on");
    options.addOption("s", "second-corpus", true, "Dump file or directory of dump files to join with the first corpus");
    options.addOption("d", "delimiter", true, "Closing tag of the records. By default " + DEFAULT_DELIMITER);
    options.addOption(null, "min-revisions", true, "Minimal number of revisions of the articles to count. By default 100");
    options.addOption(null, "min-contributors", true, "Minimal number of contributors of the articles to count. By default 10");
    options.addOption("n", "top", true, "Size of the rankings. By default 3");
    options.addOption("y", "year", true, "Year to count the contributors of. By default 2014");
    options.addOption(null, "contributor", true, "Contributor to count the revisions of. By default Magioladitis");
    options.addOption(null, "contributor-year", true, "Year to count the revisions of the contributor in. By default 2013");
    options.addOption(null, "join-year", true, "Year used to join the two corpora. By default 2013");
    options.addOption("p", "parallel", false, "Compute the aggregations with parallel streams");
    options.addOption("t", "threads", true, "Number of dump files read at the same time. By default the number of processors");
    options.addOption("f", "format", true, "Report format, text or json. By default text");
    options.addOption("o", "output", true, "File to write the report to. By default the standard output");
    return options;
  }

  static QueryParameters fromCommandLine(CommandLine line) throws ParseException {
    return new QueryParameters(line);
  }

  private static int intValue(CommandLine line, String option, int defaultValue) throws ParseException {
    String value = line.getOptionValue(option);
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new ParseException("Invalid value for --" + option + ": " + value);
    }
  }

  Path getCorpus() {
    return corpus;
  }

  /**
   * @return the corpus to join with, null if there is none
   */
  Path getSecondCorpus() {
    return secondCorpus;
  }

  String getDelimiter() {
    return delimiter;
  }

  int getMinRevisions() {
    return minRevisions;
  }

  int getMinContributors() {
    return minContributors;
  }

  int getTop() {
    return top;
  }

  int getYear() {
    return year;
  }

  String getContributor() {
    return contributor;
  }

  int getContributorYear() {
    return contributorYear;
  }

  int getJoinYear() {
    return joinYear;
  }

  boolean isParallel() {
    return parallel;
  }

  int getThreads() {
    return threads;
  }

  ReportFormat getFormat() {
    return format;
  }

  /**
   * @return the report file, null for the standard output
   */
  Path getOutput() {
    return output;
  }
}
