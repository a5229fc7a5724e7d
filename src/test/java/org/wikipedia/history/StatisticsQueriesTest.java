package org.wikipedia.history;

import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.ParseException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.wikipedia.history.model.Article;
import org.wikipedia.history.preprocessor.CorpusReader;
import org.wikipedia.history.stats.CorpusSize;
import org.wikipedia.history.stats.KeyCount;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.Stream;

class StatisticsQueriesTest {

  @Test
  void testSingleCorpus() throws ParseException, IOException {
    StatisticsReport report = queries("-c", "unused", "--min-revisions", "2", "--min-contributors", "3", "--top", "1", "--year", "2014")
            .run(readSample("/dump_sample.xml"), null);

    Assertions.assertEquals(new CorpusSize(6, 2), value(report, "Q1"));
    Assertions.assertEquals(5L, value(report, "Q2"));
    Assertions.assertEquals(new TreeSet<>(Arrays.asList(2013, 2014)), value(report, "Q3"));
    Assertions.assertEquals(1L, value(report, "Q4"));
    Assertions.assertEquals(Arrays.asList(new KeyCount("Albert Einstein", 4)), value(report, "Q5"));
    Assertions.assertEquals(Arrays.asList(new KeyCount("Alice", 2)), value(report, "Q6"));
    Assertions.assertEquals(2, value(report, "Q7-grouping"));
    Assertions.assertEquals(2, value(report, "Q8-grouping"));
    Assertions.assertEquals(3, value(report, "Q8"));
    Assertions.assertEquals(1, value(report, "Q9"));
    Assertions.assertFalse(report.getEntry("Q10").isPresent());
    Assertions.assertFalse(report.getEntry("Q11").isPresent());
  }

  @Test
  void testJoin() throws ParseException, IOException {
    for (String[] args : Arrays.asList(new String[]{"-c", "unused"}, new String[]{"-c", "unused", "--parallel"})) {
      StatisticsReport report = queries(args)
              .run(readSample("/dump_sample.xml"), readSample("/dump_sample_2.xml"));
      Assertions.assertEquals(5, value(report, "Q10-cogroup"));
      Assertions.assertEquals(2, value(report, "Q10"));
      Assertions.assertEquals(1, value(report, "Q11"));
    }
  }

  @Test
  void testTextReport() throws ParseException, IOException {
    StatisticsReport report = queries("-c", "unused").run(readSample("/dump_sample.xml"), readSample("/dump_sample_2.xml"));
    StringWriter writer = new StringWriter();
    report.write(writer, ReportFormat.TEXT);
    String text = writer.toString();
    Assertions.assertTrue(text.contains("********** Q1: revision and article counts\nrevision num -> 6, article num -> 2\n"));
    Assertions.assertTrue(text.contains("(Albert Einstein,4)\n(Zurich,2)\n"));
    Assertions.assertTrue(text.contains("Processing Q11 took "));
    Assertions.assertTrue(text.contains("Processing Q7-grouping took "));
    Assertions.assertTrue(text.contains("Processing Q10-cogroup took "));
    Assertions.assertTrue(text.indexOf("Processing Q10-cogroup took ") < text.indexOf("********** Q10: "));
  }

  @Test
  void testJsonReport() throws ParseException, IOException {
    StatisticsReport report = queries("-c", "unused").run(readSample("/dump_sample.xml"), null);
    StringWriter writer = new StringWriter();
    report.write(writer, ReportFormat.JSON);
    String json = writer.toString();
    Assertions.assertTrue(json.contains("\"label\" : \"Q1\""));
    Assertions.assertTrue(json.contains("\"revisionCount\" : 6"));
    Assertions.assertTrue(json.contains("\"key\" : \"Albert Einstein\""));
    Assertions.assertTrue(json.contains("\"durationMillis\""));
  }

  private static StatisticsQueries queries(String... args) throws ParseException {
    return new StatisticsQueries(QueryParameters.fromCommandLine(new DefaultParser().parse(QueryParameters.options(), args)));
  }

  private static Object value(StatisticsReport report, String label) {
    return report.getEntry(label).orElseThrow(() -> new AssertionError("No result for " + label)).getValue();
  }

  private List<Article> readSample(String resource) throws IOException {
    try (
            CorpusReader reader = new CorpusReader(new InputStreamReader(getClass().getResourceAsStream(resource), StandardCharsets.UTF_8), "</page>");
            Stream<Article> articles = reader.toArticles()
    ) {
      return articles.collect(Collectors.toList());
    }
  }
}
