package org.wikipedia.history;

import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.MissingOptionException;
import org.apache.commons.cli.ParseException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;

class QueryParametersTest {

  @Test
  void testDefaults() throws ParseException {
    QueryParameters parameters = parse("-c", "wiki_1.xml");
    Assertions.assertEquals(Paths.get("wiki_1.xml"), parameters.getCorpus());
    Assertions.assertNull(parameters.getSecondCorpus());
    Assertions.assertEquals("</page>", parameters.getDelimiter());
    Assertions.assertEquals(100, parameters.getMinRevisions());
    Assertions.assertEquals(10, parameters.getMinContributors());
    Assertions.assertEquals(3, parameters.getTop());
    Assertions.assertEquals(2014, parameters.getYear());
    Assertions.assertEquals("Magioladitis", parameters.getContributor());
    Assertions.assertEquals(2013, parameters.getContributorYear());
    Assertions.assertEquals(2013, parameters.getJoinYear());
    Assertions.assertFalse(parameters.isParallel());
    Assertions.assertTrue(parameters.getThreads() > 0);
    Assertions.assertEquals(ReportFormat.TEXT, parameters.getFormat());
    Assertions.assertNull(parameters.getOutput());
  }

  @Test
  void testOptions() throws ParseException {
    QueryParameters parameters = parse(
            "--corpus", "a", "--second-corpus", "b", "--delimiter", "</doc>", "--min-revisions", "5",
            "--min-contributors", "2", "--top", "10", "--year", "2010", "--contributor", "Alice",
            "--contributor-year", "2011", "--join-year", "2012", "--parallel", "--threads", "4",
            "--format", "JSON", "--output", "report.json"
    );
    Assertions.assertEquals(Paths.get("b"), parameters.getSecondCorpus());
    Assertions.assertEquals("</doc>", parameters.getDelimiter());
    Assertions.assertEquals(5, parameters.getMinRevisions());
    Assertions.assertEquals(2, parameters.getMinContributors());
    Assertions.assertEquals(10, parameters.getTop());
    Assertions.assertEquals(2010, parameters.getYear());
    Assertions.assertEquals("Alice", parameters.getContributor());
    Assertions.assertEquals(2011, parameters.getContributorYear());
    Assertions.assertEquals(2012, parameters.getJoinYear());
    Assertions.assertTrue(parameters.isParallel());
    Assertions.assertEquals(4, parameters.getThreads());
    Assertions.assertEquals(ReportFormat.JSON, parameters.getFormat());
    Assertions.assertEquals(Paths.get("report.json"), parameters.getOutput());
  }

  @Test
  void testInvalidOptions() {
    Assertions.assertThrows(MissingOptionException.class, () -> parse("--top", "3"));
    Assertions.assertThrows(ParseException.class, () -> parse("-c", "a", "--top", "three"));
    Assertions.assertThrows(ParseException.class, () -> parse("-c", "a", "--top", "0"));
    Assertions.assertThrows(ParseException.class, () -> parse("-c", "a", "--threads", "-1"));
    Assertions.assertThrows(ParseException.class, () -> parse("-c", "a", "--format", "xml"));
  }

  private static QueryParameters parse(String... args) throws ParseException {
    return QueryParameters.fromCommandLine(new DefaultParser().parse(QueryParameters.options(), args));
  }
}
