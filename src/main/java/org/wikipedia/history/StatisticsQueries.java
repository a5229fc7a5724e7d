package org.wikipedia.history;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wikipedia.history.model.Article;
import org.wikipedia.history.model.Revision;
import org.wikipedia.history.stats.ArticleStatistics;
import org.wikipedia.history.stats.ContributorCoGroup;
import org.wikipedia.history.stats.RevisionPredicates;
import org.wikipedia.history.stats.RevisionReducers;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * The fixed list of statistics computed on one corpus, and on its join with a second corpus if there is one.
 */
final class StatisticsQueries {

  private static final Logger LOGGER = LoggerFactory.getLogger(StatisticsQueries.class);

  private final QueryParameters parameters;

  StatisticsQueries(QueryParameters parameters) {
    this.parameters = parameters;
  }

  /**
   * @param second the articles to join with, null to skip the join queries
   */
  StatisticsReport run(List<Article> first, List<Article> second) {
    StatisticsReport report = new StatisticsReport();

    add(report, "first article", Timed.run("Q0", () -> first.isEmpty() ? "" : first.get(0).toString()));
    add(report, "revision and article counts",
            Timed.run("Q1", () -> ArticleStatistics.totalRevisionsAndArticles(stream(first))));
    add(report, "number of unique contributors",
            Timed.run("Q2", () -> ArticleStatistics.uniqueContributorCount(stream(first))));
    add(report, "years when articles were created",
            Timed.run("Q3", () -> ArticleStatistics.creationYears(stream(first))));
    add(report, "articles with at least " + parameters.getMinRevisions() + " revisions and " + parameters.getMinContributors() + " unique contributors",
            Timed.run("Q4", () -> ArticleStatistics.countWithMinRevisionsAndContributors(
                    stream(first), parameters.getMinRevisions(), parameters.getMinContributors()
            )));
    add(report, "top " + parameters.getTop() + " articles having the largest number of revisions",
            Timed.run("Q5", () -> ArticleStatistics.topArticlesByRevisionCount(stream(first), parameters.getTop())));
    add(report, "top " + parameters.getTop() + " contributors having the largest number of revisions",
            Timed.run("Q6", () -> ArticleStatistics.topContributorsByRevisionCount(stream(first), parameters.getTop())));

    Timed<Map<Integer, List<Revision>>> yearGroupsResult = Timed.run("Q7-grouping", () -> ArticleStatistics.groupRevisionsByYear(stream(first)));
    add(report, "number of years in the revision history (grouping of the revisions by year)", yearGroupsResult.map(Map::size));
    Map<Integer, List<Revision>> yearGroups = yearGroupsResult.getValue();
    Timed<Map<Integer, Map<String, Integer>>> contributorCountsResult = Timed.run("Q8-grouping", () -> ArticleStatistics.contributorCountsPerYear(yearGroups));
    add(report, "number of years with contributor counts (counting of the revisions per contributor and year)", contributorCountsResult.map(Map::size));
    Map<Integer, Map<String, Integer>> contributorCounts = contributorCountsResult.getValue();
    add(report, "number of revisions per year",
            Timed.run("Q7", () -> ArticleStatistics.lookupPerYear(yearGroups, RevisionReducers.revisionCount())));
    add(report, "number of unique contributors having made revisions in " + parameters.getYear(),
            Timed.run("Q8", () -> ArticleStatistics.contributorsInYear(contributorCounts, parameters.getYear()).size()));
    add(report, "number of revisions made by " + parameters.getContributor() + " in " + parameters.getContributorYear(),
            Timed.run("Q9", () -> ArticleStatistics.revisionsByContributorInYear(
                    contributorCounts, parameters.getContributorYear(), parameters.getContributor()
            )));

    if (second == null) {
      LOGGER.info("No second corpus given, skipping the join queries");
      return report;
    }
    Timed<Map<String, ContributorCoGroup>> cogroupResult = Timed.run("Q10-cogroup", () -> ArticleStatistics.cogroupByContributor(stream(first), stream(second)));
    add(report, "number of contributors of any of the two corpora (cogroup of the revisions by contributor)", cogroupResult.map(Map::size));
    Map<String, ContributorCoGroup> cogroup = cogroupResult.getValue();
    add(report, "number of contributors having contributed to both corpora",
            Timed.run("Q10", () -> ArticleStatistics.filterCogroup(cogroup, RevisionPredicates.notEmpty()).size()));
    add(report, "number of contributors having contributed to both corpora in " + parameters.getJoinYear(),
            Timed.run("Q11", () -> ArticleStatistics.filterCogroup(cogroup, RevisionPredicates.anyInYear(parameters.getJoinYear())).size()));
    return report;
  }

  private Stream<Article> stream(List<Article> articles) {
    return parameters.isParallel() ? articles.parallelStream() : articles.stream();
  }

  private static void add(StatisticsReport report, String description, Timed<?> result) {
    LOGGER.info(result.toString());
    report.add(description, result);
  }
}
