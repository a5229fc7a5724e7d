package org.wikipedia.history.stats;

import com.google.common.collect.Comparators;
import com.google.common.collect.Sets;
import org.wikipedia.history.model.Article;
import org.wikipedia.history.model.Revision;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Predicate;
import java.util.function.ToIntFunction;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Aggregations over streams of articles.
 * <p>
 * Inputs are never modified. All the aggregations are associative reductions so the article streams may be parallel:
 * each shard is reduced on its own and the partial results are merged, sums are added, sets and bags are united and
 * rankings are merged before being sorted.
 */
public final class ArticleStatistics {

  private ArticleStatistics() {
  }

  public static CorpusSize totalRevisionsAndArticles(Stream<Article> articles) {
    return articles
            .map(article -> new CorpusSize(article.revisionCount(), 1))
            .reduce(new CorpusSize(0, 0), CorpusSize::plus);
  }

  /**
   * Sums for each article the number of its distinct contributors.
   * A contributor of several articles is counted once per article.
   */
  public static long uniqueContributorCount(Stream<Article> articles) {
    return articles.mapToLong(Article::distinctContributorCount).sum();
  }

  /**
   * @return the distinct years of the first revisions of the articles
   */
  public static SortedSet<Integer> creationYears(Stream<Article> articles) {
    return articles.map(Article::creationYear).collect(Collectors.toCollection(TreeSet::new));
  }

  /**
   * @return the number of articles with at least minRevisions revisions and minContributors distinct contributors
   */
  public static long countWithMinRevisionsAndContributors(Stream<Article> articles, int minRevisions, int minContributors) {
    return articles
            .filter(article -> article.revisionCount() >= minRevisions)
            .filter(article -> article.distinctContributorCount() >= minContributors)
            .count();
  }

  /**
   * @return the titles of the articles with their number of revisions, largest count first
   */
  public static List<KeyCount> topArticlesByRevisionCount(Stream<Article> articles) {
    return articlesByRevisionCount(articles).sorted(KeyCount.DESCENDING).collect(Collectors.toList());
  }

  /**
   * Same as {@link #topArticlesByRevisionCount(Stream)} but keeps only the first limit entries.
   */
  public static List<KeyCount> topArticlesByRevisionCount(Stream<Article> articles, int limit) {
    return articlesByRevisionCount(articles).collect(Comparators.least(limit, KeyCount.DESCENDING));
  }

  /**
   * @return the contributors with the number of revisions they made, largest count first
   */
  public static List<KeyCount> topContributorsByRevisionCount(Stream<Article> articles) {
    return contributorsByRevisionCount(articles).sorted(KeyCount.DESCENDING).collect(Collectors.toList());
  }

  /**
   * Same as {@link #topContributorsByRevisionCount(Stream)} but keeps only the first limit entries.
   */
  public static List<KeyCount> topContributorsByRevisionCount(Stream<Article> articles, int limit) {
    return contributorsByRevisionCount(articles).collect(Comparators.least(limit, KeyCount.DESCENDING));
  }

  private static Stream<KeyCount> articlesByRevisionCount(Stream<Article> articles) {
    return articles.map(article -> new KeyCount(article.getTitle(), article.revisionCount()));
  }

  private static Stream<KeyCount> contributorsByRevisionCount(Stream<Article> articles) {
    Map<String, Long> counts = articles
            .flatMap(article -> article.contributors().stream())
            .collect(Collectors.groupingBy(contributor -> contributor, Collectors.counting()));
    return counts.entrySet().stream().map(entry -> new KeyCount(entry.getKey(), entry.getValue()));
  }

  /**
   * @return all the revisions of the articles grouped by year
   */
  public static SortedMap<Integer, List<Revision>> groupRevisionsByYear(Stream<Article> articles) {
    return articles
            .flatMap(article -> article.getRevisions().stream())
            .collect(Collectors.groupingBy(Revision::year, TreeMap::new, Collectors.toList()));
  }

  /**
   * Applies reducer to the revisions of each year.
   */
  public static SortedMap<Integer, Integer> lookupPerYear(
          Map<Integer, ? extends Collection<Revision>> yearGroups, ToIntFunction<? super Collection<Revision>> reducer
  ) {
    SortedMap<Integer, Integer> result = new TreeMap<>();
    yearGroups.forEach((year, revisions) -> result.put(year, reducer.applyAsInt(revisions)));
    return result;
  }

  /**
   * @return for each year the number of revisions made by each contributor
   */
  public static SortedMap<Integer, Map<String, Integer>> contributorCountsPerYear(Map<Integer, ? extends Collection<Revision>> yearGroups) {
    SortedMap<Integer, Map<String, Integer>> result = new TreeMap<>();
    yearGroups.forEach((year, revisions) -> result.put(year, revisions.stream()
            .collect(Collectors.groupingBy(Revision::getContributor, Collectors.summingInt(revision -> 1)))
    ));
    return result;
  }

  /**
   * @return the contributors that made at least one revision during the given year
   */
  public static SortedSet<String> contributorsInYear(Map<Integer, Map<String, Integer>> contributorCounts, int year) {
    return new TreeSet<>(contributorCounts.getOrDefault(year, Collections.emptyMap()).keySet());
  }

  public static int revisionsByContributorInYear(Map<Integer, Map<String, Integer>> contributorCounts, int year, String contributor) {
    return contributorCounts.getOrDefault(year, Collections.emptyMap()).getOrDefault(contributor, 0);
  }

  /**
   * @return each revision of the articles keyed by its contributor
   */
  public static Stream<Map.Entry<String, Revision>> partitionByContributor(Stream<Article> articles) {
    return articles.flatMap(article -> article.contributorsAndRevisions().stream());
  }

  /**
   * Full outer join of the revisions of two corpora on the exact contributor name.
   *
   * @return for each contributor of any of the two corpora its revisions in the first and in the second corpus
   */
  public static SortedMap<String, ContributorCoGroup> cogroupByContributor(Stream<Article> first, Stream<Article> second) {
    Map<String, List<Revision>> firstRevisions = revisionsByContributor(first);
    Map<String, List<Revision>> secondRevisions = revisionsByContributor(second);

    SortedMap<String, ContributorCoGroup> result = new TreeMap<>();
    for (String contributor : Sets.union(firstRevisions.keySet(), secondRevisions.keySet())) {
      result.put(contributor, new ContributorCoGroup(
              firstRevisions.getOrDefault(contributor, Collections.emptyList()),
              secondRevisions.getOrDefault(contributor, Collections.emptyList())
      ));
    }
    return result;
  }

  private static Map<String, List<Revision>> revisionsByContributor(Stream<Article> articles) {
    return partitionByContributor(articles)
            .collect(Collectors.groupingBy(Map.Entry::getKey, Collectors.mapping(Map.Entry::getValue, Collectors.toList())));
  }

  /**
   * @return the entries of the cogroup for which predicate holds on both the first and the second revisions
   */
  public static SortedMap<String, ContributorCoGroup> filterCogroup(
          Map<String, ContributorCoGroup> cogroup, Predicate<? super Collection<Revision>> predicate
  ) {
    SortedMap<String, ContributorCoGroup> result = new TreeMap<>();
    cogroup.forEach((contributor, group) -> {
      if (predicate.test(group.getFirst()) && predicate.test(group.getSecond())) {
        result.put(contributor, group);
      }
    });
    return result;
  }
}
