package org.wikipedia.history.stats;

import org.wikipedia.history.model.Revision;

import java.util.Collection;
import java.util.function.Predicate;

/**
 * Predicates on bags of revisions to use with {@link ArticleStatistics#filterCogroup}.
 */
public final class RevisionPredicates {

  private RevisionPredicates() {
  }

  public static Predicate<Collection<Revision>> notEmpty() {
    return revisions -> !revisions.isEmpty();
  }

  /**
   * @return a predicate that holds if at least one of the revisions has been made during the given year
   */
  public static Predicate<Collection<Revision>> anyInYear(int year) {
    return revisions -> revisions.stream().anyMatch(revision -> revision.year() == year);
  }
}
