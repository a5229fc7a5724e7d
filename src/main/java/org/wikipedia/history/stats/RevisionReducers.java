package org.wikipedia.history.stats;

import org.wikipedia.history.model.Revision;

import java.util.Collection;
import java.util.function.ToIntFunction;

/**
 * Reducers of bags of revisions to use with {@link ArticleStatistics#lookupPerYear}.
 */
public final class RevisionReducers {

  private RevisionReducers() {
  }

  public static ToIntFunction<Collection<Revision>> revisionCount() {
    return Collection::size;
  }

  public static ToIntFunction<Collection<Revision>> distinctContributors() {
    return revisions -> (int) revisions.stream().map(Revision::getContributor).distinct().count();
  }
}
