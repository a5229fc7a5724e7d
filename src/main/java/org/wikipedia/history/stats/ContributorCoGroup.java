package org.wikipedia.history.stats;

import com.google.common.collect.ImmutableList;
import org.wikipedia.history.model.Revision;

import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * The revisions of one contributor in two corpora. Any side may be empty.
 */
public final class ContributorCoGroup {

  private final ImmutableList<Revision> first;
  private final ImmutableList<Revision> second;

  public ContributorCoGroup(Collection<Revision> first, Collection<Revision> second) {
    this.first = ImmutableList.copyOf(first);
    this.second = ImmutableList.copyOf(second);
  }

  /**
   * @return the revisions from the first corpus
   */
  public List<Revision> getFirst() {
    return first;
  }

  /**
   * @return the revisions from the second corpus
   */
  public List<Revision> getSecond() {
    return second;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ContributorCoGroup)) {
      return false;
    }
    ContributorCoGroup other = (ContributorCoGroup) o;
    return first.equals(other.first) && second.equals(other.second);
  }

  @Override
  public int hashCode() {
    return Objects.hash(first, second);
  }

  @Override
  public String toString() {
    return "(" + first + "," + second + ")";
  }
}
