package org.wikipedia.history.model;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A wikipedia page with its revisions in document order, the first one being the creation of the page.
 */
public final class Article {

  private final long id;
  private final String title;
  private final ImmutableList<Revision> revisions;

  public Article(long id, String title, List<Revision> revisions) {
    this.id = id;
    this.title = (title == null) ? "" : title;
    this.revisions = ImmutableList.copyOf(revisions);
  }

  public long getId() {
    return id;
  }

  public String getTitle() {
    return title;
  }

  public List<Revision> getRevisions() {
    return revisions;
  }

  public int revisionCount() {
    return revisions.size();
  }

  /**
   * @return the author of each revision in revision order, with duplicates
   */
  public List<String> contributors() {
    return revisions.stream().map(Revision::getContributor).collect(ImmutableList.toImmutableList());
  }

  public int distinctContributorCount() {
    return (int) revisions.stream().map(Revision::getContributor).distinct().count();
  }

  public List<Map.Entry<String, Revision>> contributorsAndRevisions() {
    return revisions.stream()
            .map(revision -> Maps.immutableEntry(revision.getContributor(), revision))
            .collect(ImmutableList.toImmutableList());
  }

  public List<Integer> revisionYears() {
    return revisions.stream().map(Revision::year).collect(ImmutableList.toImmutableList());
  }

  /**
   * @throws IllegalStateException if the article has no revision
   */
  public int creationYear() {
    if (revisions.isEmpty()) {
      throw new IllegalStateException("The article " + id + " has no revision");
    }
    return revisions.get(0).year();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Article)) {
      return false;
    }
    Article other = (Article) o;
    return id == other.id && title.equals(other.title) && revisions.equals(other.revisions);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, title, revisions);
  }

  @Override
  public String toString() {
    return id + "," + title + "\n" + revisions.stream().map(Revision::toString).collect(Collectors.joining());
  }
}
