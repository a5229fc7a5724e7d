package org.wikipedia.history.model;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;

/**
 * A single edit of an article.
 */
public final class Revision {

  /**
   * Zone used to compute the year of a revision.
   */
  public static final ZoneId REFERENCE_ZONE = ZoneOffset.UTC;

  private final long id;
  private final String contributor;
  private final Instant timestamp;

  /**
   * @param id          the revision id, -1 if unknown
   * @param contributor the user name or the IP address of the author, empty if unknown
   * @param timestamp   the time of the edit
   */
  public Revision(long id, String contributor, Instant timestamp) {
    this.id = id;
    this.contributor = (contributor == null) ? "" : contributor;
    this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
  }

  public long getId() {
    return id;
  }

  public String getContributor() {
    return contributor;
  }

  public Instant getTimestamp() {
    return timestamp;
  }

  public int year() {
    return year(REFERENCE_ZONE);
  }

  public int year(ZoneId zone) {
    return timestamp.atZone(zone).getYear();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Revision)) {
      return false;
    }
    Revision other = (Revision) o;
    return id == other.id && contributor.equals(other.contributor) && timestamp.equals(other.timestamp);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, contributor, timestamp);
  }

  @Override
  public String toString() {
    return "\t" + id + "," + contributor + "," + timestamp + "\n";
  }
}
