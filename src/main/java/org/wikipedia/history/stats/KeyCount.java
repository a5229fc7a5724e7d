package org.wikipedia.history.stats;

import java.util.Comparator;
import java.util.Objects;

/**
 * A key, like an article title or a contributor, with the number of revisions attached to it.
 */
public final class KeyCount {

  /**
   * Largest count first, ties broken by key.
   */
  public static final Comparator<KeyCount> DESCENDING = Comparator.comparingLong(KeyCount::getCount).reversed()
          .thenComparing(KeyCount::getKey);

  private final String key;
  private final long count;

  public KeyCount(String key, long count) {
    this.key = key;
    this.count = count;
  }

  public String getKey() {
    return key;
  }

  public long getCount() {
    return count;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof KeyCount)) {
      return false;
    }
    KeyCount other = (KeyCount) o;
    return count == other.count && key.equals(other.key);
  }

  @Override
  public int hashCode() {
    return Objects.hash(key, count);
  }

  @Override
  public String toString() {
    return "(" + key + "," + count + ")";
  }
}
