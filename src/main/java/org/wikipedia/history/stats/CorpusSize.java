package org.wikipedia.history.stats;

import java.util.Objects;

public final class CorpusSize {

  private final long revisionCount;
  private final long articleCount;

  public CorpusSize(long revisionCount, long articleCount) {
    this.revisionCount = revisionCount;
    this.articleCount = articleCount;
  }

  public long getRevisionCount() {
    return revisionCount;
  }

  public long getArticleCount() {
    return articleCount;
  }

  CorpusSize plus(CorpusSize other) {
    return new CorpusSize(revisionCount + other.revisionCount, articleCount + other.articleCount);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof CorpusSize)) {
      return false;
    }
    CorpusSize other = (CorpusSize) o;
    return revisionCount == other.revisionCount && articleCount == other.articleCount;
  }

  @Override
  public int hashCode() {
    return Objects.hash(revisionCount, articleCount);
  }

  @Override
  public String toString() {
    return "revision num -> " + revisionCount + ", article num -> " + articleCount;
  }
}
