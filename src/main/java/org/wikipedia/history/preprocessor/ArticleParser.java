package org.wikipedia.history.preprocessor;

import org.wikipedia.history.model.Article;
import org.wikipedia.history.model.Revision;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Converts a {@code <page>...</page>} block of a MediaWiki history dump into an {@link Article}.
 */
public final class ArticleParser {

  private static final long MISSING_ID = -1;

  private ArticleParser() {
  }

  /**
   * @throws RecordParseException if an id or a timestamp is present but invalid, or if a revision has no timestamp
   */
  public static Article parse(String block) {
    String pageHeader = pageHeader(block);
    String title = TagExtractor.extractText(pageHeader, "title");
    long id = parseId(TagExtractor.extractText(pageHeader, "id"), "id", block);

    List<Revision> revisions = TagExtractor.extractAll(block, "revision")
            .map(revision -> parseRevision(revision, block))
            .collect(Collectors.toList());
    return new Article(id, title, revisions);
  }

  /**
   * Page level fields are read outside of the revisions that also contain {@code <id>} elements.
   * An unterminated revision, as found at the end of a truncated dump, is cut off with all the text after it.
   */
  private static String pageHeader(String block) {
    String header = TagExtractor.removeAll(block, "revision");
    int unterminated = TagExtractor.indexOfOpeningTag(header, "revision", 0);
    return (unterminated < 0) ? header : header.substring(0, unterminated);
  }

  private static Revision parseRevision(String revision, String block) {
    String contributor = TagExtractor.extractText(revision, "username");
    if (contributor.isEmpty()) {
      contributor = TagExtractor.extractText(revision, "ip");
    }
    long id = parseId(TagExtractor.extractText(TagExtractor.removeAll(revision, "contributor"), "id"), "revision.id", block);
    Instant timestamp = parseTimestamp(TagExtractor.extractText(revision, "timestamp"), block);
    return new Revision(id, contributor, timestamp);
  }

  private static long parseId(String text, String field, String block) {
    String value = text.trim();
    if (value.isEmpty()) {
      return MISSING_ID;
    }
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      throw new RecordParseException(field, value, block, e);
    }
  }

  private static Instant parseTimestamp(String text, String block) {
    String value = text.trim();
    try {
      return Instant.parse(value);
    } catch (DateTimeParseException e) {
      throw new RecordParseException("revision.timestamp", value, block, e);
    }
  }
}
