package org.wikipedia.history.preprocessor;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.Streams;

import java.util.Iterator;
import java.util.stream.Stream;

/**
 * Extracts elements from a dump fragment by literal search of the opening and closing tags.
 * <p>
 * An element starts at {@code <name} followed by {@code >}, a whitespace or {@code /} and ends at the first
 * {@code </name>} after its opening tag. Nested elements with the same name are not supported.
 * Entities are not decoded.
 */
public final class TagExtractor {

  private TagExtractor() {
  }

  /**
   * @return the elements named tagName in document order, opening and closing tags included
   */
  public static Stream<String> extractAll(String text, String tagName) {
    return Streams.stream(elements(text, tagName)).map(element -> text.substring(element.start, element.end));
  }

  /**
   * @return the content of the first element named tagName or the empty string if there is none
   */
  public static String extractText(String text, String tagName) {
    Element element = find(text, tagName, 0);
    return (element == null) ? "" : text.substring(element.contentStart, element.contentEnd);
  }

  /**
   * @return text without the elements named tagName
   */
  public static String removeAll(String text, String tagName) {
    StringBuilder builder = new StringBuilder(text.length());
    int position = 0;
    Iterator<Element> iterator = elements(text, tagName);
    while (iterator.hasNext()) {
      Element element = iterator.next();
      builder.append(text, position, element.start);
      position = element.end;
    }
    return builder.append(text, position, text.length()).toString();
  }

  private static Iterator<Element> elements(String text, String tagName) {
    return new AbstractIterator<Element>() {
      private int position = 0;

      @Override
      protected Element computeNext() {
        Element element = find(text, tagName, position);
        if (element == null) {
          return endOfData();
        }
        position = element.end;
        return element;
      }
    };
  }

  /**
   * @return the position of the first opening tag named tagName, terminated or not, or -1 if there is none
   */
  static int indexOfOpeningTag(String text, String tagName, int from) {
    String openingTag = "<" + tagName;
    int position = from;
    while (true) {
      int start = text.indexOf(openingTag, position);
      if (start < 0) {
        return -1;
      }
      int afterName = start + openingTag.length();
      if (afterName >= text.length()) {
        return -1;
      }
      char next = text.charAt(afterName);
      if (next == '>' || next == '/' || Character.isWhitespace(next)) {
        return start;
      }
      position = afterName; // Longer tag name sharing the same prefix
    }
  }

  private static Element find(String text, String tagName, int from) {
    int start = indexOfOpeningTag(text, tagName, from);
    if (start < 0) {
      return null;
    }
    int openingEnd = text.indexOf('>', start + tagName.length() + 1);
    if (openingEnd < 0) {
      return null;
    }
    if (text.charAt(openingEnd - 1) == '/') {
      return new Element(start, openingEnd + 1, openingEnd + 1, openingEnd + 1);
    }
    String closingTag = "</" + tagName + ">";
    int closingStart = text.indexOf(closingTag, openingEnd + 1);
    if (closingStart < 0) {
      return null;
    }
    return new Element(start, closingStart + closingTag.length(), openingEnd + 1, closingStart);
  }

  private static final class Element {
    private final int start;
    private final int end;
    private final int contentStart;
    private final int contentEnd;

    private Element(int start, int end, int contentStart, int contentEnd) {
      this.start = start;
      this.end = end;
      this.contentStart = contentStart;
      this.contentEnd = contentEnd;
    }
  }
}
