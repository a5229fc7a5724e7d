package org.wikipedia.history.preprocessor;

/**
 * Thrown when a field of a dump block is present but can not be parsed.
 */
public class RecordParseException extends RuntimeException {

  private static final int MAX_BLOCK_LENGTH_IN_MESSAGE = 200;

  private final String field;
  private final String block;

  RecordParseException(String field, String value, String block, Throwable cause) {
    super("Invalid value '" + value + "' for field " + field + " in block: " + abbreviate(block), cause);
    this.field = field;
    this.block = block;
  }

  /**
   * @return the name of the field that failed to parse, like "revision.timestamp"
   */
  public String getField() {
    return field;
  }

  /**
   * @return the raw text of the block
   */
  public String getBlock() {
    return block;
  }

  private static String abbreviate(String block) {
    return (block.length() > MAX_BLOCK_LENGTH_IN_MESSAGE) ? block.substring(0, MAX_BLOCK_LENGTH_IN_MESSAGE) + "..." : block;
  }
}
