package com.scholary.scribe.document;

/**
 * Thrown when structured text cannot be parsed into an {@link Outline}.
 *
 * <p>Block-level problems (such as a ragged table) are fatal for the whole document. Inline
 * problems never raise this; unmatched delimiters are kept as literal text.
 */
public class MalformedOutlineException extends RuntimeException {

  private final int lineNumber;

  public MalformedOutlineException(String message, int lineNumber) {
    super(String.format("Line %d: %s", lineNumber, message));
    this.lineNumber = lineNumber;
  }

  /** One-based line number of the offending input line. */
  public int getLineNumber() {
    return lineNumber;
  }
}
