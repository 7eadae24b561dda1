package io.ariasnap.parser;

import java.util.Objects;

/**
 * A structural problem found while parsing one snapshot line.
 *
 * @param line 1-based line number in the extracted snapshot text, or {@code null} when unknown
 * @param message what went wrong
 */
public record ParseError(Integer line, String message) {
  public ParseError {
    Objects.requireNonNull(message, "message");
  }

  @Override
  public String toString() {
    return line == null ? message : "Line " + line + ": " + message;
  }
}
