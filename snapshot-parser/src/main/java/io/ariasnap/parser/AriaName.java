package io.ariasnap.parser;

import java.util.Objects;

/**
 * Accessible name of a node.
 *
 * @param value the verbatim content between the delimiters, no escape processing applied
 * @param regex {@code true} when the name was written as {@code /pattern/}
 */
public record AriaName(String value, boolean regex) {
  public AriaName {
    Objects.requireNonNull(value, "value");
  }

  public static AriaName literal(String value) {
    return new AriaName(value, false);
  }

  public static AriaName pattern(String value) {
    return new AriaName(value, true);
  }
}
