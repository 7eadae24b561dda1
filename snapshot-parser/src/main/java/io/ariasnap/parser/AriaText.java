package io.ariasnap.parser;

import java.util.Objects;

/** Literal text content under a node, for example {@code - text: Search for Images}. */
public record AriaText(String text) implements AriaChild {
  public AriaText {
    Objects.requireNonNull(text, "text");
  }
}
