package io.ariasnap.parser;

import java.util.Locale;
import java.util.Optional;

/** Three-valued state used by {@code checked} and {@code pressed}. */
public enum CheckedState {
  TRUE,
  FALSE,
  MIXED;

  /**
   * Parses {@code true}, {@code false} or {@code mixed}, ignoring case.
   *
   * @param text attribute value as written in the snapshot
   * @return the state, or empty when the text is outside the three-valued domain
   */
  public static Optional<CheckedState> parse(String text) {
    if (text == null) {
      return Optional.empty();
    }
    switch (text.toLowerCase(Locale.ROOT)) {
      case "true":
        return Optional.of(TRUE);
      case "false":
        return Optional.of(FALSE);
      case "mixed":
        return Optional.of(MIXED);
      default:
        return Optional.empty();
    }
  }

  /** Maps a serialized value ({@code Boolean} or the string {@code "mixed"}) back to a state. */
  public static Optional<CheckedState> fromData(Object value) {
    if (value instanceof Boolean b) {
      return Optional.of(b ? TRUE : FALSE);
    }
    if (value instanceof String s) {
      return parse(s);
    }
    return Optional.empty();
  }

  /** Plain-data form: a {@code Boolean} for true/false, the string {@code "mixed"} otherwise. */
  public Object toData() {
    return switch (this) {
      case TRUE -> Boolean.TRUE;
      case FALSE -> Boolean.FALSE;
      case MIXED -> "mixed";
    };
  }
}
