package io.ariasnap.parser;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of {@link AriaSnapshotParser#parse(String)}.
 *
 * <p>{@code tree} is {@code null} only for syntactically empty input; in every other case it holds
 * the root entries that could be parsed, possibly alongside errors for the lines that could not.
 */
public record ParseResult(List<AriaChild> tree, List<ParseError> errors) {

  private static final ParseResult EMPTY = new ParseResult(null, List.of());

  public ParseResult {
    tree = tree == null ? null : List.copyOf(tree);
    errors = List.copyOf(errors);
  }

  public static ParseResult empty() {
    return EMPTY;
  }

  public Optional<List<AriaChild>> treeIfPresent() {
    return Optional.ofNullable(tree);
  }

  public boolean hasErrors() {
    return !errors.isEmpty();
  }

  /** Errors rendered as {@code Line N: message}. */
  public List<String> errorMessages() {
    return errors.stream().map(ParseError::toString).toList();
  }
}
