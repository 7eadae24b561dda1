package io.ariasnap.query;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of a query: either a value (which may itself be {@code null}) or an error message.
 *
 * @param value the result; meaningless when {@code error} is set
 * @param error the error message, or {@code null} on success
 */
public record QueryResult(Object value, String error) {

  public static QueryResult success(Object value) {
    return new QueryResult(value, null);
  }

  public static QueryResult failure(String error) {
    if (error == null || error.isBlank()) {
      throw new IllegalArgumentException("Error message is required");
    }
    return new QueryResult(null, error);
  }

  public boolean isSuccess() {
    return error == null;
  }

  public Optional<String> errorIfPresent() {
    return Optional.ofNullable(error);
  }

  /** The value callers should continue with: the empty list when the query failed. */
  public Object effectiveValue() {
    return error != null ? List.of() : value;
  }
}
