package io.ariasnap.query;

/** Evaluates query expressions against plain snapshot data. Never throws for a bad expression. */
public interface QueryEngine {

  /**
   * @param data plain data: maps, lists, strings, numbers, booleans or {@code null}
   * @param expression the query expression
   * @return the result, or a descriptive error
   */
  QueryResult evaluate(Object data, String expression);
}
