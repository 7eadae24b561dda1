package io.ariasnap.paging;

import java.util.ArrayList;
import java.util.List;

public final class Paginator {

  private Paginator() {}

  /**
   * Slices a query or flatten result.
   *
   * <p>A {@code null} result counts as an empty list and any other non-list value as a one-element
   * list. An offset at or past the end yields an empty page.
   *
   * @throws IllegalArgumentException if {@code offset < 0} or {@code limit < 1}
   */
  public static Page paginate(Object result, int offset, int limit) {
    if (offset < 0) {
      throw new IllegalArgumentException("offset must not be negative: " + offset);
    }
    if (limit < 1) {
      throw new IllegalArgumentException("limit must be at least 1: " + limit);
    }
    List<?> all = asList(result);
    int total = all.size();
    int from = Math.min(offset, total);
    int to = (int) Math.min((long) offset + limit, total);
    List<Object> items = new ArrayList<>(all.subList(from, to));
    return new Page(items, total, offset, limit, (long) offset + limit < total);
  }

  private static List<?> asList(Object result) {
    if (result == null) {
      return List.of();
    }
    if (result instanceof List<?> list) {
      return list;
    }
    return List.of(result);
  }
}
