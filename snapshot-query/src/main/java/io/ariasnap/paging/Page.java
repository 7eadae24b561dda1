package io.ariasnap.paging;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** One contiguous slice of a result list. Items may be {@code null}. */
public record Page(List<Object> items, int totalItems, int offset, int limit, boolean hasMore) {

  public Page {
    items = Collections.unmodifiableList(new ArrayList<>(items));
  }
}
