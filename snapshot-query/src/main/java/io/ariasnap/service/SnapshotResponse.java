package io.ariasnap.service;

import io.ariasnap.format.OutputFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of {@link SnapshotQueryService#execute}.
 *
 * <p>{@code snapshot} holds the formatted page and is {@code null} in silent mode or when the
 * request failed before a page could be built. A failed query still carries the cache key.
 */
public record SnapshotResponse(
    boolean success,
    String url,
    String cacheKey,
    int totalItems,
    int offset,
    int limit,
    boolean hasMore,
    String queryApplied,
    OutputFormat outputFormat,
    String snapshot,
    String error) {

  static SnapshotResponse failure(
      String url, String cacheKey, int offset, int limit, OutputFormat format, String error) {
    return new SnapshotResponse(
        false, url, cacheKey, 0, offset, limit, false, null, format, null, error);
  }

  /** Fields in wire order; absent optional fields are left out rather than written as null. */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("success", success);
    if (url != null) {
      map.put("url", url);
    }
    if (cacheKey != null) {
      map.put("cache_key", cacheKey);
    }
    map.put("total_items", totalItems);
    map.put("offset", offset);
    map.put("limit", limit);
    map.put("has_more", hasMore);
    if (queryApplied != null) {
      map.put("query_applied", queryApplied);
    }
    map.put("output_format", outputFormat.id());
    if (snapshot != null) {
      map.put("snapshot", snapshot);
    }
    if (error != null) {
      map.put("error", error);
    }
    return map;
  }
}
