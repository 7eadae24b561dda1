package io.ariasnap.service;

import io.ariasnap.cache.CacheEntry;
import io.ariasnap.cache.SnapshotCache;
import io.ariasnap.config.SnapshotConfig;
import io.ariasnap.flatten.SnapshotFlattener;
import io.ariasnap.format.OutputFormat;
import io.ariasnap.format.OutputFormatter;
import io.ariasnap.paging.Page;
import io.ariasnap.paging.Paginator;
import io.ariasnap.parser.AriaSnapshotParser;
import io.ariasnap.parser.AriaSnapshotSerializer;
import io.ariasnap.parser.ParseResult;
import io.ariasnap.query.QueryEngine;
import io.ariasnap.query.QueryResult;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a snapshot request end to end: parse and cache (or look up the cache), flatten, query,
 * paginate and format.
 *
 * <p>Caller mistakes and bad input come back as a failed {@link SnapshotResponse}; this method does
 * not throw for them. The service holds no state of its own beyond the shared cache.
 */
public final class SnapshotQueryService {

  private static final Logger LOG = LoggerFactory.getLogger(SnapshotQueryService.class);

  private final SnapshotCache cache;
  private final QueryEngine queryEngine;
  private final SnapshotConfig config;

  public SnapshotQueryService(SnapshotCache cache, QueryEngine queryEngine, SnapshotConfig config) {
    this.cache = Objects.requireNonNull(cache, "cache");
    this.queryEngine = Objects.requireNonNull(queryEngine, "queryEngine");
    this.config = Objects.requireNonNull(config, "config");
  }

  public SnapshotCache cache() {
    return cache;
  }

  public SnapshotResponse execute(SnapshotRequest request) {
    Objects.requireNonNull(request, "request");
    int limit = request.limit() != null ? request.limit() : config.defaultLimit();
    int offset = request.offset();
    OutputFormat format = request.format() != null ? request.format() : config.defaultFormat();

    if (limit < 1 || limit > config.maxLimit()) {
      return SnapshotResponse.failure(
          request.sourceUrl(),
          request.cacheKey(),
          offset,
          limit,
          format,
          "limit must be between 1 and " + config.maxLimit() + ": " + limit);
    }
    if (offset < 0) {
      return SnapshotResponse.failure(
          request.sourceUrl(),
          request.cacheKey(),
          offset,
          limit,
          format,
          "offset must not be negative: " + offset);
    }

    String url;
    String key;
    Object data;
    if (request.cacheKey() != null) {
      key = request.cacheKey();
      Optional<CacheEntry> entry = cache.get(key);
      if (entry.isEmpty()) {
        LOG.debug("No cached snapshot for {}", key);
        return SnapshotResponse.failure(
            request.sourceUrl(),
            null,
            offset,
            limit,
            format,
            "Cache key not found or expired: " + key);
      }
      url = entry.get().sourceUrl();
      data = entry.get().snapshot();
    } else if (request.rawSnapshot() != null) {
      url = request.sourceUrl();
      ParseResult parsed = AriaSnapshotParser.parse(request.rawSnapshot());
      if (parsed.hasErrors()) {
        LOG.debug("Snapshot from {} has {} parse errors", url, parsed.errors().size());
        return SnapshotResponse.failure(
            url, null, offset, limit, format, String.join("; ", parsed.errorMessages()));
      }
      data = parsed.tree() == null ? List.of() : AriaSnapshotSerializer.toData(parsed.tree());
      key = cache.create(url, data);
    } else {
      return SnapshotResponse.failure(
          request.sourceUrl(),
          null,
          offset,
          limit,
          format,
          "Either a cache key or a raw snapshot is required");
    }

    Object result = request.flatten() ? SnapshotFlattener.flatten(data) : data;
    String error = null;
    if (request.hasQuery()) {
      QueryResult queried = queryEngine.evaluate(result, request.query());
      error = queried.error();
      result = queried.effectiveValue();
    }

    Page page = Paginator.paginate(result, offset, limit);
    String snapshot = request.silent() ? null : OutputFormatter.format(page.items(), format);
    LOG.debug(
        "Served {} of {} items for {} (offset {}, limit {})",
        page.items().size(),
        page.totalItems(),
        key,
        offset,
        limit);
    return new SnapshotResponse(
        error == null,
        url,
        key,
        page.totalItems(),
        offset,
        limit,
        page.hasMore(),
        request.hasQuery() ? request.query() : null,
        format,
        snapshot,
        error);
  }
}
