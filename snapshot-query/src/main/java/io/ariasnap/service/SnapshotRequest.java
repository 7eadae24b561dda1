package io.ariasnap.service;

import io.ariasnap.format.OutputFormat;

/**
 * A request to parse (or re-read from cache), filter and page a snapshot.
 *
 * <p>Exactly one source is used: {@code cacheKey} when set, otherwise {@code rawSnapshot}. {@code
 * limit} and {@code format} fall back to the service configuration when {@code null}.
 */
public record SnapshotRequest(
    String sourceUrl,
    String rawSnapshot,
    String cacheKey,
    String query,
    boolean flatten,
    Integer limit,
    int offset,
    OutputFormat format,
    boolean silent) {

  public static Builder fresh(String sourceUrl, String rawSnapshot) {
    return new Builder().sourceUrl(sourceUrl).rawSnapshot(rawSnapshot);
  }

  public static Builder cached(String cacheKey) {
    return new Builder().cacheKey(cacheKey);
  }

  public boolean hasQuery() {
    return query != null && !query.isBlank();
  }

  public static final class Builder {
    private String sourceUrl;
    private String rawSnapshot;
    private String cacheKey;
    private String query;
    private boolean flatten;
    private Integer limit;
    private int offset;
    private OutputFormat format;
    private boolean silent;

    private Builder() {}

    public Builder sourceUrl(String sourceUrl) {
      this.sourceUrl = sourceUrl;
      return this;
    }

    public Builder rawSnapshot(String rawSnapshot) {
      this.rawSnapshot = rawSnapshot;
      return this;
    }

    public Builder cacheKey(String cacheKey) {
      this.cacheKey = cacheKey;
      return this;
    }

    public Builder query(String query) {
      this.query = query;
      return this;
    }

    public Builder flatten(boolean flatten) {
      this.flatten = flatten;
      return this;
    }

    public Builder limit(Integer limit) {
      this.limit = limit;
      return this;
    }

    public Builder offset(int offset) {
      this.offset = offset;
      return this;
    }

    public Builder format(OutputFormat format) {
      this.format = format;
      return this;
    }

    public Builder silent(boolean silent) {
      this.silent = silent;
      return this;
    }

    public SnapshotRequest build() {
      return new SnapshotRequest(
          sourceUrl, rawSnapshot, cacheKey, query, flatten, limit, offset, format, silent);
    }
  }
}
