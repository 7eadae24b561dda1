package io.ariasnap.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time view of a cached snapshot.
 *
 * @param key the cache key
 * @param sourceUrl the page the snapshot was taken from, may be {@code null}
 * @param snapshot serialized snapshot data
 * @param createdAt when the entry was stored
 * @param lastAccessedAt the last successful access, which starts the current TTL window
 * @param ttl sliding expiration window
 */
public record CacheEntry(
    String key,
    String sourceUrl,
    Object snapshot,
    Instant createdAt,
    Instant lastAccessedAt,
    Duration ttl) {

  /** The entry expires once more than {@code ttl} has passed since the last access. */
  public boolean isExpired(Instant now) {
    return Duration.between(lastAccessedAt, now).compareTo(ttl) > 0;
  }

  public Instant expiresAt() {
    return lastAccessedAt.plus(ttl);
  }

  /** Metadata without the snapshot itself. */
  public Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("cache_key", key);
    if (sourceUrl != null) {
      map.put("url", sourceUrl);
    }
    map.put("created_at", createdAt.toString());
    map.put("last_accessed_at", lastAccessedAt.toString());
    map.put("ttl_seconds", ttl.getSeconds());
    return map;
  }
}
