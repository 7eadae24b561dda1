package io.ariasnap.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory store of serialized snapshots with sliding expiration.
 *
 * <p>Thread-safe: every operation holds the instance lock. There is no background timer; expired
 * entries are swept on each {@link #create} and {@link #get}, so an entry may stay in memory past
 * its TTL when the cache is not touched again. A successful {@link #get} restarts the entry's TTL
 * window.
 */
public final class SnapshotCache implements AutoCloseable {

  private static final Logger LOG = LoggerFactory.getLogger(SnapshotCache.class);

  public static final Duration DEFAULT_TTL = Duration.ofSeconds(300);
  static final String KEY_PREFIX = "nav_";

  private final Duration defaultTtl;
  private final Clock clock;
  private final Map<String, Slot> entries = new LinkedHashMap<>();

  public SnapshotCache() {
    this(DEFAULT_TTL, Clock.systemUTC());
  }

  public SnapshotCache(Duration defaultTtl) {
    this(defaultTtl, Clock.systemUTC());
  }

  public SnapshotCache(Duration defaultTtl, Clock clock) {
    this.defaultTtl = requirePositive(defaultTtl);
    this.clock = Objects.requireNonNull(clock, "clock");
    LOG.info("SnapshotCache created with default TTL {}s", defaultTtl.getSeconds());
  }

  public Duration defaultTtl() {
    return defaultTtl;
  }

  /** Stores a snapshot under a fresh key using the default TTL. */
  public String create(String sourceUrl, Object snapshot) {
    return create(sourceUrl, snapshot, null);
  }

  /**
   * Stores a snapshot under a fresh key.
   *
   * @param sourceUrl the page the snapshot came from, may be {@code null}
   * @param snapshot serialized snapshot data; callers must not mutate it afterwards
   * @param ttl expiration window, or {@code null} for the default
   * @return the new key
   */
  public synchronized String create(String sourceUrl, Object snapshot, Duration ttl) {
    Duration effectiveTtl = ttl == null ? defaultTtl : requirePositive(ttl);
    Instant now = clock.instant();
    sweep(now);
    String key;
    do {
      key = KEY_PREFIX + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    } while (entries.containsKey(key));
    entries.put(key, new Slot(key, sourceUrl, snapshot, now, effectiveTtl));
    LOG.debug("Cached snapshot {} for {} (ttl {}s)", key, sourceUrl, effectiveTtl.getSeconds());
    return key;
  }

  /**
   * Looks up an entry and restarts its TTL window.
   *
   * @return the entry, or empty if the key is unknown or expired
   */
  public synchronized Optional<CacheEntry> get(String key) {
    Instant now = clock.instant();
    sweep(now);
    if (key == null) {
      return Optional.empty();
    }
    Slot slot = entries.get(key);
    if (slot == null) {
      LOG.debug("Cache miss for {}", key);
      return Optional.empty();
    }
    slot.lastAccessedAt = now;
    return Optional.of(slot.view());
  }

  /** Removes an entry; returns whether it was present. */
  public synchronized boolean delete(String key) {
    boolean removed = entries.remove(key) != null;
    if (removed) {
      LOG.debug("Deleted snapshot {}", key);
    }
    return removed;
  }

  public synchronized void clear() {
    LOG.debug("Clearing {} cached snapshots", entries.size());
    entries.clear();
  }

  /** Number of stored entries, including expired ones not yet swept. */
  public synchronized int size() {
    return entries.size();
  }

  @Override
  public void close() {
    LOG.info("Closing SnapshotCache, dropping {} snapshots", size());
    clear();
  }

  private void sweep(Instant now) {
    int removed = 0;
    Iterator<Slot> it = entries.values().iterator();
    while (it.hasNext()) {
      if (it.next().view().isExpired(now)) {
        it.remove();
        removed++;
      }
    }
    if (removed > 0) {
      LOG.debug("Swept {} expired snapshots", removed);
    }
  }

  private static Duration requirePositive(Duration ttl) {
    if (ttl == null || ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("TTL must be positive: " + ttl);
    }
    return ttl;
  }

  // Mutable holder; only touched under the cache lock
  private static final class Slot {
    final String key;
    final String sourceUrl;
    final Object snapshot;
    final Instant createdAt;
    final Duration ttl;
    Instant lastAccessedAt;

    Slot(String key, String sourceUrl, Object snapshot, Instant createdAt, Duration ttl) {
      this.key = key;
      this.sourceUrl = sourceUrl;
      this.snapshot = snapshot;
      this.createdAt = createdAt;
      this.lastAccessedAt = createdAt;
      this.ttl = ttl;
    }

    CacheEntry view() {
      return new CacheEntry(key, sourceUrl, snapshot, createdAt, lastAccessedAt, ttl);
    }
  }
}
