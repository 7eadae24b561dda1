package io.ariasnap.config;

import io.ariasnap.format.OutputFormat;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Settings for snapshot caching, paging and output.
 *
 * <p>Values come from {@link #defaults()}, optionally a properties file ({@link #load(Path)}), and
 * finally the {@code aria.snapshot.*} system properties ({@link #withSystemOverrides()}).
 *
 * @param defaultTtl sliding expiration window for cached snapshots
 * @param defaultLimit page size when a request does not give one
 * @param maxLimit largest page size a request may ask for
 * @param defaultFormat output format when a request does not give one
 */
public record SnapshotConfig(
    Duration defaultTtl, int defaultLimit, int maxLimit, OutputFormat defaultFormat) {

  public static final String TTL_PROPERTY = "aria.snapshot.ttl";
  public static final String LIMIT_PROPERTY = "aria.snapshot.limit";
  public static final String MAX_LIMIT_PROPERTY = "aria.snapshot.maxLimit";
  public static final String FORMAT_PROPERTY = "aria.snapshot.format";

  public SnapshotConfig {
    Objects.requireNonNull(defaultTtl, "defaultTtl");
    Objects.requireNonNull(defaultFormat, "defaultFormat");
    if (defaultTtl.isNegative() || defaultTtl.isZero()) {
      throw new IllegalArgumentException("defaultTtl must be positive: " + defaultTtl);
    }
    if (maxLimit < 1) {
      throw new IllegalArgumentException("maxLimit must be at least 1: " + maxLimit);
    }
    if (defaultLimit < 1 || defaultLimit > maxLimit) {
      throw new IllegalArgumentException(
          "defaultLimit must be between 1 and " + maxLimit + ": " + defaultLimit);
    }
  }

  public static SnapshotConfig defaults() {
    return new SnapshotConfig(
        Duration.ofSeconds(300), // 5 minutes
        1000,
        10000,
        OutputFormat.YAML);
  }

  /**
   * Loads configuration from a properties file with the keys {@code ttlSeconds}, {@code
   * defaultLimit}, {@code maxLimit} and {@code format}. Missing keys keep their defaults.
   *
   * @return loaded configuration, or defaults if the file doesn't exist
   * @throws IOException if the file exists but cannot be read
   */
  public static SnapshotConfig load(Path file) throws IOException {
    if (!Files.exists(file)) {
      return defaults();
    }
    Properties props = new Properties();
    try (var reader = Files.newBufferedReader(file)) {
      props.load(reader);
    }
    return fromProperties(props);
  }

  public static SnapshotConfig fromProperties(Properties props) {
    SnapshotConfig d = defaults();
    long ttlSeconds = parseLong(props, "ttlSeconds", d.defaultTtl().getSeconds());
    int maxLimit = parseInt(props, "maxLimit", d.maxLimit());
    int defaultLimit = parseInt(props, "defaultLimit", Math.min(d.defaultLimit(), maxLimit));
    String format = props.getProperty("format");
    return new SnapshotConfig(
        Duration.ofSeconds(ttlSeconds),
        defaultLimit,
        maxLimit,
        format == null ? d.defaultFormat() : OutputFormat.parse(format));
  }

  /** Applies the {@code aria.snapshot.*} system properties on top of this configuration. */
  public SnapshotConfig withSystemOverrides() {
    Long ttl = Long.getLong(TTL_PROPERTY);
    int max = Integer.getInteger(MAX_LIMIT_PROPERTY, maxLimit);
    int limit = Integer.getInteger(LIMIT_PROPERTY, Math.min(defaultLimit, max));
    String format = System.getProperty(FORMAT_PROPERTY);
    return new SnapshotConfig(
        ttl == null ? defaultTtl : Duration.ofSeconds(ttl),
        limit,
        max,
        format == null ? defaultFormat : OutputFormat.parse(format));
  }

  private static int parseInt(Properties props, String key, int fallback) {
    long value = parseLong(props, key, fallback);
    try {
      return Math.toIntExact(value);
    } catch (ArithmeticException e) {
      throw new IllegalArgumentException("Value for '" + key + "' is out of range: " + value, e);
    }
  }

  private static long parseLong(Properties props, String key, long fallback) {
    String value = props.getProperty(key);
    if (value == null || value.isBlank()) {
      return fallback;
    }
    try {
      return Long.parseLong(value.strip());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid value for '" + key + "': " + value, e);
    }
  }
}
