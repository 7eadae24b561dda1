package io.ariasnap.format;

import java.util.Locale;

public enum OutputFormat {
  JSON,
  YAML;

  /** Case-insensitive; anything other than {@code json}, including {@code null}, means YAML. */
  public static OutputFormat parse(String value) {
    return value != null && value.strip().toLowerCase(Locale.ROOT).equals("json") ? JSON : YAML;
  }

  public String id() {
    return name().toLowerCase(Locale.ROOT);
  }
}
