package ca.gc.cra.envbind.infrastructure.usage;

import java.util.Locale;

/**
 * Output layouts for usage documentation.
 *
 * @since 0.1.0
 */
public enum UsageFormat {
  /** Aligned columns, one variable per line. */
  TABLE,
  /** One block of labelled lines per variable. */
  LIST,
  /** JSON array of variable objects. */
  JSON,
  /** Caller-supplied {@link UsageTemplate} applied to each variable. */
  CUSTOM;

  /**
   * Parses a format name, ignoring case and surrounding whitespace.
   *
   * @param value format name; blank selects {@link #TABLE}
   * @return parsed format
   * @throws IllegalArgumentException for unknown names
   */
  public static UsageFormat fromString(String value) {
    if (value == null || value.isBlank()) {
      return TABLE;
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT);
    for (UsageFormat format : values()) {
      if (format.name().equals(normalized)) {
        return format;
      }
    }
    throw new IllegalArgumentException("format must be one of table, list, json, custom; got " + value);
  }
}
