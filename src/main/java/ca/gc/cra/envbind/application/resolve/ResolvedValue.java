package ca.gc.cra.envbind.application.resolve;

import java.util.Objects;

/**
 * Value chosen for a field before conversion.
 *
 * @param value raw string, possibly empty
 * @param source where the value came from
 * @param sourceKey key that supplied the value; empty for defaults
 * @since 0.1.0
 */
public record ResolvedValue(String value, ResolutionSource source, String sourceKey) {
  public ResolvedValue {
    Objects.requireNonNull(value, "value");
    Objects.requireNonNull(source, "source");
    sourceKey = sourceKey == null ? "" : sourceKey;
  }

  /**
   * Indicates the value was read from the environment rather than a default.
   *
   * @return {@code false} for defaults
   */
  public boolean supplied() {
    return source != ResolutionSource.DEFAULT;
  }
}
