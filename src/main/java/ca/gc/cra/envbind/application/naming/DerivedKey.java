package ca.gc.cra.envbind.application.naming;

import java.util.Objects;

/**
 * Lookup keys computed for one field.
 *
 * @param key canonical key, prefix-qualified and upper-cased
 * @param aliasKey bare upper-cased alias used as a fallback; empty when none applies
 * @since 0.1.0
 */
public record DerivedKey(String key, String aliasKey) {
  public DerivedKey {
    Objects.requireNonNull(key, "key");
    aliasKey = aliasKey == null ? "" : aliasKey;
  }

  /**
   * Indicates whether a fallback alias lookup applies.
   *
   * @return {@code true} when {@link #aliasKey()} is non-empty
   */
  public boolean hasAlias() {
    return !aliasKey.isEmpty();
  }

  /**
   * Returns the key reported when the field is required but missing.
   *
   * @return alias key when present, otherwise the canonical key
   */
  public String reportedKey() {
    return hasAlias() ? aliasKey : key;
  }
}
