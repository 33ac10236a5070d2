package ca.gc.cra.envbind.domain.env;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable copy of every key/value pair visible to one binding pass.
 *
 * <p>Captured once per call so that every lookup, index scan and unused-key check sees the same
 * environment, even when the underlying source changes concurrently.</p>
 *
 * @since 0.1.0
 */
public final class EnvironmentSnapshot {
  private static final EnvironmentSnapshot EMPTY = new EnvironmentSnapshot(Map.of());

  private final Map<String, String> values;

  private EnvironmentSnapshot(Map<String, String> values) {
    this.values = values;
  }

  /**
   * Builds a snapshot from a map; {@code null} values are dropped.
   *
   * @param values key/value pairs
   * @return immutable snapshot
   */
  public static EnvironmentSnapshot of(Map<String, String> values) {
    Objects.requireNonNull(values, "values");
    Map<String, String> copy = new LinkedHashMap<>();
    values.forEach((key, value) -> {
      if (key != null && value != null) {
        copy.put(key, value);
      }
    });
    return new EnvironmentSnapshot(Collections.unmodifiableMap(copy));
  }

  /**
   * Returns a snapshot with no keys.
   *
   * @return shared empty snapshot
   */
  public static EnvironmentSnapshot empty() {
    return EMPTY;
  }

  /**
   * Looks up a key.
   *
   * @param key exact key
   * @return value when present, possibly empty
   */
  public Optional<String> lookup(String key) {
    if (key == null || key.isEmpty()) {
      return Optional.empty();
    }
    return Optional.ofNullable(values.get(key));
  }

  /**
   * Returns every captured key.
   *
   * @return unmodifiable key set
   */
  public Set<String> keys() {
    return values.keySet();
  }

  /**
   * Returns the number of captured keys.
   *
   * @return key count
   */
  public int size() {
    return values.size();
  }
}
