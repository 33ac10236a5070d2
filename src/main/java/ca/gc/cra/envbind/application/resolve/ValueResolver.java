package ca.gc.cra.envbind.application.resolve;

import ca.gc.cra.envbind.application.naming.DerivedKey;
import ca.gc.cra.envbind.domain.env.EnvironmentSnapshot;
import ca.gc.cra.envbind.domain.failure.MissingRequiredException;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Chooses the raw value of a field from the snapshot, its alias, or its default.
 * <p><strong>Role:</strong> Second step of every leaf field visit.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Canonical key first; alias key only when the canonical key is absent.</li>
 *   <li>A present but empty value counts as supplied.</li>
 *   <li>Fall back to a non-empty default, then fail for required fields or skip.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class ValueResolver {

  /**
   * Resolves the value of one field.
   *
   * @param keys canonical and alias keys
   * @param defaultValue declared default; empty means none
   * @param required whether the field must be supplied
   * @param snapshot environment view
   * @return resolved value, or empty when the field should be left untouched
   * @throws MissingRequiredException when a required field has no value and no default
   */
  public Optional<ResolvedValue> resolve(
      DerivedKey keys, String defaultValue, boolean required, EnvironmentSnapshot snapshot)
      throws MissingRequiredException {
    Objects.requireNonNull(keys, "keys");
    Objects.requireNonNull(snapshot, "snapshot");
    Optional<String> canonical = snapshot.lookup(keys.key());
    if (canonical.isPresent()) {
      return Optional.of(new ResolvedValue(canonical.get(), ResolutionSource.ENVIRONMENT, keys.key()));
    }
    if (keys.hasAlias()) {
      Optional<String> alias = snapshot.lookup(keys.aliasKey());
      if (alias.isPresent()) {
        return Optional.of(new ResolvedValue(alias.get(), ResolutionSource.ALIAS, keys.aliasKey()));
      }
    }
    if (defaultValue != null && !defaultValue.isEmpty()) {
      return Optional.of(new ResolvedValue(defaultValue, ResolutionSource.DEFAULT, ""));
    }
    if (required) {
      throw new MissingRequiredException(keys.reportedKey());
    }
    return Optional.empty();
  }
}
