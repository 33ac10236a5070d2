package ca.gc.cra.envbind.domain.failure;

import java.util.Objects;

/**
 * Raised when a required field has no canonical value, no alias value and no default.
 *
 * @since 0.1.0
 */
public final class MissingRequiredException extends EnvConfigException {
  private static final long serialVersionUID = 1L;

  private final String key;

  /**
   * Creates an exception naming the missing key.
   *
   * @param key alias key when the field declares one, otherwise the canonical key
   */
  public MissingRequiredException(String key) {
    super("required key " + Objects.requireNonNull(key, "key") + " missing value");
    this.key = key;
  }

  /**
   * Returns the key reported as missing.
   *
   * @return missing key
   */
  public String key() {
    return key;
  }
}
