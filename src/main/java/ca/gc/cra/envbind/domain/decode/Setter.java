package ca.gc.cra.envbind.domain.decode;

/**
 * Generic set-from-string capability, consulted after {@link EnvDecoder}.
 *
 * @since 0.1.0
 */
public interface Setter {
  /**
   * Sets this instance's state from the raw value.
   *
   * @param value raw string, possibly empty
   * @throws Exception when the value is not acceptable
   */
  void set(String value) throws Exception;
}
