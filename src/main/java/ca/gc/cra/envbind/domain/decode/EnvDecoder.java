package ca.gc.cra.envbind.domain.decode;

/**
 * Implemented by field types that decode themselves from the raw environment string.
 *
 * <p>Takes precedence over every built-in conversion: a type implementing this interface is always
 * decoded through {@link #decode(String)}, even when the value would also satisfy a primitive
 * conversion. Implementations need a no-argument constructor.</p>
 *
 * @since 0.1.0
 */
public interface EnvDecoder {
  /**
   * Populates this instance from the raw value.
   *
   * @param value raw string, possibly empty
   * @throws Exception when the value is not acceptable
   */
  void decode(String value) throws Exception;
}
