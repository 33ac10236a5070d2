package ca.gc.cra.envbind.domain.decode;

/**
 * Ad hoc decoder registered for a type the caller cannot (or does not want to) modify.
 *
 * @param <T> produced type
 * @since 0.1.0
 * @see DecoderRegistry
 */
@FunctionalInterface
public interface ValueDecoder<T> {
  /**
   * Converts the raw value.
   *
   * @param value raw string, possibly empty
   * @return decoded value; {@code null} leaves reference fields unset and is rejected for primitives
   * @throws Exception when the value is not acceptable
   */
  T decode(String value) throws Exception;
}
