package ca.gc.cra.envbind.domain.decode;

/**
 * Binary unmarshal capability, the last self-decoding capability consulted.
 *
 * @since 0.1.0
 */
public interface BinaryUnmarshaler {
  /**
   * Populates this instance from raw bytes.
   *
   * @param data UTF-8 bytes of the raw value; never {@code null}
   * @throws Exception when the data is not acceptable
   */
  void unmarshalBinary(byte[] data) throws Exception;
}
