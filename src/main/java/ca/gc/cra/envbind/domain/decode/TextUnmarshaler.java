package ca.gc.cra.envbind.domain.decode;

/**
 * Text unmarshal capability, consulted after {@link Setter}. Receives the UTF-8 bytes of the raw
 * value.
 *
 * @since 0.1.0
 */
public interface TextUnmarshaler {
  /**
   * Populates this instance from UTF-8 encoded text.
   *
   * @param text UTF-8 bytes of the raw value; never {@code null}
   * @throws Exception when the text is not acceptable
   */
  void unmarshalText(byte[] text) throws Exception;
}
