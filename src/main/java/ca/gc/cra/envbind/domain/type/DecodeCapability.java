package ca.gc.cra.envbind.domain.type;

/**
 * How a type decodes itself from a string, in precedence order.
 *
 * @since 0.1.0
 */
public enum DecodeCapability {
  /** {@link ca.gc.cra.envbind.domain.decode.EnvDecoder}. */
  DECODER,
  /** {@link ca.gc.cra.envbind.domain.decode.Setter}. */
  SETTER,
  /** {@link ca.gc.cra.envbind.domain.decode.TextUnmarshaler}. */
  TEXT,
  /** {@link ca.gc.cra.envbind.domain.decode.BinaryUnmarshaler}. */
  BINARY,
  /** One-string factory found by {@link ca.gc.cra.envbind.domain.decode.StringFactories}. */
  PARSE
}
