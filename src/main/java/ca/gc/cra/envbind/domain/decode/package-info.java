/**
 * <strong>Purpose:</strong> Custom decoding capabilities and the explicit decoder registry.
 * <p><strong>Precedence:</strong> registered {@link ca.gc.cra.envbind.domain.decode.ValueDecoder}, then
 * {@link ca.gc.cra.envbind.domain.decode.EnvDecoder}, {@link ca.gc.cra.envbind.domain.decode.Setter},
 * {@link ca.gc.cra.envbind.domain.decode.TextUnmarshaler} and
 * {@link ca.gc.cra.envbind.domain.decode.BinaryUnmarshaler}, all ahead of built-in conversions.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.envbind.domain.decode;
