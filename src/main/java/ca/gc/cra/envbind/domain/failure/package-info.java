/**
 * <strong>Purpose:</strong> Checked failures terminating a binding pass.
 * <p><strong>Role:</strong> Domain error taxonomy; every operation of the {@code EnvConfig} facade either
 * completes or throws exactly one {@link ca.gc.cra.envbind.domain.failure.EnvConfigException}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.envbind.domain.failure;
