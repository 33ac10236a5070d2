/**
 * <strong>Purpose:</strong> Binding entry points.
 * <p><strong>Role:</strong> Application facade; {@link ca.gc.cra.envbind.application.pipeline.EnvConfig}
 * runs one synchronous pass over a snapshot of an environment source.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.envbind.application.pipeline;
