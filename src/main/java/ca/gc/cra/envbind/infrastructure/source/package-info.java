/**
 * <strong>Purpose:</strong> {@link ca.gc.cra.envbind.application.port.EnvironmentSource} adapters.
 * <p><strong>Role:</strong> Infrastructure; process environment, in-memory maps, {@code KEY=VALUE} files, YAML
 * documents (SnakeYAML) and layered combinations of these.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.envbind.infrastructure.source;
