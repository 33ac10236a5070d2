/**
 * <strong>Purpose:</strong> Traversal of configuration object graphs.
 * <p><strong>Role:</strong> Application service producing {@link ca.gc.cra.envbind.application.walk.VariableInfo}
 * lists consumed by binding, usage rendering and unused-key detection.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.envbind.application.walk;
