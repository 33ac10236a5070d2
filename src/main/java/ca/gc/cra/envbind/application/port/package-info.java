/**
 * <strong>Purpose:</strong> Ports the binding pipeline depends on.
 * <p><strong>Role:</strong> Application boundary; infrastructure adapters implement these interfaces.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.envbind.application.port;
