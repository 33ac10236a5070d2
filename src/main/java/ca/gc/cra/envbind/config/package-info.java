/**
 * Command-line option aggregates.
 * <p><strong>Role:</strong> Adapter configuration validated with {@code ca.gc.cra.envbind.validation} utilities.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.envbind.config;
