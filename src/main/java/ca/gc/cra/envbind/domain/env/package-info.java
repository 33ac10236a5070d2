/**
 * Immutable environment view captured at the start of a binding pass.
 *
 * @since 0.1.0
 */
package ca.gc.cra.envbind.domain.env;
