/**
 * Argument validation helpers raising {@link java.lang.IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.envbind.validation;
