/**
 * Logging helpers for the command line: verbosity control and message truncation.
 *
 * @since 0.1.0
 */
package ca.gc.cra.envbind.logging;
