/**
 * Usage documentation rendering: table, list and JSON (Jackson) layouts over gathered variables.
 *
 * @since 0.1.0
 */
package ca.gc.cra.envbind.infrastructure.usage;
