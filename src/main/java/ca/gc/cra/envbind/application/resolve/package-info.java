/**
 * Value resolution: canonical key, alias key, default, or skip.
 *
 * @since 0.1.0
 */
package ca.gc.cra.envbind.application.resolve;
