/**
 * Key derivation from field names, aliases and prefixes.
 *
 * @since 0.1.0
 */
package ca.gc.cra.envbind.application.naming;
