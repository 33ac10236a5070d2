/**
 * <strong>Purpose:</strong> Field annotations declaring how environment variables bind to configuration classes.
 * <p><strong>Role:</strong> Read once per class by {@code ca.gc.cra.envbind.domain.type.TypeCatalog}; all
 * annotations use runtime retention and target fields only.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.envbind.annotation;
