/**
 * <strong>Purpose:</strong> String to value conversion.
 * <p><strong>Role:</strong> Application service; {@link ca.gc.cra.envbind.application.coerce.TypeCoercer}
 * dispatches over type descriptors and delegates literal syntax to the {@code *Literals} helpers.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.envbind.application.coerce;
