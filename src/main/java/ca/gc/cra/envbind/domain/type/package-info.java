/**
 * <strong>Purpose:</strong> Type descriptors for configuration classes.
 * <p><strong>Role:</strong> Domain model; {@link ca.gc.cra.envbind.domain.type.TypeCatalog} reads a class once
 * and produces {@link ca.gc.cra.envbind.domain.type.FieldDescriptor}s whose shapes belong to the sealed
 * {@link ca.gc.cra.envbind.domain.type.TypeDescriptor} hierarchy.</p>
 * <p><strong>Concurrency:</strong> Descriptors are immutable; the catalog cache is concurrent.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.envbind.domain.type;
