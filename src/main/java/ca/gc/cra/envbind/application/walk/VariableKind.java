package ca.gc.cra.envbind.application.walk;

/**
 * How the binder treats a gathered variable.
 *
 * @since 0.1.0
 */
public enum VariableKind {
  /** Resolved, converted and written. */
  VALUE,
  /** List of nested objects expanded from indexed keys; its elements contribute their own variables. */
  INDEXED_LIST,
  /** Resolved for presence only; the binder has no conversion for the field type. */
  OPAQUE
}
