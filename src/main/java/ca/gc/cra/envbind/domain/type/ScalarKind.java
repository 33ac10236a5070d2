package ca.gc.cra.envbind.domain.type;

/**
 * Built-in leaf conversions.
 *
 * @since 0.1.0
 */
public enum ScalarKind {
  STRING(0, false),
  CHAR(16, false),
  BOOL(1, false),
  INT8(8, false),
  INT16(16, false),
  INT32(32, false),
  INT64(64, false),
  UINT8(8, true),
  UINT16(16, true),
  UINT32(32, true),
  UINT64(64, true),
  BIG_INTEGER(0, false),
  FLOAT32(32, false),
  FLOAT64(64, false),
  BIG_DECIMAL(0, false),
  DURATION(64, false),
  BYTES(0, false),
  ENUM(0, false);

  private final int bits;
  private final boolean unsigned;

  ScalarKind(int bits, boolean unsigned) {
    this.bits = bits;
    this.unsigned = unsigned;
  }

  /**
   * Returns the storage width for fixed-width numeric kinds.
   *
   * @return width in bits, or {@code 0} when unbounded or not numeric
   */
  public int bits() {
    return bits;
  }

  /**
   * Indicates an unsigned integral kind.
   *
   * @return {@code true} for {@code UINT*}
   */
  public boolean unsigned() {
    return unsigned;
  }

  /**
   * Indicates a fixed-width integral kind, signed or unsigned.
   *
   * @return {@code true} for {@code INT*} and {@code UINT*}
   */
  public boolean integral() {
    return switch (this) {
      case INT8, INT16, INT32, INT64, UINT8, UINT16, UINT32, UINT64 -> true;
      default -> false;
    };
  }
}
