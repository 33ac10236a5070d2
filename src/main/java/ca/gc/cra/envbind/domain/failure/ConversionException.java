package ca.gc.cra.envbind.domain.failure;

/**
 * <strong>What:</strong> Raised when a resolved string cannot be converted to the type of its field.
 * <p><strong>Why:</strong> Carries everything an operator needs to fix the variable: the key that was read,
 * the field it targets, the expected type and the offending raw value.</p>
 * <p><strong>Observability:</strong> The message embeds the raw value; callers logging it for secrets should
 * truncate or redact first.</p>
 *
 * @since 0.1.0
 */
public final class ConversionException extends EnvConfigException {
  private static final long serialVersionUID = 1L;

  private final String keyName;
  private final String fieldName;
  private final String typeName;
  private final String value;

  /**
   * Creates a conversion failure.
   *
   * @param keyName environment key that supplied the value
   * @param fieldName name of the target field
   * @param typeName display name of the target type
   * @param value raw value that failed to convert
   * @param cause underlying conversion error
   */
  public ConversionException(
      String keyName, String fieldName, String typeName, String value, Throwable cause) {
    super(
        "assigning " + keyName + " to " + fieldName + ": converting '" + value + "' to type "
            + typeName + ". details: " + (cause == null ? "unknown" : cause.getMessage()),
        cause);
    this.keyName = keyName;
    this.fieldName = fieldName;
    this.typeName = typeName;
    this.value = value;
  }

  /** @return environment key that supplied the value */
  public String keyName() {
    return keyName;
  }

  /** @return name of the target field */
  public String fieldName() {
    return fieldName;
  }

  /** @return display name of the target type */
  public String typeName() {
    return typeName;
  }

  /** @return raw value that failed to convert */
  public String value() {
    return value;
  }
}
