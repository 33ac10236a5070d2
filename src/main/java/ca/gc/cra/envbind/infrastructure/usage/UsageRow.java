package ca.gc.cra.envbind.infrastructure.usage;

import ca.gc.cra.envbind.application.walk.VariableInfo;
import ca.gc.cra.envbind.domain.type.FieldMetadata;
import java.util.Objects;

/**
 * One documented variable.
 *
 * @param key canonical key
 * @param alias alias key, empty when none applies
 * @param type type description
 * @param defaultValue default, empty when none
 * @param required whether the variable must be supplied
 * @param description free text, possibly empty
 * @since 0.1.0
 */
public record UsageRow(
    String key, String alias, String type, String defaultValue, boolean required, String description) {
  public UsageRow {
    Objects.requireNonNull(key, "key");
    alias = alias == null ? "" : alias;
    type = type == null ? "" : type;
    defaultValue = defaultValue == null ? "" : defaultValue;
    description = description == null ? "" : description;
  }

  /**
   * Builds a row from a gathered variable.
   *
   * @param info gathered variable
   * @return usage row
   */
  public static UsageRow from(VariableInfo info) {
    FieldMetadata metadata = info.metadata();
    return new UsageRow(
        info.key(),
        info.aliasKey(),
        TypeDescriptions.describe(info.field().type()),
        metadata.defaultValue(),
        metadata.required(),
        metadata.description());
  }
}
