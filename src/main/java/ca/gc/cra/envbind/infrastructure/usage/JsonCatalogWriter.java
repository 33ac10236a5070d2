package ca.gc.cra.envbind.infrastructure.usage;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * Writes usage rows as a JSON array of {@code {key, alias, type, default, required, description}}
 * objects with Jackson's streaming generator. The target writer is left open.
 *
 * @since 0.1.0
 */
public final class JsonCatalogWriter {
  private final JsonFactory factory = new JsonFactory();

  /**
   * Writes the rows followed by a newline.
   *
   * @param rows variables to document
   * @param out destination; not closed
   * @throws IOException when writing fails
   */
  public void write(List<UsageRow> rows, Writer out) throws IOException {
    try (JsonGenerator gen = factory.createGenerator(out)) {
      gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
      gen.useDefaultPrettyPrinter();
      gen.writeStartArray();
      for (UsageRow row : rows) {
        gen.writeStartObject();
        gen.writeStringField("key", row.key());
        gen.writeStringField("alias", row.alias());
        gen.writeStringField("type", row.type());
        gen.writeStringField("default", row.defaultValue());
        gen.writeBooleanField("required", row.required());
        gen.writeStringField("description", row.description());
        gen.writeEndObject();
      }
      gen.writeEndArray();
    }
    out.write('\n');
  }
}
