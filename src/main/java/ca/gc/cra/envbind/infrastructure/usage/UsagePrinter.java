package ca.gc.cra.envbind.infrastructure.usage;

import ca.gc.cra.envbind.application.walk.VariableInfo;
import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Renders usage documentation for gathered variables.
 * <p><strong>Role:</strong> Presentation adapter behind the {@code usage} command.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Table layout with columns padded to the widest cell plus four spaces.</li>
 *   <li>List layout with one labelled block per variable.</li>
 *   <li>JSON layout through {@link JsonCatalogWriter}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe to share.</p>
 *
 * @since 0.1.0
 */
public final class UsagePrinter {
  static final String HEADER = """
      This application is configured via the environment. The following environment
      variables can be used:
      """;
  private static final int PADDING = 4;
  private static final List<String> COLUMNS =
      List.of("KEY", "TYPE", "DEFAULT", "REQUIRED", "DESCRIPTION");

  private final JsonCatalogWriter jsonWriter = new JsonCatalogWriter();

  /**
   * Converts gathered variables into rows.
   *
   * @param infos gathered variables
   * @return rows in traversal order
   */
  public static List<UsageRow> rows(List<VariableInfo> infos) {
    List<UsageRow> rows = new ArrayList<>(infos.size());
    for (VariableInfo info : infos) {
      rows.add(UsageRow.from(info));
    }
    return rows;
  }

  /**
   * Writes documentation in the requested layout; the writer is flushed but not closed.
   *
   * @param rows variables to document
   * @param format layout
   * @param out destination
   * @throws IOException when writing fails
   */
  public void print(List<UsageRow> rows, UsageFormat format, Writer out) throws IOException {
    Objects.requireNonNull(rows, "rows");
    Objects.requireNonNull(format, "format");
    Objects.requireNonNull(out, "out");
    switch (format) {
      case TABLE -> out.write(table(rows));
      case LIST -> out.write(list(rows));
      case JSON -> jsonWriter.write(rows, out);
      default -> throw new IllegalArgumentException(format + " output needs a template");
    }
    out.flush();
  }

  /**
   * Writes documentation through a caller-supplied template; the writer is flushed but not closed.
   *
   * @param rows variables to document
   * @param template per-variable layout
   * @param out destination
   * @throws IOException when writing fails
   */
  public void print(List<UsageRow> rows, UsageTemplate template, Writer out) throws IOException {
    Objects.requireNonNull(rows, "rows");
    Objects.requireNonNull(template, "template");
    Objects.requireNonNull(out, "out");
    out.write(template.render(rows));
    out.flush();
  }

  /**
   * Renders the table layout.
   *
   * @param rows variables to document
   * @return rendered text ending with a newline
   */
  public String table(List<UsageRow> rows) {
    List<List<String>> lines = new ArrayList<>();
    lines.add(COLUMNS);
    for (UsageRow row : rows) {
      lines.add(List.of(
          row.key(), row.type(), row.defaultValue(), required(row), row.description()));
    }
    int[] widths = new int[COLUMNS.size() - 1];
    for (List<String> cells : lines) {
      for (int i = 0; i < widths.length; i++) {
        widths[i] = Math.max(widths[i], width(cells.get(i)));
      }
    }
    StringBuilder sb = new StringBuilder(HEADER).append('\n');
    for (List<String> cells : lines) {
      for (int i = 0; i < widths.length; i++) {
        String cell = cells.get(i);
        sb.append(cell).append(" ".repeat(widths[i] - width(cell) + PADDING));
      }
      sb.append(cells.get(widths.length)).append('\n');
    }
    return sb.toString();
  }

  /**
   * Renders the list layout.
   *
   * @param rows variables to document
   * @return rendered text ending with a newline
   */
  public String list(List<UsageRow> rows) {
    StringBuilder sb = new StringBuilder(HEADER);
    for (UsageRow row : rows) {
      sb.append('\n').append(row.key()).append('\n')
          .append("  [description] ").append(row.description()).append('\n')
          .append("  [type]        ").append(row.type()).append('\n')
          .append("  [default]     ").append(row.defaultValue()).append('\n')
          .append("  [required]    ").append(required(row));
    }
    return sb.append('\n').toString();
  }

  private static String required(UsageRow row) {
    return row.required() ? "true" : "";
  }

  private static int width(String cell) {
    return cell.codePointCount(0, cell.length());
  }
}
