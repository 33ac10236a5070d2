package ca.gc.cra.envbind.infrastructure.usage;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * <strong>What:</strong> Caller-supplied per-variable layout for usage output, such as
 * {@code {key}={description}\n}.
 * <p><strong>Syntax:</strong> placeholders {@code {key}}, {@code {alias}}, {@code {type}},
 * {@code {default}}, {@code {required}} and {@code {description}}; {@code {{} and {@code }}} for
 * literal braces; escapes {@code \n}, {@code \t} and {@code \\} so a template fits on one command
 * line. {@code {required}} renders {@code true} or nothing, like the table column.</p>
 * <p><strong>Thread-safety:</strong> Immutable once compiled.</p>
 *
 * @since 0.1.0
 */
public final class UsageTemplate {
  private static final Map<String, Function<UsageRow, String>> PLACEHOLDERS = placeholders();

  private final String pattern;
  private final List<Function<UsageRow, String>> parts;

  private UsageTemplate(String pattern, List<Function<UsageRow, String>> parts) {
    this.pattern = pattern;
    this.parts = List.copyOf(parts);
  }

  /**
   * Parses a template.
   *
   * @param pattern template text
   * @return compiled template
   * @throws IllegalArgumentException when the template is blank, names an unknown placeholder, leaves a
   *     placeholder unclosed, or uses an unsupported escape
   */
  public static UsageTemplate compile(String pattern) {
    if (pattern == null || pattern.isBlank()) {
      throw new IllegalArgumentException("template must not be blank");
    }
    List<Function<UsageRow, String>> parts = new ArrayList<>();
    StringBuilder literal = new StringBuilder();
    int i = 0;
    while (i < pattern.length()) {
      char c = pattern.charAt(i);
      if (c == '\\') {
        if (i + 1 >= pattern.length()) {
          throw new IllegalArgumentException("template ends with a lone backslash");
        }
        literal.append(escape(pattern.charAt(i + 1)));
        i += 2;
      } else if (c == '{' && i + 1 < pattern.length() && pattern.charAt(i + 1) == '{') {
        literal.append('{');
        i += 2;
      } else if (c == '}' && i + 1 < pattern.length() && pattern.charAt(i + 1) == '}') {
        literal.append('}');
        i += 2;
      } else if (c == '{') {
        int close = pattern.indexOf('}', i);
        if (close < 0) {
          throw new IllegalArgumentException("unclosed placeholder at offset " + i);
        }
        String name = pattern.substring(i + 1, close);
        Function<UsageRow, String> value = PLACEHOLDERS.get(name);
        if (value == null) {
          throw new IllegalArgumentException("unknown placeholder {" + name + "}; expected one of "
              + String.join(", ", PLACEHOLDERS.keySet()));
        }
        flush(literal, parts);
        parts.add(value);
        i = close + 1;
      } else {
        literal.append(c);
        i++;
      }
    }
    flush(literal, parts);
    return new UsageTemplate(pattern, parts);
  }

  /**
   * Renders one row.
   *
   * @param row variable to document
   * @return rendered text
   */
  public String render(UsageRow row) {
    Objects.requireNonNull(row, "row");
    StringBuilder sb = new StringBuilder();
    for (Function<UsageRow, String> part : parts) {
      sb.append(part.apply(row));
    }
    return sb.toString();
  }

  /**
   * Renders every row in order, without header or separator.
   *
   * @param rows variables to document
   * @return concatenated output
   */
  public String render(List<UsageRow> rows) {
    StringBuilder sb = new StringBuilder();
    for (UsageRow row : rows) {
      sb.append(render(row));
    }
    return sb.toString();
  }

  /** @return template text as supplied */
  public String pattern() {
    return pattern;
  }

  private static char escape(char c) {
    return switch (c) {
      case 'n' -> '\n';
      case 't' -> '\t';
      case '\\' -> '\\';
      default -> throw new IllegalArgumentException("unsupported escape \\" + c);
    };
  }

  private static void flush(StringBuilder literal, List<Function<UsageRow, String>> parts) {
    if (literal.length() > 0) {
      String text = literal.toString();
      parts.add(row -> text);
      literal.setLength(0);
    }
  }

  private static Map<String, Function<UsageRow, String>> placeholders() {
    Map<String, Function<UsageRow, String>> map = new LinkedHashMap<>();
    map.put("key", UsageRow::key);
    map.put("alias", UsageRow::alias);
    map.put("type", UsageRow::type);
    map.put("default", UsageRow::defaultValue);
    map.put("required", row -> row.required() ? "true" : "");
    map.put("description", UsageRow::description);
    return map;
  }
}
