package ca.gc.cra.envbind.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validation utilities for strings supplied on the {@code envbind} command line.
 * <p><strong>Role:</strong> Support utilities invoked by {@link ca.gc.cra.envbind.config.InspectConfig} before any
 * class is loaded or file opened.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject blank or control-character inputs.</li>
 *   <li>Check binary class names and environment key prefixes against their character sets.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No logs; violations raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 * @see Paths
 */
public final class Strings {
  private static final Pattern CLASS_NAME_PATTERN =
      Pattern.compile("^[A-Za-z_$][A-Za-z0-9_$]*(\\.[A-Za-z_$][A-Za-z0-9_$]*)*$");
  private static final Pattern PREFIX_PATTERN = Pattern.compile("^[A-Za-z0-9_]*$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates a binary class name such as {@code com.example.AppConfig$Db}.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate class name
   * @return trimmed class name
   * @throws IllegalArgumentException if blank or not a well-formed class name
   */
  public static String requireClassName(String name, String value) {
    String sanitized = requireNonBlank(name, value);
    if (!CLASS_NAME_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name, "must be a fully qualified class name"));
    }
    return sanitized;
  }

  /**
   * Validates an environment key prefix; {@code null} and blank mean no prefix.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate prefix
   * @return trimmed prefix, possibly empty
   * @throws IllegalArgumentException if the prefix holds characters other than letters, digits or underscore
   */
  public static String sanitizePrefix(String name, String value) {
    if (value == null) {
      return "";
    }
    String trimmed = value.trim();
    if (!PREFIX_PATTERN.matcher(trimmed).matches()) {
      throw new IllegalArgumentException(message(name,
          "must only contain letters, digits, or underscore"));
    }
    return trimmed;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
