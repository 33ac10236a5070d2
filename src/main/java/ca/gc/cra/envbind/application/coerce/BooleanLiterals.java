package ca.gc.cra.envbind.application.coerce;

import java.util.Set;

/**
 * Boolean literal parsing.
 *
 * @since 0.1.0
 */
public final class BooleanLiterals {
  private static final Set<String> TRUE = Set.of("1", "t", "T", "TRUE", "true", "True");
  private static final Set<String> FALSE = Set.of("0", "f", "F", "FALSE", "false", "False");

  private BooleanLiterals() {}

  /**
   * Parses {@code 1 t T TRUE true True} and {@code 0 f F FALSE false False}.
   *
   * @param text literal
   * @return parsed value
   * @throws IllegalArgumentException for any other input
   */
  public static boolean parse(String text) {
    if (TRUE.contains(text)) {
      return true;
    }
    if (FALSE.contains(text)) {
      return false;
    }
    throw new IllegalArgumentException("parsing \"" + text + "\": invalid syntax");
  }
}
