package ca.gc.cra.envbind.application.coerce;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Floating point literal parsing: decimal, exponent, hexadecimal with a binary exponent, and the
 * case-insensitive words {@code inf}, {@code infinity} and {@code nan}.
 *
 * @since 0.1.0
 */
public final class FloatLiterals {
  private static final Pattern DECIMAL =
      Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
  private static final Pattern HEX =
      Pattern.compile("[+-]?0[xX]([0-9a-fA-F]+\\.?[0-9a-fA-F]*|\\.[0-9a-fA-F]+)[pP][+-]?\\d+");

  private FloatLiterals() {}

  /**
   * Parses a 64-bit float.
   *
   * @param text literal
   * @return parsed value
   * @throws NumberFormatException when malformed or when a finite literal overflows
   */
  public static double parseDouble(String text) {
    Double special = special(text);
    if (special != null) {
      return special;
    }
    requireSyntax(text);
    double value = Double.parseDouble(text);
    if (Double.isInfinite(value)) {
      throw new NumberFormatException("parsing \"" + text + "\": value out of range");
    }
    return value;
  }

  /**
   * Parses a 32-bit float.
   *
   * @param text literal
   * @return parsed value
   * @throws NumberFormatException when malformed or when a finite literal overflows
   */
  public static float parseFloat(String text) {
    Double special = special(text);
    if (special != null) {
      return special.floatValue();
    }
    requireSyntax(text);
    float value = Float.parseFloat(text);
    if (Float.isInfinite(value)) {
      throw new NumberFormatException("parsing \"" + text + "\": value out of range");
    }
    return value;
  }

  private static void requireSyntax(String text) {
    if (text == null || !(DECIMAL.matcher(text).matches() || HEX.matcher(text).matches())) {
      throw new NumberFormatException("parsing \"" + text + "\": invalid syntax");
    }
  }

  private static Double special(String text) {
    if (text == null) {
      return null;
    }
    String lower = text.toLowerCase(Locale.ROOT);
    if (lower.equals("nan")) {
      return Double.NaN;
    }
    boolean negative = lower.startsWith("-");
    String body = lower.startsWith("-") || lower.startsWith("+") ? lower.substring(1) : lower;
    if (body.equals("inf") || body.equals("infinity")) {
      return negative ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
    }
    return null;
  }
}
