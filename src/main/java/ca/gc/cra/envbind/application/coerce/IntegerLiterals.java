package ca.gc.cra.envbind.application.coerce;

import java.math.BigInteger;

/**
 * Integer literal parsing with automatic base detection.
 *
 * <p>Accepted forms: decimal, {@code 0x}/{@code 0X} hexadecimal, {@code 0b}/{@code 0B} binary,
 * {@code 0o}/{@code 0O} octal and legacy leading-zero octal. An underscore may separate digits, or
 * follow a base prefix.</p>
 *
 * @since 0.1.0
 */
public final class IntegerLiterals {
  private IntegerLiterals() {}

  /**
   * Parses a signed integer that must fit in {@code bits} bits.
   *
   * @param text literal
   * @param bits width between 8 and 64
   * @return parsed value
   * @throws NumberFormatException when malformed or out of range
   */
  public static long parseSigned(String text, int bits) {
    BigInteger value = parse(text);
    BigInteger max = BigInteger.ONE.shiftLeft(bits - 1).subtract(BigInteger.ONE);
    BigInteger min = BigInteger.ONE.shiftLeft(bits - 1).negate();
    if (value.compareTo(max) > 0 || value.compareTo(min) < 0) {
      throw outOfRange(text);
    }
    return value.longValue();
  }

  /**
   * Parses an unsigned integer that must fit in {@code bits} bits; the result is the two's
   * complement bit pattern, as {@link Integer#parseUnsignedInt(String)} produces.
   *
   * @param text literal without sign
   * @param bits width between 8 and 64
   * @return parsed bit pattern
   * @throws NumberFormatException when signed, malformed or out of range
   */
  public static long parseUnsigned(String text, int bits) {
    if (text != null && !text.isEmpty() && (text.charAt(0) == '-' || text.charAt(0) == '+')) {
      throw invalid(text);
    }
    BigInteger value = parse(text);
    if (value.bitLength() > bits) {
      throw outOfRange(text);
    }
    return value.longValue();
  }

  /**
   * Parses an integer of arbitrary size.
   *
   * @param text literal with optional sign
   * @return parsed value
   * @throws NumberFormatException when malformed
   */
  public static BigInteger parse(String text) {
    if (text == null || text.isEmpty()) {
      throw invalid(text);
    }
    int pos = 0;
    boolean negative = false;
    char first = text.charAt(0);
    if (first == '+' || first == '-') {
      negative = first == '-';
      pos = 1;
    }
    int radix = 10;
    boolean prefixed = false;
    if (text.length() - pos >= 2 && text.charAt(pos) == '0') {
      char marker = Character.toLowerCase(text.charAt(pos + 1));
      if (marker == 'x') {
        radix = 16;
        pos += 2;
        prefixed = true;
      } else if (marker == 'b') {
        radix = 2;
        pos += 2;
        prefixed = true;
      } else if (marker == 'o') {
        radix = 8;
        pos += 2;
        prefixed = true;
      } else {
        radix = 8;
        pos += 1;
        prefixed = true;
      }
    }
    String digits = text.substring(pos);
    if (!underscoresOk(digits, prefixed)) {
      throw invalid(text);
    }
    String clean = digits.replace("_", "");
    if (clean.isEmpty()) {
      throw invalid(text);
    }
    for (int i = 0; i < clean.length(); i++) {
      char c = clean.charAt(i);
      if (c > 0x7f || Character.digit(c, radix) < 0) {
        throw invalid(text);
      }
    }
    BigInteger value = new BigInteger(clean, radix);
    return negative ? value.negate() : value;
  }

  private static boolean underscoresOk(String digits, boolean prefixed) {
    if (digits.isEmpty()) {
      return true;
    }
    if (digits.startsWith("_") && !prefixed) {
      return false;
    }
    return !digits.endsWith("_") && !digits.contains("__");
  }

  private static NumberFormatException invalid(String text) {
    return new NumberFormatException("parsing \"" + text + "\": invalid syntax");
  }

  private static NumberFormatException outOfRange(String text) {
    return new NumberFormatException("parsing \"" + text + "\": value out of range");
  }
}
