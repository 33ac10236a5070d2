package ca.gc.cra.envbind.application.coerce;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Duration literal parsing.
 *
 * <p>Accepts a signed sequence of decimal numbers, each with an optional fraction and a unit
 * suffix, such as {@code 300ms}, {@code -1.5h} or {@code 2h45m}. Units are {@code ns},
 * {@code us} (or {@code µs}, {@code μs}), {@code ms}, {@code s}, {@code m} and {@code h}. A bare
 * {@code 0} is accepted. ISO-8601 input such as {@code PT15M} is delegated to
 * {@link Duration#parse(CharSequence)}.</p>
 *
 * @since 0.1.0
 */
public final class DurationLiterals {
  private static final Map<String, Long> UNITS = Map.of(
      "ns", 1L,
      "us", 1_000L,
      "µs", 1_000L,
      "μs", 1_000L,
      "ms", 1_000_000L,
      "s", 1_000_000_000L,
      "m", 60_000_000_000L,
      "h", 3_600_000_000_000L);
  private static final BigInteger MAX_NANOS = BigInteger.valueOf(Long.MAX_VALUE);
  private static final BigInteger MIN_NANOS = BigInteger.valueOf(Long.MIN_VALUE);

  private DurationLiterals() {}

  /**
   * Parses a duration literal.
   *
   * @param text literal
   * @return parsed duration
   * @throws IllegalArgumentException when malformed or beyond the signed 64-bit nanosecond range
   */
  public static Duration parse(String text) {
    if (text == null || text.isEmpty()) {
      throw invalid(text);
    }
    if (isIso(text)) {
      try {
        return Duration.parse(text);
      } catch (DateTimeParseException ex) {
        throw new IllegalArgumentException("invalid duration \"" + text + "\"", ex);
      }
    }
    int pos = 0;
    boolean negative = false;
    char first = text.charAt(0);
    if (first == '-' || first == '+') {
      negative = first == '-';
      pos++;
    }
    if (text.substring(pos).equals("0")) {
      return Duration.ZERO;
    }
    if (pos == text.length()) {
      throw invalid(text);
    }
    BigInteger total = BigInteger.ZERO;
    while (pos < text.length()) {
      int start = pos;
      while (pos < text.length() && isDigit(text.charAt(pos))) {
        pos++;
      }
      boolean leading = pos > start;
      boolean trailing = false;
      if (pos < text.length() && text.charAt(pos) == '.') {
        pos++;
        int fractionStart = pos;
        while (pos < text.length() && isDigit(text.charAt(pos))) {
          pos++;
        }
        trailing = pos > fractionStart;
      }
      if (!leading && !trailing) {
        throw invalid(text);
      }
      BigDecimal number = new BigDecimal(normalize(text.substring(start, pos)));
      int unitStart = pos;
      while (pos < text.length() && text.charAt(pos) != '.' && !isDigit(text.charAt(pos))) {
        pos++;
      }
      if (unitStart == pos) {
        throw new IllegalArgumentException("missing unit in duration \"" + text + "\"");
      }
      String unit = text.substring(unitStart, pos);
      Long nanosPerUnit = UNITS.get(unit);
      if (nanosPerUnit == null) {
        throw new IllegalArgumentException(
            "unknown unit \"" + unit + "\" in duration \"" + text + "\"");
      }
      total = total.add(number.multiply(BigDecimal.valueOf(nanosPerUnit))
          .setScale(0, RoundingMode.DOWN)
          .toBigInteger());
      if (total.compareTo(MAX_NANOS) > 0) {
        throw invalid(text);
      }
    }
    BigInteger signed = negative ? total.negate() : total;
    if (signed.compareTo(MIN_NANOS) < 0 || signed.compareTo(MAX_NANOS) > 0) {
      throw invalid(text);
    }
    return Duration.ofNanos(signed.longValue());
  }

  private static boolean isIso(String text) {
    int pos = text.charAt(0) == '-' || text.charAt(0) == '+' ? 1 : 0;
    return pos < text.length() && (text.charAt(pos) == 'P' || text.charAt(pos) == 'p');
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static String normalize(String number) {
    String value = number.startsWith(".") ? "0" + number : number;
    return value.endsWith(".") ? value + "0" : value;
  }

  private static IllegalArgumentException invalid(String text) {
    return new IllegalArgumentException("invalid duration \"" + text + "\"");
  }
}
