package org.hypertrace.core.logquery.codec;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses durations written as Go duration strings ({@code 1h30m}, {@code 1.5s}, {@code 250ms}) or
 * as plain floating point seconds.
 */
public class DurationStrings {
  private static final Pattern COMPONENT =
      Pattern.compile("(\\d+\\.?\\d*|\\.\\d+)(ns|us|µs|μs|ms|s|m|h)");

  private static final Map<String, Long> NANOS_PER_UNIT =
      Map.of(
          "ns", 1L,
          "us", 1_000L,
          "µs", 1_000L,
          "μs", 1_000L,
          "ms", 1_000_000L,
          "s", 1_000_000_000L,
          "m", 60_000_000_000L,
          "h", 3_600_000_000_000L);

  /**
   * @throws IllegalArgumentException if the value is not a Go duration string
   */
  public static Duration parseGoDuration(String value) {
    String input = value.trim();
    if (input.isEmpty()) {
      throw new IllegalArgumentException("invalid duration \"" + value + "\"");
    }
    boolean negative = false;
    if (input.charAt(0) == '-' || input.charAt(0) == '+') {
      negative = input.charAt(0) == '-';
      input = input.substring(1);
    }
    if (input.equals("0")) {
      return Duration.ZERO;
    }
    Matcher matcher = COMPONENT.matcher(input);
    BigDecimal nanos = BigDecimal.ZERO;
    int position = 0;
    while (position < input.length()) {
      if (!matcher.find(position) || matcher.start() != position) {
        throw new IllegalArgumentException("invalid duration \"" + value + "\"");
      }
      nanos =
          nanos.add(
              new BigDecimal(matcher.group(1))
                  .multiply(BigDecimal.valueOf(NANOS_PER_UNIT.get(matcher.group(2)))));
      position = matcher.end();
    }
    Duration duration = Duration.ofNanos(nanos.longValue());
    return negative ? duration.negated() : duration;
  }

  /**
   * Accepts floating point seconds first, then Go duration strings.
   *
   * @throws IllegalArgumentException if the value is neither
   */
  public static Duration parseSecondsOrDuration(String value) {
    try {
      BigDecimal seconds = new BigDecimal(value.trim());
      return Duration.ofNanos(
          seconds.movePointRight(9).setScale(0, RoundingMode.HALF_UP).longValueExact());
    } catch (NumberFormatException | ArithmeticException e) {
      try {
        return parseGoDuration(value);
      } catch (IllegalArgumentException durationError) {
        throw new IllegalArgumentException(
            String.format("cannot parse \"%s\" to a valid duration", value), durationError);
      }
    }
  }
}
