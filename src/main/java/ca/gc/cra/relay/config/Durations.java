package ca.gc.cra.relay.config;

import java.time.Duration;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses collector-style durations such as {@code 200ms}, {@code 5s}, {@code 1m30s} or {@code 1h}.
 * A bare integer is read as milliseconds.
 */
public final class Durations {
  private static final Pattern PART = Pattern.compile("(\\d+(?:\\.\\d+)?)(ns|us|µs|ms|s|m|h)");

  private Durations() {
    // Utility
  }

  /**
   * Parses a duration.
   *
   * @param raw configured text
   * @param location configuration path for error messages
   * @return parsed duration
   * @throws ConfigException if the value is blank, malformed or negative
   */
  public static Duration parse(String raw, String location) {
    if (raw == null || raw.isBlank()) {
      throw new ConfigException(location + " must be a duration such as 5s or 200ms");
    }
    String text = raw.trim().toLowerCase(Locale.ROOT);
    if (text.chars().allMatch(Character::isDigit)) {
      return Duration.ofMillis(Long.parseLong(text));
    }
    Matcher matcher = PART.matcher(text);
    int position = 0;
    double nanos = 0d;
    while (matcher.find() && matcher.start() == position) {
      nanos += Double.parseDouble(matcher.group(1)) * unitNanos(matcher.group(2));
      position = matcher.end();
    }
    if (position == 0 || position != text.length()) {
      throw new ConfigException(location + " has invalid duration '" + raw + "'");
    }
    return Duration.ofNanos((long) nanos);
  }

  /**
   * Renders a duration in the same notation {@link #parse(String, String)} accepts.
   *
   * @param duration duration to render
   * @return compact text such as {@code 200ms} or {@code 5s}
   */
  public static String format(Duration duration) {
    long millis = duration.toMillis();
    if (millis % 1000 == 0 && millis > 0) {
      return (millis / 1000) + "s";
    }
    return millis + "ms";
  }

  private static double unitNanos(String unit) {
    return switch (unit) {
      case "ns" -> 1d;
      case "us", "µs" -> 1_000d;
      case "ms" -> 1_000_000d;
      case "s" -> 1_000_000_000d;
      case "m" -> 60d * 1_000_000_000d;
      case "h" -> 3600d * 1_000_000_000d;
      default -> throw new IllegalStateException("unit " + unit);
    };
  }
}
