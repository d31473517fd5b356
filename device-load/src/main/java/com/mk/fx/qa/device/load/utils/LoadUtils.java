package com.mk.fx.qa.device.load.utils;

import java.time.Duration;

public final class LoadUtils {

  private LoadUtils() {
    // Utility class, no instantiation
  }

  public static Duration toDuration(Duration duration) {
    return duration != null ? duration : Duration.ZERO;
  }

  /**
   * Parses {@code 250ms}, {@code 30s}, {@code 5m}, {@code 1h} or a plain number of seconds. Blank
   * means zero.
   *
   * @throws IllegalArgumentException if the value is malformed or negative
   */
  public static Duration parseDuration(String value) {
    if (value == null || value.isBlank()) {
      return Duration.ZERO;
    }
    String trimmed = value.trim().toLowerCase();
    try {
      if (trimmed.endsWith("ms")) {
        long ms = Long.parseLong(trimmed.substring(0, trimmed.length() - 2));
        return nonNegative(Duration.ofMillis(ms), value);
      }
      char unit = trimmed.charAt(trimmed.length() - 1);
      if (Character.isDigit(unit)) {
        return nonNegative(Duration.ofSeconds(Long.parseLong(trimmed)), value);
      }
      long amount = Long.parseLong(trimmed.substring(0, trimmed.length() - 1));
      var duration =
          switch (unit) {
            case 's' -> Duration.ofSeconds(amount);
            case 'm' -> Duration.ofMinutes(amount);
            case 'h' -> Duration.ofHours(amount);
            default -> throw new IllegalArgumentException("Unrecognised duration unit in " + value);
          };
      return nonNegative(duration, value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid duration " + value, e);
    }
  }

  private static Duration nonNegative(Duration duration, String value) {
    if (duration.isNegative()) {
      throw new IllegalArgumentException("Duration cannot be negative: " + value);
    }
    return duration;
  }
}
