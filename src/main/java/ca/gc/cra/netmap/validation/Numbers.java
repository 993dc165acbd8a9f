package ca.gc.cra.netmap.validation;

import java.time.Duration;

/**
 * Numeric validation helpers.
 *
 * @since 0.1.0
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Ensures {@code value} lies within {@code [min, max]}.
   *
   * @param name label used in error messages
   * @param value candidate value
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return {@code value}
   * @throws IllegalArgumentException when out of range
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Ensures {@code value} is a finite number strictly inside {@code (0, 1)}.
   *
   * @param name label used in error messages
   * @param value candidate value
   * @return {@code value}
   */
  public static double requireOpenUnitInterval(String name, double value) {
    if (!Double.isFinite(value) || value <= 0.0 || value >= 1.0) {
      throw new IllegalArgumentException(label(name) + " must be > 0 and < 1 (was " + value + ")");
    }
    return value;
  }

  /**
   * Ensures {@code value} is a finite number within {@code [0, 1]}.
   *
   * @param name label used in error messages
   * @param value candidate value
   * @return {@code value}
   */
  public static double requireUnitInterval(String name, double value) {
    if (!Double.isFinite(value) || value < 0.0 || value > 1.0) {
      throw new IllegalArgumentException(label(name) + " must be between 0 and 1 (was " + value + ")");
    }
    return value;
  }

  /**
   * Ensures {@code value} is strictly positive.
   *
   * @param name label used in error messages
   * @param value candidate duration
   * @return {@code value}
   */
  public static Duration requirePositive(String name, Duration value) {
    if (value == null || value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(label(name) + " must be a positive duration (was " + value + ")");
    }
    return value;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
