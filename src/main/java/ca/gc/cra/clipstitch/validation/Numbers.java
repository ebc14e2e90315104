package ca.gc.cra.clipstitch.validation;

/**
 * Numeric range checks for CLI and configuration values.
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Ensures {@code value} lies within {@code [min, max]}.
   *
   * @param name parameter label used in error messages
   * @param value candidate value
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return {@code value}
   * @throws IllegalArgumentException if the value is out of range
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a positive, finite decimal such as a segment length in seconds.
   *
   * @param name parameter label used in error messages
   * @param raw textual value
   * @param max inclusive upper bound
   * @return parsed value
   * @throws IllegalArgumentException if the text is not a number in {@code (0, max]}
   */
  public static double requirePositiveDecimal(String name, String raw, double max) {
    String trimmed = Strings.requireNonBlank(name, raw);
    double value;
    try {
      value = Double.parseDouble(trimmed);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be a number (was " + trimmed + ")", ex);
    }
    if (Double.isNaN(value) || value <= 0 || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be greater than 0 and at most " + max + " (was " + trimmed + ")");
    }
    return value;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
