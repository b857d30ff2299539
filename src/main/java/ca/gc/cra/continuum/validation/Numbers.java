package ca.gc.cra.continuum.validation;

/**
 * Numeric parsing and range checks for configuration values.
 *
 * <p>All failures raise {@link IllegalArgumentException} naming the offending key.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a value falls within an inclusive range.
   *
   * @param name parameter name used in messages
   * @param value candidate
   * @param min inclusive minimum
   * @param max inclusive maximum
   * @return {@code value}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a decimal integer and checks its range.
   *
   * @param name parameter name used in messages
   * @param raw text to parse; surrounding whitespace is ignored
   * @param min inclusive minimum
   * @param max inclusive maximum
   * @return parsed value
   */
  public static long parseLong(String name, String raw, long min, long max) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException(label(name) + " must not be blank");
    }
    long value;
    try {
      value = Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be an integer (was " + raw.trim() + ")", ex);
    }
    return requireRange(name, value, min, max);
  }

  /**
   * Parses an integer that must fit an {@code int}.
   *
   * @param name parameter name used in messages
   * @param raw text to parse
   * @param min inclusive minimum
   * @param max inclusive maximum
   * @return parsed value
   */
  public static int parseInt(String name, String raw, int min, int max) {
    return (int) parseLong(name, raw, min, max);
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
