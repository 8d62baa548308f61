package ca.gc.cra.dem.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by the CLI and configuration parsing.
 * <p><strong>Why:</strong> Rejects unusable cell sizes, worker counts and simulation counts before any
 * catalog is opened or raster allocated.</p>
 * <p><strong>Thread-safety:</strong> Stateless utility.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates that a floating point value is finite and strictly positive.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate value such as a cell size or weight
   * @return the validated value
   * @throws IllegalArgumentException if the value is NaN, infinite, zero or negative
   */
  public static double requirePositive(String name, double value) {
    if (!Double.isFinite(value) || value <= 0d) {
      throw new IllegalArgumentException(label(name) + " must be a positive finite number (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates that a floating point value is finite and within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value
   * @throws IllegalArgumentException if the value is not finite or lies outside {@code [min, max]}
   */
  public static double requireRange(String name, double value, double min, double max) {
    if (!Double.isFinite(value) || value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
