package ca.gc.cra.dem.domain.grid;

/**
 * Parses GMT style cell increments such as {@code 1s}, {@code 0.25m} or {@code 0.0001}.
 *
 * @since 0.1.0
 */
public final class CellSizes {
  private CellSizes() {
    // Utility
  }

  /**
   * Converts an increment to geographic units.
   *
   * <p>Suffix {@code s} or {@code c} means arc-seconds, {@code m} arc-minutes; no suffix is taken as-is.</p>
   *
   * @param text increment text
   * @return positive increment
   * @throws IllegalArgumentException when the text is not a positive number with an optional suffix
   */
  public static double parse(String text) {
    if (text == null || text.isBlank()) {
      throw new IllegalArgumentException("cell size must not be blank");
    }
    String trimmed = text.trim();
    char unit = Character.toLowerCase(trimmed.charAt(trimmed.length() - 1));
    double divisor = switch (unit) {
      case 's', 'c' -> 3600d;
      case 'm' -> 60d;
      default -> 1d;
    };
    String number = divisor == 1d ? trimmed : trimmed.substring(0, trimmed.length() - 1);
    double value;
    try {
      value = Double.parseDouble(number) / divisor;
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("could not parse cell size '" + text + "'", ex);
    }
    if (!(value > 0d) || Double.isInfinite(value)) {
      throw new IllegalArgumentException("cell size must be positive (was '" + text + "')");
    }
    return value;
  }
}
