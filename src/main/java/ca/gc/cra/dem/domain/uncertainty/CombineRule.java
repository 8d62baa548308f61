package ca.gc.cra.dem.domain.uncertainty;

import java.util.Locale;

/**
 * Optional rule merging the distance and slope uncertainty layers into one.
 *
 * @since 0.1.0
 */
public enum CombineRule {
  /** Keep the two layers separate. */
  NONE,
  /** Larger of the two values per cell. */
  MAX,
  /** Square root of the sum of squares per cell. */
  QUADRATURE;

  /**
   * Applies the rule to one cell.
   *
   * @param distanceUncertainty distance based value
   * @param slopeUncertainty slope based value
   * @return combined value
   */
  public double combine(double distanceUncertainty, double slopeUncertainty) {
    return switch (this) {
      case MAX -> Math.max(distanceUncertainty, slopeUncertainty);
      case QUADRATURE -> Math.sqrt(distanceUncertainty * distanceUncertainty
          + slopeUncertainty * slopeUncertainty);
      case NONE -> throw new IllegalStateException("NONE does not combine layers");
    };
  }

  /**
   * Parses a rule name, case-insensitively.
   *
   * @param value rule name
   * @return rule
   */
  public static CombineRule parse(String value) {
    if (value == null || value.isBlank()) {
      return NONE;
    }
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("unknown combine rule: " + value, ex);
    }
  }
}
