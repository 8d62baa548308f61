package ca.gc.cra.dem.domain.uncertainty;

/**
 * Elevation sign profile of a tile.
 *
 * @since 0.1.0
 */
public enum Zone {
  /** Every elevation below zero (bathymetry). */
  NEGATIVE,
  /** Elevations on both sides of zero. */
  MIXED,
  /** Every elevation above zero (topography). */
  POSITIVE;

  /**
   * Classifies an elevation range.
   *
   * @param zMin minimum elevation
   * @param zMax maximum elevation
   * @return zone
   */
  public static Zone of(double zMin, double zMax) {
    if (zMax < 0d) {
      return NEGATIVE;
    }
    if (zMin > 0d) {
      return POSITIVE;
    }
    return MIXED;
  }
}
