package ca.gc.cra.dem.domain.uncertainty;

/**
 * Interpolation error observed at one withheld point.
 *
 * @param error observed minus predicted elevation
 * @param distance distance to the nearest retained sample, in cells
 * @param slope local slope of the trial surface
 * @since 0.1.0
 */
public record ErrorSample(double error, double distance, double slope) {

  /**
   * Returns the explanatory value for {@code axis}.
   *
   * @param axis explanatory variable
   * @return distance or slope
   */
  public double value(ErrorAxis axis) {
    return axis == ErrorAxis.DISTANCE ? distance : slope;
  }
}
