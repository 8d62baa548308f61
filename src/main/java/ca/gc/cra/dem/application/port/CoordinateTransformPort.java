package ca.gc.cra.dem.application.port;

/**
 * Reprojects horizontal coordinates between EPSG coordinate systems.
 *
 * @since 0.1.0
 */
public interface CoordinateTransformPort {
  /**
   * Tests whether the pair of systems is supported.
   *
   * @param sourceEpsg source EPSG code
   * @param targetEpsg target EPSG code
   * @return {@code true} when {@link #transform} can convert between them
   */
  boolean supports(int sourceEpsg, int targetEpsg);

  /**
   * Converts one coordinate.
   *
   * @param x source x
   * @param y source y
   * @param sourceEpsg source EPSG code
   * @param targetEpsg target EPSG code
   * @return {@code {x', y'}}
   * @throws IllegalArgumentException when the pair is not supported
   */
  double[] transform(double x, double y, int sourceEpsg, int targetEpsg);
}
