package ca.gc.cra.dem.domain.extent;

import java.util.Optional;

/**
 * Running min/max over observed points. Not thread-safe.
 *
 * @since 0.1.0
 */
public final class ExtentAccumulator {
  private double xMin = Double.POSITIVE_INFINITY;
  private double xMax = Double.NEGATIVE_INFINITY;
  private double yMin = Double.POSITIVE_INFINITY;
  private double yMax = Double.NEGATIVE_INFINITY;
  private double zMin = Double.POSITIVE_INFINITY;
  private double zMax = Double.NEGATIVE_INFINITY;
  private long count;

  /**
   * Folds one observation into the running extent.
   *
   * @param x easting
   * @param y northing
   * @param z elevation
   */
  public void add(double x, double y, double z) {
    xMin = Math.min(xMin, x);
    xMax = Math.max(xMax, x);
    yMin = Math.min(yMin, y);
    yMax = Math.max(yMax, y);
    zMin = Math.min(zMin, z);
    zMax = Math.max(zMax, z);
    count++;
  }

  public long count() {
    return count;
  }

  /** Returns the extent, or empty when nothing was added. */
  public Optional<Extent> toExtent() {
    if (count == 0) {
      return Optional.empty();
    }
    return Optional.of(Extent.of(xMin, xMax, yMin, yMax, zMin, zMax));
  }
}
