package ca.gc.cra.dem.domain.point;

/**
 * One weighted elevation observation.
 *
 * @param x easting or longitude
 * @param y northing or latitude
 * @param z elevation
 * @param weight relative weight, {@code 1} unless a catalog entry says otherwise
 * @since 0.1.0
 */
public record PointRecord(double x, double y, double z, double weight) {

  /**
   * Creates a record with weight {@code 1}.
   *
   * @param x easting or longitude
   * @param y northing or latitude
   * @param z elevation
   * @return unweighted record
   */
  public static PointRecord of(double x, double y, double z) {
    return new PointRecord(x, y, z, 1d);
  }

  /**
   * Returns a copy carrying a different weight.
   *
   * @param newWeight weight to attach
   * @return reweighted record
   */
  public PointRecord withWeight(double newWeight) {
    return new PointRecord(x, y, z, newWeight);
  }

  /**
   * Returns a copy at different horizontal coordinates.
   *
   * @param newX new x
   * @param newY new y
   * @return moved record
   */
  public PointRecord withXy(double newX, double newY) {
    return new PointRecord(newX, newY, z, weight);
  }
}
