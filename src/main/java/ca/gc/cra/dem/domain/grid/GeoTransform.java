package ca.gc.cra.dem.domain.grid;

/**
 * Six-coefficient affine transform between pixel and geographic space, in GDAL coefficient order.
 *
 * <p>Pixel {@code (i, j)} has its centre at {@code origin + (i + 0.5, j + 0.5)} pushed through the matrix.
 * {@link #column(double, double)} and {@link #row(double, double)} invert that centre transform and add
 * half a cell back before flooring, so a point anywhere inside a cell, and in particular at its centre,
 * maps to that cell.</p>
 *
 * @param originX x of the upper-left corner
 * @param pixelWidth x step per column
 * @param rowRotation x step per row
 * @param originY y of the upper-left corner
 * @param columnRotation y step per column
 * @param pixelHeight y step per row, negative for north-up rasters
 * @since 0.1.0
 */
public record GeoTransform(
    double originX,
    double pixelWidth,
    double rowRotation,
    double originY,
    double columnRotation,
    double pixelHeight) {

  public GeoTransform {
    double det = pixelWidth * pixelHeight - rowRotation * columnRotation;
    if (det == 0d || !Double.isFinite(det)) {
      throw new IllegalArgumentException("geotransform is not invertible");
    }
  }

  /**
   * North-up transform with square cells.
   *
   * @param west x of the left edge
   * @param north y of the top edge
   * @param cellSize cell size
   * @return transform
   */
  public static GeoTransform northUp(double west, double north, double cellSize) {
    return new GeoTransform(west, cellSize, 0d, north, 0d, -cellSize);
  }

  /** Geographic x of the centre of pixel {@code (column, row)}. */
  public double centerX(double column, double row) {
    return originX + (column + .5d) * pixelWidth + (row + .5d) * rowRotation;
  }

  /** Geographic y of the centre of pixel {@code (column, row)}. */
  public double centerY(double column, double row) {
    return originY + (column + .5d) * columnRotation + (row + .5d) * pixelHeight;
  }

  /** Fractional column of the centre transform inverse; integral at cell centres. */
  public double inverseColumn(double x, double y) {
    double det = pixelWidth * pixelHeight - rowRotation * columnRotation;
    double dx = x - originX;
    double dy = y - originY;
    return (pixelHeight * dx - rowRotation * dy) / det - .5d;
  }

  /** Fractional row of the centre transform inverse; integral at cell centres. */
  public double inverseRow(double x, double y) {
    double det = pixelWidth * pixelHeight - rowRotation * columnRotation;
    double dx = x - originX;
    double dy = y - originY;
    return (-columnRotation * dx + pixelWidth * dy) / det - .5d;
  }

  /** Column index of the cell containing {@code (x, y)}; may fall outside the raster. */
  public long column(double x, double y) {
    return (long) Math.floor(inverseColumn(x, y) + .5d);
  }

  /** Row index of the cell containing {@code (x, y)}; may fall outside the raster. */
  public long row(double x, double y) {
    return (long) Math.floor(inverseRow(x, y) + .5d);
  }
}
