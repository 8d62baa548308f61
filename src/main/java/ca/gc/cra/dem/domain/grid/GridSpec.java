package ca.gc.cra.dem.domain.grid;

import ca.gc.cra.dem.domain.region.Region;
import java.util.Objects;

/**
 * <strong>What:</strong> Geometry of a north-up raster derived once from a region and a cell size.
 * <p><strong>Why:</strong> Binning, interpolation, proximity and uncertainty all index the same cells, so
 * the dimension rounding and transform live in one place.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * <p>Dimensions are {@code round((east - west) / cellSize)} and {@code round((north - south) / cellSize)},
 * anchored at the north-west corner; {@link #region()} is the snapped region those cells actually cover.</p>
 *
 * @param region area covered by the cells
 * @param cellSize cell edge length
 * @param width number of columns
 * @param height number of rows
 * @param transform pixel to geographic transform
 * @param nodataValue value marking empty cells
 * @since 0.1.0
 */
public record GridSpec(
    Region region,
    double cellSize,
    int width,
    int height,
    GeoTransform transform,
    double nodataValue) {
  /** Nodata value used unless configured otherwise. */
  public static final double DEFAULT_NODATA = -9999d;

  public GridSpec {
    Objects.requireNonNull(region, "region");
    Objects.requireNonNull(transform, "transform");
    if (width < 1 || height < 1) {
      throw new IllegalArgumentException("grid must have at least one cell (was " + width + "x" + height + ")");
    }
    if (!(cellSize > 0d)) {
      throw new IllegalArgumentException("cellSize must be positive");
    }
  }

  /**
   * Derives a grid with the default nodata value.
   *
   * @param region requested region; must be valid
   * @param cellSize cell size
   * @return grid specification
   */
  public static GridSpec of(Region region, double cellSize) {
    return of(region, cellSize, DEFAULT_NODATA);
  }

  /**
   * Derives a grid.
   *
   * @param region requested region; must be valid
   * @param cellSize cell size; must be positive
   * @param nodataValue nodata marker
   * @return grid specification
   */
  public static GridSpec of(Region region, double cellSize, double nodataValue) {
    Objects.requireNonNull(region, "region");
    region.requireValid("grid region");
    if (!(cellSize > 0d) || Double.isInfinite(cellSize)) {
      throw new IllegalArgumentException("cellSize must be positive (was " + cellSize + ")");
    }
    long w = Math.round(region.width() / cellSize);
    long h = Math.round(region.height() / cellSize);
    if (w < 1 || h < 1) {
      throw new IllegalArgumentException("region " + region + " is smaller than one cell of " + cellSize);
    }
    if (w * h > Integer.MAX_VALUE - 8) {
      throw new IllegalArgumentException("grid of " + w + "x" + h + " cells is too large");
    }
    Region snapped = Region.of(region.west(), region.west() + w * cellSize,
        region.north() - h * cellSize, region.north());
    return new GridSpec(snapped, cellSize, (int) w, (int) h,
        GeoTransform.northUp(region.west(), region.north(), cellSize), nodataValue);
  }

  public int cellCount() {
    return width * height;
  }

  /** Row-major buffer index of {@code (column, row)}. */
  public int index(int column, int row) {
    return row * width + column;
  }

  /**
   * Buffer index of the cell containing {@code (x, y)}.
   *
   * @param x easting
   * @param y northing
   * @return index, or {@code -1} when the point falls outside the grid
   */
  public int cellOf(double x, double y) {
    long col = transform.column(x, y);
    long row = transform.row(x, y);
    if (col < 0 || row < 0 || col >= width || row >= height) {
      return -1;
    }
    return (int) (row * width + col);
  }

  public double centerX(int column) {
    return transform.centerX(column, 0);
  }

  public double centerY(int row) {
    return transform.centerY(0, row);
  }

  /**
   * Window of this grid covering {@code sub}, clipped to the grid.
   *
   * @param sub region of interest
   * @return window, possibly empty
   */
  public SourceWindow windowOf(Region sub) {
    Objects.requireNonNull(sub, "sub");
    Region area = sub.reduce(region);
    if (!area.isValid()) {
      return new SourceWindow(0, 0, 0, 0);
    }
    int x0 = clamp(Math.round((area.west() - region.west()) / cellSize), width);
    int x1 = clamp(Math.round((area.east() - region.west()) / cellSize), width);
    int y0 = clamp(Math.round((region.north() - area.north()) / cellSize), height);
    int y1 = clamp(Math.round((region.north() - area.south()) / cellSize), height);
    return new SourceWindow(x0, y0, Math.max(0, x1 - x0), Math.max(0, y1 - y0));
  }

  /**
   * Grid covering a non-empty window of this grid.
   *
   * @param window pixel window inside this grid
   * @return sub-grid sharing cell size and nodata
   */
  public GridSpec subGrid(SourceWindow window) {
    Objects.requireNonNull(window, "window");
    if (window.isEmpty()
        || window.xOffset() + window.xSize() > width
        || window.yOffset() + window.ySize() > height) {
      throw new IllegalArgumentException("window " + window + " does not fit in " + width + "x" + height);
    }
    double west = region.west() + window.xOffset() * cellSize;
    double north = region.north() - window.yOffset() * cellSize;
    Region sub = Region.of(west, west + window.xSize() * cellSize, north - window.ySize() * cellSize, north);
    return new GridSpec(sub, cellSize, window.xSize(), window.ySize(),
        GeoTransform.northUp(west, north, cellSize), nodataValue);
  }

  private static int clamp(long value, int max) {
    return (int) Math.max(0, Math.min(max, value));
  }
}
