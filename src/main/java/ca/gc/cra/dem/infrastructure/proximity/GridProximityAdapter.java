package ca.gc.cra.dem.infrastructure.proximity;

import ca.gc.cra.dem.application.port.RasterProxyService;
import ca.gc.cra.dem.domain.grid.GridSpec;
import ca.gc.cra.dem.domain.grid.Raster;
import java.util.Objects;

/**
 * In-process proximity and slope rasters.
 *
 * <p><strong>What:</strong> Exact Euclidean distance transform (Felzenszwalb and Huttenlocher, two 1-D
 * passes) in pixel units and Horn's 3x3 slope in degrees.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the immutable vertical scale; safe to share between
 * uncertainty trials.</p>
 *
 * @since 0.1.0
 */
public final class GridProximityAdapter implements RasterProxyService {
  /** Metres per degree of latitude; applied when the DEM is in geographic coordinates with metre elevations. */
  public static final double DEFAULT_VERTICAL_SCALE = 111_120d;

  private static final double INF = 1e20;

  private final double verticalScale;

  public GridProximityAdapter() {
    this(DEFAULT_VERTICAL_SCALE);
  }

  /**
   * Creates the adapter.
   *
   * @param verticalScale ratio of horizontal map units to elevation units
   */
  public GridProximityAdapter(double verticalScale) {
    if (!(verticalScale > 0d) || Double.isInfinite(verticalScale)) {
      throw new IllegalArgumentException("verticalScale must be positive and finite");
    }
    this.verticalScale = verticalScale;
  }

  /**
   * Distance in cells from every cell to the nearest data cell of {@code mask}.
   *
   * <p>A mask cell holds data when it is non-zero and not nodata. A mask without data yields a raster of
   * nodata.</p>
   */
  @Override
  public Raster proximity(Raster mask) {
    Objects.requireNonNull(mask, "mask");
    GridSpec spec = mask.spec();
    int width = spec.width();
    int height = spec.height();
    double[] grid = new double[spec.cellCount()];
    boolean any = false;
    for (int i = 0; i < grid.length; i++) {
      double v = mask.getAt(i);
      boolean data = !mask.isNoData(v) && v != 0d;
      grid[i] = data ? 0d : INF;
      any |= data;
    }
    Raster out = Raster.empty(spec);
    if (!any) {
      return out;
    }

    int longest = Math.max(width, height);
    double[] f = new double[longest];
    double[] d = new double[longest];
    int[] v = new int[longest];
    double[] z = new double[longest + 1];

    for (int col = 0; col < width; col++) {
      for (int row = 0; row < height; row++) {
        f[row] = grid[spec.index(col, row)];
      }
      transform1d(f, height, d, v, z);
      for (int row = 0; row < height; row++) {
        grid[spec.index(col, row)] = d[row];
      }
    }
    for (int row = 0; row < height; row++) {
      for (int col = 0; col < width; col++) {
        f[col] = grid[spec.index(col, row)];
      }
      transform1d(f, width, d, v, z);
      for (int col = 0; col < width; col++) {
        out.set(col, row, Math.sqrt(d[col]));
      }
    }
    return out;
  }

  /** Squared distance transform of a sampled function; {@code d} receives the lower envelope. */
  static void transform1d(double[] f, int n, double[] d, int[] v, double[] z) {
    int k = 0;
    v[0] = 0;
    z[0] = Double.NEGATIVE_INFINITY;
    z[1] = Double.POSITIVE_INFINITY;
    for (int q = 1; q < n; q++) {
      double s = intersection(f, q, v[k]);
      while (s <= z[k]) {
        k--;
        s = intersection(f, q, v[k]);
      }
      k++;
      v[k] = q;
      z[k] = s;
      z[k + 1] = Double.POSITIVE_INFINITY;
    }
    k = 0;
    for (int q = 0; q < n; q++) {
      while (z[k + 1] < q) {
        k++;
      }
      double delta = q - v[k];
      d[q] = delta * delta + f[v[k]];
    }
  }

  private static double intersection(double[] f, int q, int p) {
    return ((f[q] + (double) q * q) - (f[p] + (double) p * p)) / (2d * q - 2d * p);
  }

  /**
   * Horn slope in degrees.
   *
   * <p>Nodata cells stay nodata; nodata or off-grid neighbours take the centre value.</p>
   */
  @Override
  public Raster slope(Raster dem) {
    Objects.requireNonNull(dem, "dem");
    GridSpec spec = dem.spec();
    Raster out = Raster.empty(spec);
    double run = 8d * spec.cellSize() * verticalScale;
    for (int row = 0; row < spec.height(); row++) {
      for (int col = 0; col < spec.width(); col++) {
        double centre = dem.get(col, row);
        if (dem.isNoData(centre)) {
          continue;
        }
        double a = neighbour(dem, col - 1, row - 1, centre);
        double b = neighbour(dem, col, row - 1, centre);
        double c = neighbour(dem, col + 1, row - 1, centre);
        double dd = neighbour(dem, col - 1, row, centre);
        double f = neighbour(dem, col + 1, row, centre);
        double g = neighbour(dem, col - 1, row + 1, centre);
        double h = neighbour(dem, col, row + 1, centre);
        double i = neighbour(dem, col + 1, row + 1, centre);
        double dzdx = ((c + 2 * f + i) - (a + 2 * dd + g)) / run;
        double dzdy = ((g + 2 * h + i) - (a + 2 * b + c)) / run;
        out.set(col, row, Math.toDegrees(Math.atan(Math.sqrt(dzdx * dzdx + dzdy * dzdy))));
      }
    }
    return out;
  }

  private static double neighbour(Raster dem, int col, int row, double fallback) {
    if (col < 0 || row < 0 || col >= dem.width() || row >= dem.height()) {
      return fallback;
    }
    double value = dem.get(col, row);
    return dem.isNoData(value) ? fallback : value;
  }
}
