package ca.gc.cra.dem.domain.grid;

import ca.gc.cra.dem.domain.region.Region;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Single band float raster bound to a {@link GridSpec}; row {@code 0} is the northern edge.
 *
 * <p>Mutable and not thread-safe. A raster has one owner at a time: the binner until it hands the raster to
 * the raster I/O port, or the uncertainty trial that created it.</p>
 *
 * @since 0.1.0
 */
public final class Raster {
  private final GridSpec spec;
  private final float[] data;

  /**
   * Wraps an existing buffer.
   *
   * @param spec grid geometry
   * @param data row-major values of length {@code spec.cellCount()}; ownership passes to the raster
   */
  public Raster(GridSpec spec, float[] data) {
    this.spec = Objects.requireNonNull(spec, "spec");
    this.data = Objects.requireNonNull(data, "data");
    if (data.length != spec.cellCount()) {
      throw new IllegalArgumentException(
          "buffer length " + data.length + " does not match " + spec.width() + "x" + spec.height());
    }
  }

  /**
   * Allocates a raster filled with one value.
   *
   * @param spec grid geometry
   * @param value fill value
   * @return new raster
   */
  public static Raster filled(GridSpec spec, double value) {
    float[] data = new float[spec.cellCount()];
    Arrays.fill(data, (float) value);
    return new Raster(spec, data);
  }

  /**
   * Allocates a raster filled with the grid's nodata value.
   *
   * @param spec grid geometry
   * @return new raster
   */
  public static Raster empty(GridSpec spec) {
    return filled(spec, spec.nodataValue());
  }

  public GridSpec spec() {
    return spec;
  }

  public int width() {
    return spec.width();
  }

  public int height() {
    return spec.height();
  }

  public double get(int column, int row) {
    return data[spec.index(column, row)];
  }

  public void set(int column, int row, double value) {
    data[spec.index(column, row)] = (float) value;
  }

  public double getAt(int index) {
    return data[index];
  }

  public void setAt(int index, double value) {
    data[index] = (float) value;
  }

  /** Returns {@code true} when {@code value} is NaN or equals the nodata marker. */
  public boolean isNoData(double value) {
    return Double.isNaN(value) || (float) value == (float) spec.nodataValue();
  }

  /**
   * Value of the cell containing {@code (x, y)}.
   *
   * @param x easting
   * @param y northing
   * @return value, or empty when outside the raster or nodata
   */
  public OptionalDouble sample(double x, double y) {
    int index = spec.cellOf(x, y);
    if (index < 0) {
      return OptionalDouble.empty();
    }
    double value = data[index];
    return isNoData(value) ? OptionalDouble.empty() : OptionalDouble.of(value);
  }

  /** Number of cells holding data. */
  public int validCount() {
    int count = 0;
    for (float v : data) {
      if (!isNoData(v)) {
        count++;
      }
    }
    return count;
  }

  /** Sum of cells holding data. */
  public double validSum() {
    double sum = 0d;
    for (float v : data) {
      if (!isNoData(v)) {
        sum += v;
      }
    }
    return sum;
  }

  /**
   * Minimum and maximum of cells holding data.
   *
   * @return {@code [min, max]}, or empty when the raster holds no data
   */
  public Optional<double[]> valueRange() {
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (float v : data) {
      if (!isNoData(v)) {
        min = Math.min(min, v);
        max = Math.max(max, v);
      }
    }
    return min > max ? Optional.empty() : Optional.of(new double[] {min, max});
  }

  /**
   * Percentile of the cells holding data, interpolating linearly between ranks.
   *
   * @param percent percentile in {@code [0, 100]}
   * @return percentile value, or empty when the raster holds no data
   */
  public OptionalDouble percentile(double percent) {
    double[] values = validValues();
    if (values.length == 0) {
      return OptionalDouble.empty();
    }
    Arrays.sort(values);
    return OptionalDouble.of(Statistics.percentileOfSorted(values, percent));
  }

  /** Copies the cells holding data. */
  public double[] validValues() {
    double[] values = new double[data.length];
    int n = 0;
    for (float v : data) {
      if (!isNoData(v)) {
        values[n++] = v;
      }
    }
    return Arrays.copyOf(values, n);
  }

  /**
   * Copies a pixel window into a new raster.
   *
   * @param window window inside this raster
   * @return window raster with its own geometry
   */
  public Raster window(SourceWindow window) {
    GridSpec sub = spec.subGrid(window);
    float[] out = new float[sub.cellCount()];
    for (int r = 0; r < window.ySize(); r++) {
      System.arraycopy(data, spec.index(window.xOffset(), window.yOffset() + r), out, r * window.xSize(),
          window.xSize());
    }
    return new Raster(sub, out);
  }

  /**
   * Copies the part of this raster covering {@code region}.
   *
   * @param region area to cut
   * @return cut raster, or empty when the region misses the raster
   */
  public Optional<Raster> cut(Region region) {
    SourceWindow window = spec.windowOf(region);
    return window.isEmpty() ? Optional.empty() : Optional.of(window(window));
  }

  /**
   * Writes the data cells of {@code tile} into this raster where the grids overlap.
   *
   * <p>Both rasters must share the cell size; the tile is placed by the position of its cell centres.</p>
   *
   * @param tile raster to paste
   * @return number of cells written
   */
  public int paste(Raster tile) {
    Objects.requireNonNull(tile, "tile");
    if (Math.abs(tile.spec.cellSize() - spec.cellSize()) > spec.cellSize() * 1e-9) {
      throw new IllegalArgumentException("cannot paste a raster with a different cell size");
    }
    int written = 0;
    for (int r = 0; r < tile.height(); r++) {
      double y = tile.spec.centerY(r);
      for (int c = 0; c < tile.width(); c++) {
        double value = tile.get(c, r);
        if (tile.isNoData(value)) {
          continue;
        }
        int index = spec.cellOf(tile.spec.centerX(c), y);
        if (index >= 0) {
          data[index] = (float) value;
          written++;
        }
      }
    }
    return written;
  }

  /** Deep copy. */
  public Raster copy() {
    return new Raster(spec, data.clone());
  }

  /** Copy of the cell values in row-major order. */
  public float[] buffer() {
    return data.clone();
  }
}
