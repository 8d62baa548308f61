package ca.gc.cra.dem.domain.grid;

import ca.gc.cra.dem.domain.point.PointRecord;
import java.util.Objects;

/**
 * Per-cell partial sums {@code (count, Σw, Σw·z)} that can be merged by addition.
 *
 * <p>Accumulators built from disjoint parts of a point stream merge into the same result as one
 * accumulator fed the whole stream, in any order. Not thread-safe; give each worker its own instance.</p>
 *
 * @since 0.1.0
 */
public final class GridAccumulator {
  private final GridSpec spec;
  private final long[] counts;
  private final double[] sumWeight;
  private final double[] sumWeightedZ;

  public GridAccumulator(GridSpec spec) {
    this.spec = Objects.requireNonNull(spec, "spec");
    this.counts = new long[spec.cellCount()];
    this.sumWeight = new double[spec.cellCount()];
    this.sumWeightedZ = new double[spec.cellCount()];
  }

  public GridSpec spec() {
    return spec;
  }

  /**
   * Adds one record.
   *
   * @param record point to bin
   * @return {@code true} when the point fell inside the grid
   */
  public boolean add(PointRecord record) {
    int index = spec.cellOf(record.x(), record.y());
    if (index < 0) {
      return false;
    }
    counts[index]++;
    sumWeight[index] += record.weight();
    sumWeightedZ[index] += record.weight() * record.z();
    return true;
  }

  /**
   * Adds another accumulator's sums cell by cell.
   *
   * @param other accumulator over the same grid
   * @return this accumulator
   */
  public GridAccumulator merge(GridAccumulator other) {
    Objects.requireNonNull(other, "other");
    if (!other.spec.equals(spec)) {
      throw new IllegalArgumentException("cannot merge accumulators over different grids");
    }
    for (int i = 0; i < counts.length; i++) {
      counts[i] += other.counts[i];
      sumWeight[i] += other.sumWeight[i];
      sumWeightedZ[i] += other.sumWeightedZ[i];
    }
    return this;
  }

  public long count(int index) {
    return counts[index];
  }

  public double sumWeight(int index) {
    return sumWeight[index];
  }

  public double sumWeightedZ(int index) {
    return sumWeightedZ[index];
  }

  /** Total number of points accumulated. */
  public long totalCount() {
    long total = 0;
    for (long c : counts) {
      total += c;
    }
    return total;
  }

  /**
   * Finishes the sums into a raster.
   *
   * @param mode aggregation policy
   * @return raster owned by the caller
   */
  public Raster toRaster(BinningMode mode) {
    Objects.requireNonNull(mode, "mode");
    Raster raster = Raster.empty(spec);
    for (int i = 0; i < counts.length; i++) {
      switch (mode) {
        case COUNT -> raster.setAt(i, counts[i]);
        case PRESENCE -> raster.setAt(i, counts[i] > 0 ? 1d : 0d);
        case MEAN -> {
          if (counts[i] > 0 && sumWeight[i] != 0d) {
            raster.setAt(i, sumWeightedZ[i] / sumWeight[i]);
          }
        }
        default -> throw new IllegalStateException("unhandled mode " + mode);
      }
    }
    return raster;
  }
}
