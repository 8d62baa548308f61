package ca.gc.cra.dem.application.grid;

import ca.gc.cra.dem.application.port.MetricsPort;
import ca.gc.cra.dem.domain.grid.BinningMode;
import ca.gc.cra.dem.domain.grid.GridAccumulator;
import ca.gc.cra.dem.domain.grid.GridSpec;
import ca.gc.cra.dem.domain.grid.Raster;
import ca.gc.cra.dem.domain.point.PointRecord;
import ca.gc.cra.dem.domain.point.PointStream;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Bins weighted point streams into rasters.
 * <p><strong>Role:</strong> Application service behind the {@code num}, {@code mean} and {@code mask} grid
 * modules, the uncertainty masks and the spatial metadata masks.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the metrics sink; safe to share.</p>
 * <p><strong>Observability:</strong> Observes {@code grid.points.binned} once per binned stream.</p>
 *
 * @since 0.1.0
 */
public final class GridBinner {
  private static final Logger log = LoggerFactory.getLogger(GridBinner.class);

  private final MetricsPort metrics;

  public GridBinner(MetricsPort metrics) {
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
  }

  /**
   * Bins a stream into a raster. The stream is consumed but not closed.
   *
   * @param points point records
   * @param spec output grid
   * @param mode aggregation policy
   * @return raster; cells without points hold {@code 0} for count and presence, nodata for mean
   */
  public Raster bin(PointStream points, GridSpec spec, BinningMode mode) {
    Objects.requireNonNull(mode, "mode");
    return accumulate(points, spec).toRaster(mode);
  }

  /**
   * Accumulates a stream into mergeable per-cell sums. The stream is consumed but not closed.
   *
   * @param points point records
   * @param spec grid
   * @return accumulator owned by the caller
   */
  public GridAccumulator accumulate(PointStream points, GridSpec spec) {
    Objects.requireNonNull(points, "points");
    GridAccumulator accumulator = new GridAccumulator(Objects.requireNonNull(spec, "spec"));
    long seen = 0;
    long inside = 0;
    while (points.hasNext()) {
      seen++;
      if (accumulator.add(points.next())) {
        inside++;
      }
    }
    metrics.observe("grid.points.binned", inside);
    if (log.isDebugEnabled()) {
      log.debug("Binned {} of {} points into {}x{} cells", inside, seen, spec.width(), spec.height());
    }
    return accumulator;
  }

  /**
   * Accumulates disjoint partitions on {@code executor} and merges the partial sums.
   *
   * <p>Each supplier is opened, drained and closed on a worker. The result equals binning the concatenated
   * partitions sequentially.</p>
   *
   * @param partitions stream suppliers, one per partition
   * @param spec grid
   * @param mode aggregation policy
   * @param executor worker pool; not shut down by this method
   * @return merged raster
   * @throws InterruptedException when interrupted while waiting for workers
   * @throws ExecutionException when a partition fails
   */
  public Raster binParallel(
      List<? extends Supplier<? extends PointStream>> partitions,
      GridSpec spec,
      BinningMode mode,
      ExecutorService executor) throws InterruptedException, ExecutionException {
    Objects.requireNonNull(partitions, "partitions");
    Objects.requireNonNull(executor, "executor");
    List<Future<GridAccumulator>> futures = new ArrayList<>(partitions.size());
    for (Supplier<? extends PointStream> partition : partitions) {
      futures.add(executor.submit(() -> {
        try (PointStream stream = partition.get()) {
          return accumulate(stream, spec);
        }
      }));
    }
    GridAccumulator merged = new GridAccumulator(spec);
    try {
      for (Future<GridAccumulator> future : futures) {
        merged.merge(future.get());
      }
    } finally {
      for (Future<GridAccumulator> future : futures) {
        future.cancel(true);
      }
    }
    return merged.toRaster(mode);
  }

  /**
   * Streams the weighted mean of every occupied cell as one record at the cell centre.
   *
   * <p>The record weight is the summed weight of the cell. Used to thin dense weighted input before
   * interpolation. The input stream is drained eagerly and left open.</p>
   *
   * @param points point records
   * @param spec block grid
   * @return stream of block means in row-major order
   */
  public PointStream blockMeans(PointStream points, GridSpec spec) {
    return blockMeans(accumulate(points, spec));
  }

  /**
   * Streams the weighted mean of every occupied cell of an accumulator already filled.
   *
   * @param accumulator per-cell sums
   * @return stream of block means in row-major order
   */
  public PointStream blockMeans(GridAccumulator accumulator) {
    GridSpec spec = accumulator.spec();
    Iterator<PointRecord> cells = new Iterator<>() {
      private int index = nextOccupied(accumulator, 0);

      @Override
      public boolean hasNext() {
        return index < spec.cellCount();
      }

      @Override
      public PointRecord next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        int column = index % spec.width();
        int row = index / spec.width();
        double weight = accumulator.sumWeight(index);
        PointRecord out = new PointRecord(spec.centerX(column), spec.centerY(row),
            accumulator.sumWeightedZ(index) / weight, weight);
        index = nextOccupied(accumulator, index + 1);
        return out;
      }
    };
    return PointStream.fromIterator(cells, () -> { });
  }

  private static int nextOccupied(GridAccumulator accumulator, int from) {
    int cells = accumulator.spec().cellCount();
    int i = from;
    while (i < cells && (accumulator.count(i) == 0 || accumulator.sumWeight(i) == 0d)) {
      i++;
    }
    return i;
  }
}
