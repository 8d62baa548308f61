package ca.gc.cra.dem.infrastructure.interpolation;

import ca.gc.cra.dem.application.port.ExternalToolFailureException;
import ca.gc.cra.dem.application.port.InterpolationEngine;
import ca.gc.cra.dem.domain.grid.GridSpec;
import ca.gc.cra.dem.domain.grid.Raster;
import ca.gc.cra.dem.domain.point.PointRecord;
import ca.gc.cra.dem.domain.point.PointStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Weighted inverse-distance interpolation evaluated at cell centres.
 *
 * <p>Method parameters: {@code power} (default {@code 2}), {@code radius} search radius in cells (default
 * unlimited) and {@code minPoints} (default {@code 1}). Each record contributes {@code weight / d^power};
 * cells with fewer than {@code minPoints} neighbours are nodata. A record on a cell centre sets that cell.</p>
 *
 * @since 0.1.0
 */
public final class InverseDistanceGridEngine implements InterpolationEngine {
  private static final Logger log = LoggerFactory.getLogger(InverseDistanceGridEngine.class);
  private static final double EXACT = 1e-12;

  @Override
  public String name() {
    return "idw";
  }

  @Override
  public Raster interpolate(GridSpec grid, PointStream points, Map<String, String> methodParams)
      throws ExternalToolFailureException {
    Objects.requireNonNull(grid, "grid");
    Objects.requireNonNull(points, "points");
    MethodParams params = new MethodParams(name(), methodParams);
    double power = params.number("power", 2d);
    double radiusCells = params.number("radius", 0d);
    int minPoints = params.integer("minPoints", 1);
    if (!(power > 0d) || radiusCells < 0d || minPoints < 1) {
      throw new ExternalToolFailureException(
          "idw needs power > 0, radius >= 0 and minPoints >= 1 (got " + params + ")");
    }

    List<PointRecord> records = new ArrayList<>();
    try (points) {
      while (points.hasNext()) {
        records.add(points.next());
      }
    }
    if (records.isEmpty()) {
      throw new ExternalToolFailureException("idw received no points for " + grid.region());
    }

    double radius = radiusCells * grid.cellSize();
    Neighbours index = radius > 0d ? new BucketIndex(records, radius) : query -> records;
    Raster out = Raster.empty(grid);
    for (int row = 0; row < grid.height(); row++) {
      double y = grid.centerY(row);
      for (int col = 0; col < grid.width(); col++) {
        double x = grid.centerX(col);
        double value = estimate(index.near(new double[] {x, y}), x, y, power, radius, minPoints);
        if (!Double.isNaN(value)) {
          out.set(col, row, value);
        }
      }
    }
    log.debug("idw gridded {} records onto {}x{} cells (power={}, radius={})", records.size(), grid.width(),
        grid.height(), power, radiusCells);
    return out;
  }

  private static double estimate(
      Iterable<PointRecord> candidates, double x, double y, double power, double radius, int minPoints) {
    double sumW = 0d;
    double sumWz = 0d;
    double exactW = 0d;
    double exactWz = 0d;
    int used = 0;
    for (PointRecord p : candidates) {
      double dx = p.x() - x;
      double dy = p.y() - y;
      double d = Math.sqrt(dx * dx + dy * dy);
      if (radius > 0d && d > radius) {
        continue;
      }
      used++;
      if (d < EXACT) {
        exactW += p.weight();
        exactWz += p.weight() * p.z();
        continue;
      }
      double w = p.weight() / Math.pow(d, power);
      sumW += w;
      sumWz += w * p.z();
    }
    if (used < minPoints) {
      return Double.NaN;
    }
    if (exactW > 0d) {
      return exactWz / exactW;
    }
    return sumW > 0d ? sumWz / sumW : Double.NaN;
  }

  @FunctionalInterface
  private interface Neighbours {
    Iterable<PointRecord> near(double[] xy);
  }

  /** Square buckets of side {@code radius}; a query visits the 3x3 buckets around it. */
  private static final class BucketIndex implements Neighbours {
    private final double size;
    private final Map<Long, List<PointRecord>> buckets = new HashMap<>();

    BucketIndex(List<PointRecord> records, double size) {
      this.size = size;
      for (PointRecord record : records) {
        buckets.computeIfAbsent(key(cell(record.x()), cell(record.y())), k -> new ArrayList<>()).add(record);
      }
    }

    private long cell(double v) {
      return (long) Math.floor(v / size);
    }

    private static long key(long cx, long cy) {
      return (cx << 32) ^ (cy & 0xffffffffL);
    }

    @Override
    public Iterable<PointRecord> near(double[] xy) {
      long cx = cell(xy[0]);
      long cy = cell(xy[1]);
      List<PointRecord> found = new ArrayList<>();
      for (long dx = -1; dx <= 1; dx++) {
        for (long dy = -1; dy <= 1; dy++) {
          List<PointRecord> bucket = buckets.get(key(cx + dx, cy + dy));
          if (bucket != null) {
            found.addAll(bucket);
          }
        }
      }
      return found;
    }
  }
}
