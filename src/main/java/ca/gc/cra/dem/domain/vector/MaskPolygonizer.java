package ca.gc.cra.dem.domain.vector;

import ca.gc.cra.dem.domain.grid.GridSpec;
import ca.gc.cra.dem.domain.grid.Raster;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.MultiPolygon;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.operation.union.UnaryUnionOp;

/**
 * Turns the data cells of a mask raster into dissolved footprint polygons.
 *
 * <p>Each row is scanned for runs of consecutive data cells (non-zero, not nodata). A run identical to a run
 * of the row above extends that rectangle southwards; any other run starts a new one. The rectangles are then
 * unioned, so touching cells end up in one polygon and enclosed nodata areas become holes.</p>
 *
 * @since 0.1.0
 */
public final class MaskPolygonizer {
  private static final GeometryFactory FACTORY = new GeometryFactory();

  private MaskPolygonizer() {}

  /**
   * Polygonizes {@code mask}.
   *
   * @param mask mask raster
   * @return one polygon per connected group of data cells, northernmost first; empty when the mask holds no
   *     data
   */
  public static MultiPolygon polygonize(Raster mask) {
    Objects.requireNonNull(mask, "mask");
    GridSpec spec = mask.spec();
    List<Geometry> rectangles = new ArrayList<>();
    // Open rectangles keyed by (startColumn, endColumn) of their run.
    Map<Long, int[]> open = new HashMap<>();
    for (int row = 0; row < spec.height(); row++) {
      Map<Long, int[]> next = new HashMap<>();
      int col = 0;
      while (col < spec.width()) {
        if (!isData(mask, col, row)) {
          col++;
          continue;
        }
        int start = col;
        while (col < spec.width() && isData(mask, col, row)) {
          col++;
        }
        long key = ((long) start << 32) | col;
        int[] rect = open.remove(key);
        if (rect == null) {
          rect = new int[] {start, col, row, row + 1};
        } else {
          rect[3] = row + 1;
        }
        next.put(key, rect);
      }
      for (int[] closed : open.values()) {
        rectangles.add(rectangle(spec, closed));
      }
      open = next;
    }
    for (int[] closed : open.values()) {
      rectangles.add(rectangle(spec, closed));
    }
    if (rectangles.isEmpty()) {
      return FACTORY.createMultiPolygon();
    }
    return toMultiPolygon(UnaryUnionOp.union(rectangles));
  }

  private static boolean isData(Raster mask, int col, int row) {
    double value = mask.get(col, row);
    return !mask.isNoData(value) && value != 0d;
  }

  /** Rectangle {@code {col0, col1, row0, row1}} (exclusive ends) in map coordinates. */
  private static Geometry rectangle(GridSpec spec, int[] rect) {
    double west = spec.region().west() + rect[0] * spec.cellSize();
    double east = spec.region().west() + rect[1] * spec.cellSize();
    double north = spec.region().north() - rect[2] * spec.cellSize();
    double south = spec.region().north() - rect[3] * spec.cellSize();
    return FACTORY.toGeometry(new Envelope(west, east, south, north));
  }

  private static MultiPolygon toMultiPolygon(Geometry union) {
    List<Polygon> polygons = new ArrayList<>();
    for (int i = 0; i < union.getNumGeometries(); i++) {
      Geometry part = union.getGeometryN(i);
      if (part instanceof Polygon polygon && !polygon.isEmpty()) {
        polygon.normalize();
        polygons.add(polygon);
      }
    }
    polygons.sort(Comparator.comparingDouble((Polygon p) -> -p.getEnvelopeInternal().getMaxY())
        .thenComparingDouble(p -> p.getEnvelopeInternal().getMinX()));
    return FACTORY.createMultiPolygon(polygons.toArray(new Polygon[0]));
  }
}
