package ca.gc.cra.dem.infrastructure.raster;

import ca.gc.cra.dem.application.port.RasterInfo;
import ca.gc.cra.dem.application.port.RasterIoPort;
import ca.gc.cra.dem.application.port.RasterScanPort;
import ca.gc.cra.dem.domain.catalog.RasterEntry;
import ca.gc.cra.dem.domain.grid.GridSpec;
import ca.gc.cra.dem.domain.grid.Raster;
import ca.gc.cra.dem.domain.grid.SourceWindow;
import ca.gc.cra.dem.domain.point.PointRecord;
import ca.gc.cra.dem.domain.point.PointStream;
import ca.gc.cra.dem.domain.region.Region;
import ca.gc.cra.dem.domain.region.ZBounds;
import java.io.IOException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Scans raster cells as point records at cell centres through any {@link RasterIoPort}.
 *
 * <p>Only the window covering the query region is read. Nodata cells and cells outside the elevation bounds
 * are never emitted; records carry weight {@code 1}.</p>
 *
 * @since 0.1.0
 */
public final class RasterScanAdapter implements RasterScanPort {
  private final RasterIoPort rasterIo;

  public RasterScanAdapter(RasterIoPort rasterIo) {
    this.rasterIo = Objects.requireNonNull(rasterIo, "rasterIo");
  }

  @Override
  public PointStream scan(RasterEntry entry, Region region, ZBounds zBounds) throws IOException {
    Objects.requireNonNull(entry, "entry");
    ZBounds bounds = zBounds == null ? ZBounds.none() : zBounds;
    RasterInfo info = rasterIo.open(entry.path());
    GridSpec spec = info.toGridSpec();
    SourceWindow window = region == null
        ? new SourceWindow(0, 0, spec.width(), spec.height())
        : spec.windowOf(region);
    if (window.isEmpty()) {
      return PointStream.empty();
    }
    Raster cells = rasterIo.readWindow(entry.path(), window);
    return PointStream.fromIterator(new CellIterator(cells, bounds), () -> { });
  }

  private static final class CellIterator implements Iterator<PointRecord> {
    private final Raster raster;
    private final ZBounds bounds;
    private int index = -1;

    CellIterator(Raster raster, ZBounds bounds) {
      this.raster = raster;
      this.bounds = bounds;
      advance();
    }

    private void advance() {
      int cells = raster.spec().cellCount();
      index++;
      while (index < cells) {
        double z = raster.getAt(index);
        if (!raster.isNoData(z) && bounds.accepts(z)) {
          return;
        }
        index++;
      }
    }

    @Override
    public boolean hasNext() {
      return index < raster.spec().cellCount();
    }

    @Override
    public PointRecord next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      int column = index % raster.width();
      int row = index / raster.width();
      PointRecord record = PointRecord.of(raster.spec().centerX(column), raster.spec().centerY(row),
          raster.getAt(index));
      advance();
      return record;
    }
  }
}
