package ca.gc.cra.dem.infrastructure.raster;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import ca.gc.cra.dem.domain.catalog.RasterEntry;
import ca.gc.cra.dem.domain.grid.GridSpec;
import ca.gc.cra.dem.domain.grid.Raster;
import ca.gc.cra.dem.domain.point.PointRecord;
import ca.gc.cra.dem.domain.point.PointStream;
import ca.gc.cra.dem.domain.region.Region;
import ca.gc.cra.dem.domain.region.ZBounds;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RasterScanAdapterTest {
  @TempDir Path dir;

  private final AsciiGridRasterAdapter rasterIo = new AsciiGridRasterAdapter();
  private final RasterScanAdapter scanner = new RasterScanAdapter(rasterIo);
  private RasterEntry entry;

  @BeforeEach
  void setUp() throws Exception {
    Raster raster = Raster.empty(GridSpec.of(Region.of(0, 4, 0, 2), 1));
    for (int col = 0; col < 4; col++) {
      raster.set(col, 0, col);
      raster.set(col, 1, -col);
    }
    raster.set(2, 0, raster.spec().nodataValue());
    Path path = rasterIo.write(raster, dir.resolve("tile.asc"));
    entry = new RasterEntry(path, OptionalDouble.empty(), List.of());
  }

  @Test
  void emitsValidCellCentresWithUnitWeight() throws Exception {
    List<PointRecord> records = drain(scanner.scan(entry, null, ZBounds.none()));

    assertEquals(7, records.size());
    assertEquals(new PointRecord(0.5, 1.5, 0, 1), records.get(0));
    assertEquals(new PointRecord(3.5, 0.5, -3, 1), records.get(6));
  }

  @Test
  void readsOnlyTheWindowUnderTheRegionAndAppliesBounds() throws Exception {
    List<PointRecord> records = drain(scanner.scan(entry, Region.of(2, 4, 0, 2), ZBounds.of(-2.5, null)));

    assertEquals(List.of(new PointRecord(3.5, 1.5, 3, 1), new PointRecord(2.5, 0.5, -2, 1)), records);
  }

  @Test
  void regionOutsideTheRasterYieldsNothing() throws Exception {
    try (PointStream stream = scanner.scan(entry, Region.of(10, 12, 10, 12), ZBounds.none())) {
      assertFalse(stream.hasNext());
    }
  }

  private static List<PointRecord> drain(PointStream stream) {
    List<PointRecord> out = new ArrayList<>();
    try (stream) {
      while (stream.hasNext()) {
        out.add(stream.next());
      }
    }
    return out;
  }
}
