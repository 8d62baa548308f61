package ca.gc.cra.dem.infrastructure.raster;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.dem.application.port.RasterInfo;
import ca.gc.cra.dem.domain.grid.GridSpec;
import ca.gc.cra.dem.domain.grid.Raster;
import ca.gc.cra.dem.domain.grid.SourceWindow;
import ca.gc.cra.dem.domain.region.Region;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GeoTiffRasterAdapterTest {
  @TempDir Path dir;

  private final GeoTiffRasterAdapter adapter = new GeoTiffRasterAdapter();

  @Test
  void readsBackGeoreferencingNodataAndCells() throws Exception {
    Raster raster = Raster.empty(GridSpec.of(Region.of(-70.5, -69.5, 41.75, 42.5), 0.25));
    raster.set(0, 0, 12.5);
    raster.set(3, 2, -3.25);

    Path written = adapter.write(raster, dir.resolve("nested/dem.tif"));
    RasterInfo info = adapter.open(written);
    Raster back = adapter.readWindow(written, new SourceWindow(0, 0, 4, 3));

    assertEquals(4, info.width());
    assertEquals(3, info.height());
    assertEquals(1, info.bandCount());
    assertEquals(raster.spec().region(), info.toGridSpec().region());
    assertEquals(0.25, info.toGridSpec().cellSize(), 1e-12);
    assertEquals(-9999d, info.nodata().getAsDouble(), 1e-12);
    assertEquals(12.5, back.get(0, 0), 1e-6);
    assertEquals(-3.25, back.get(3, 2), 1e-6);
    assertTrue(back.isNoData(back.get(1, 1)));
    try (Stream<Path> files = Files.list(written.getParent())) {
      assertEquals(1, files.count());
    }
  }

  @Test
  void windowCarriesItsOwnRegion() throws Exception {
    Raster raster = Raster.empty(GridSpec.of(Region.of(0, 3, 0, 3), 1));
    for (int row = 0; row < 3; row++) {
      for (int col = 0; col < 3; col++) {
        raster.set(col, row, row * 3 + col + 1);
      }
    }
    Path path = adapter.write(raster, dir.resolve("grid.tif"));

    Raster window = adapter.readWindow(path, new SourceWindow(1, 1, 2, 2));

    assertEquals(2, window.width());
    assertEquals(5d, window.get(0, 0), 1e-6);
    assertEquals(9d, window.get(1, 1), 1e-6);
    assertEquals(Region.of(1, 3, 0, 2), window.spec().region());
  }

  @Test
  void rejectsMissingAndForeignFiles() throws Exception {
    Path foreign = Files.writeString(dir.resolve("foreign.tif"), "hello world\n");

    assertThrows(NoSuchFileException.class, () -> adapter.open(dir.resolve("missing.tif")));
    assertThrows(IOException.class, () -> adapter.open(foreign));
  }
}
