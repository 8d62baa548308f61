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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class AsciiGridRasterAdapterTest {
  @TempDir Path dir;

  private final AsciiGridRasterAdapter adapter = new AsciiGridRasterAdapter();

  @Test
  void writesHeaderAndRowsNorthFirst() throws Exception {
    Raster raster = Raster.empty(GridSpec.of(Region.of(-70, -69, 40, 40.5), 0.25));
    raster.set(0, 0, 12.5);
    raster.set(3, 1, -3);

    Path written = adapter.write(raster, dir.resolve("nested/grid.asc"));

    List<String> lines = Files.readAllLines(written);
    assertEquals(List.of(
        "ncols 4",
        "nrows 2",
        "xllcorner -70",
        "yllcorner 40",
        "cellsize 0.25",
        "NODATA_value -9999",
        "12.5 -9999 -9999 -9999",
        "-9999 -9999 -9999 -3"), lines);
    try (Stream<Path> files = Files.list(written.getParent())) {
      assertEquals(1, files.count());
    }
  }

  @Test
  void readsBackWhatItWrote() throws Exception {
    Raster raster = Raster.empty(GridSpec.of(Region.of(0, 3, 0, 2), 1));
    for (int row = 0; row < 2; row++) {
      for (int col = 0; col < 3; col++) {
        raster.set(col, row, row * 10 + col);
      }
    }
    raster.set(1, 1, raster.spec().nodataValue());
    Path path = adapter.write(raster, dir.resolve("grid.asc"));

    RasterInfo info = adapter.open(path);
    Raster back = adapter.readWindow(path, new SourceWindow(0, 0, 3, 2));

    assertEquals(3, info.width());
    assertEquals(2, info.height());
    assertEquals(raster.spec().region(), info.toGridSpec().region());
    assertEquals(-9999d, info.nodata().getAsDouble(), 1e-12);
    assertEquals(12d, back.get(2, 1), 1e-6);
    assertTrue(back.isNoData(back.get(1, 1)));
  }

  @Test
  void readsWindowOfCentredGridWithProjection() throws Exception {
    Path path = Files.write(dir.resolve("centred.asc"), String.join("\n",
        "ncols 3",
        "nrows 3",
        "xllcenter 0.5",
        "yllcenter 0.5",
        "cellsize 1",
        "nodata_value -1",
        "1 2 3",
        "4 5 6",
        "7 8 9").getBytes(StandardCharsets.US_ASCII));
    Files.writeString(dir.resolve("centred.prj"), "GEOGCS[\"WGS 84\"]\n");

    RasterInfo info = adapter.open(path);
    Raster window = adapter.readWindow(path, new SourceWindow(1, 1, 2, 2));

    assertEquals(Region.of(0, 3, 0, 3), info.toGridSpec().region());
    assertEquals("GEOGCS[\"WGS 84\"]", info.projection().orElseThrow());
    assertEquals(2, window.width());
    assertEquals(5d, window.get(0, 0), 1e-6);
    assertEquals(9d, window.get(1, 1), 1e-6);
    assertEquals(Region.of(1, 3, 0, 2), window.spec().region());
  }

  @Test
  void rejectsTruncatedAndForeignFiles() throws Exception {
    Path truncated = Files.writeString(dir.resolve("short.asc"),
        "ncols 2\nnrows 3\nxllcorner 0\nyllcorner 0\ncellsize 1\n1 2\n3 4\n");
    Path foreign = Files.writeString(dir.resolve("foreign.asc"), "hello world\n");

    assertThrows(IOException.class, () -> adapter.readWindow(truncated, new SourceWindow(0, 0, 2, 3)));
    assertThrows(IOException.class, () -> adapter.open(foreign));
  }

  @Test
  void plainNumbersDropTrailingZeros() {
    assertEquals("3", AsciiGridRasterAdapter.plain(3d));
    assertEquals("-0.5", AsciiGridRasterAdapter.plain(-0.5d));
    assertEquals("0.1", AsciiGridRasterAdapter.plain(0.1f));
  }
}
