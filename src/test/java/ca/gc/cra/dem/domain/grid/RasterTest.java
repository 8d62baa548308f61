package ca.gc.cra.dem.domain.grid;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.dem.domain.region.Region;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class RasterTest {
  private final GridSpec spec = GridSpec.of(Region.of(0, 4, 0, 4), 1);

  @Test
  void emptyRasterHoldsNoData() {
    Raster raster = Raster.empty(spec);

    assertEquals(0, raster.validCount());
    assertTrue(raster.valueRange().isEmpty());
    assertTrue(raster.percentile(50).isEmpty());
  }

  @Test
  void bufferIsACopy() {
    Raster raster = Raster.filled(spec, 2);

    float[] values = raster.buffer();
    values[0] = 99f;

    assertEquals(2d, raster.get(0, 0), 1e-12);
    assertEquals(spec.cellCount(), values.length);
  }

  @Test
  void statisticsIgnoreNodataCells() {
    Raster raster = Raster.empty(spec);
    raster.set(0, 0, 1);
    raster.set(1, 0, 3);
    raster.set(2, 2, 5);

    assertEquals(3, raster.validCount());
    assertEquals(9d, raster.validSum(), 1e-9);
    assertArrayEquals(new double[] {1, 5}, raster.valueRange().orElseThrow(), 1e-9);
    assertEquals(3d, raster.percentile(50).getAsDouble(), 1e-9);
  }

  @Test
  void sampleReturnsCellValueOrEmpty() {
    Raster raster = Raster.empty(spec);
    raster.set(0, 0, 7);

    assertEquals(7d, raster.sample(0.2, 3.8).getAsDouble(), 1e-9);
    assertTrue(raster.sample(1.5, 3.5).isEmpty());
    assertTrue(raster.sample(-1, 0).isEmpty());
  }

  @Test
  void cutCopiesTheCoveredCells() {
    Raster raster = Raster.filled(spec, 0);
    raster.set(3, 3, 9);

    Optional<Raster> cut = raster.cut(Region.of(2, 4, 0, 2));

    assertTrue(cut.isPresent());
    assertEquals(2, cut.get().width());
    assertEquals(9d, cut.get().get(1, 1), 1e-9);
    assertFalse(raster.cut(Region.of(10, 11, 10, 11)).isPresent());
  }

  @Test
  void pasteWritesOnlyDataCellsOfTheTile() {
    Raster target = Raster.filled(spec, 1);
    Raster tile = Raster.empty(GridSpec.of(Region.of(2, 4, 2, 4), 1));
    tile.set(0, 0, 8);

    int written = target.paste(tile);

    assertEquals(1, written);
    assertEquals(8d, target.get(2, 0), 1e-9);
    assertEquals(1d, target.get(3, 0), 1e-9);
  }

  @Test
  void pasteRejectsDifferentCellSizes() {
    Raster target = Raster.empty(spec);
    Raster tile = Raster.empty(GridSpec.of(Region.of(0, 4, 0, 4), 2));

    assertThrows(IllegalArgumentException.class, () -> target.paste(tile));
  }

  @Test
  void copyIsIndependent() {
    Raster raster = Raster.filled(spec, 2);
    Raster copy = raster.copy();
    copy.set(0, 0, 5);

    assertEquals(2d, raster.get(0, 0), 1e-9);
  }

  @Test
  void bufferLengthMustMatchGrid() {
    assertThrows(IllegalArgumentException.class, () -> new Raster(spec, new float[3]));
  }
}
