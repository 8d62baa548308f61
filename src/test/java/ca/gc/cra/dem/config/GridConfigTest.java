package ca.gc.cra.dem.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.dem.domain.grid.BinningMode;
import ca.gc.cra.dem.domain.grid.GridSpec;
import ca.gc.cra.dem.domain.region.Region;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

class GridConfigTest {

  @Test
  void fromMapReadsEveryKey() {
    Map<String, String> options = base();
    options.put("name", "coast_1s");
    options.put("outDir", "build/dems");
    options.put("module", "IDW");
    options.put("param.power", "3");
    options.put("param.", "ignored");
    options.put("extend", "2");
    options.put("extendProc", "4");
    options.put("lower", "-100");
    options.put("weights", "yes");
    options.put("chunk", "500");
    options.put("mask", "true");
    options.put("unc", "true");
    options.put("nodata", "-32768");

    GridConfig config = GridConfig.fromMap(options);

    assertEquals("survey.datalist", config.datalist());
    assertEquals(1d / 3600d, config.cellSize(), 1e-15);
    assertEquals("coast_1s", config.name());
    assertEquals(Path.of("build/dems").toAbsolutePath().normalize(), config.outputDirectory());
    assertEquals(GridModule.IDW, config.module());
    assertEquals(Map.of("power", "3"), config.methodParams());
    assertEquals(2, config.extend());
    assertEquals(4, config.extendProc());
    assertEquals(-100d, config.zBounds().lower().getAsDouble(), 1e-12);
    assertTrue(config.zBounds().upper().isEmpty());
    assertEquals(1d, config.weightOverride().getAsDouble(), 1e-12);
    assertEquals(500, config.chunkCells().getAsInt());
    assertTrue(config.writeMask());
    assertTrue(config.uncertainty());
    assertEquals(-32768d, config.nodata(), 1e-12);
  }

  @Test
  void fromMapAppliesDefaults() {
    GridConfig config = GridConfig.fromMap(base());

    assertEquals("waffles_dem", config.name());
    assertEquals(GridModule.MEAN, config.module());
    assertEquals(10, config.extendProc());
    assertEquals(GridSpec.DEFAULT_NODATA, config.nodata(), 1e-12);
    assertTrue(config.weightOverride().isEmpty());
    assertTrue(config.chunkCells().isEmpty());
    assertFalse(config.blockMean());
  }

  @Test
  void regionIsRequired() {
    Map<String, String> options = base();
    options.remove("region");

    assertThrows(IllegalArgumentException.class, () -> GridConfig.fromMap(options));
  }

  @Test
  void uncertaintyNeedsInterpolatingModule() {
    Map<String, String> options = base();
    options.put("module", "num");
    options.put("unc", "true");

    assertThrows(IllegalArgumentException.class, () -> GridConfig.fromMap(options));
  }

  @Test
  void unsafeOutputNameIsRejected() {
    Map<String, String> options = base();
    options.put("name", "../escape");

    assertThrows(IllegalArgumentException.class, () -> GridConfig.fromMap(options));
  }

  @Test
  void regionsAreBufferedByExtendCells() {
    GridConfig config = GridConfig.builder()
        .datalist("survey.datalist")
        .region(Region.of(0, 10, 0, 10))
        .cellSize(0.5)
        .extend(2)
        .extendProc(6)
        .build();

    Region output = config.outputRegion();
    Region processing = config.processingRegion(config.region());

    assertEquals(-1d, output.west(), 1e-12);
    assertEquals(11d, output.north(), 1e-12);
    assertEquals(-4d, processing.west(), 1e-12);
    assertEquals(24, config.outputGrid().width());
    assertEquals(config.outputDirectory().resolve("waffles_dem_msk.asc"), config.output("_msk.asc"));
  }

  @Test
  void modulesMapToBinningOrEngines() {
    assertEquals(BinningMode.COUNT, GridModule.parse("num").binning().orElseThrow());
    assertEquals(BinningMode.PRESENCE, GridModule.parse(" Mask ").binning().orElseThrow());
    assertTrue(GridModule.PROCESS.binning().isEmpty());
    assertEquals("idw", GridModule.IDW.engineName());
    assertThrows(IllegalArgumentException.class, () -> GridModule.parse("surface"));
  }

  private static Map<String, String> base() {
    Map<String, String> options = new HashMap<>();
    options.put("datalist", "survey.datalist");
    options.put("region", "-70.5/-70/41/41.5");
    options.put("inc", "1s");
    return options;
  }
}
