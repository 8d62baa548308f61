package ca.gc.cra.dem.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.dem.application.grid.GridBinner;
import ca.gc.cra.dem.application.port.ExternalToolFailureException;
import ca.gc.cra.dem.application.port.InterpolationEngine;
import ca.gc.cra.dem.application.port.RecordingMetricsPort;
import ca.gc.cra.dem.config.GridConfig;
import ca.gc.cra.dem.config.GridModule;
import ca.gc.cra.dem.domain.grid.GridSpec;
import ca.gc.cra.dem.domain.grid.Raster;
import ca.gc.cra.dem.domain.point.PointRecord;
import ca.gc.cra.dem.domain.point.PointStream;
import ca.gc.cra.dem.domain.region.Region;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class GridUseCaseTest {
  @TempDir Path dir;

  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private PipelineFixtures fixtures;

  @BeforeEach
  void setUp() {
    fixtures = new PipelineFixtures(metrics);
  }

  @Test
  void countModuleWritesDemAndMask() throws Exception {
    datalist("0.5 0.5 1", "0.5 0.5 2", "1.5 1.5 3");
    GridConfig config = base(Region.of(0, 2, 0, 2)).module(GridModule.NUM).writeMask(true).build();

    GridResult result = useCase(config, Map.of()).run();

    assertEquals(dir.resolve("out/test_dem.asc"), result.dem().orElseThrow());
    assertEquals(dir.resolve("out/test_dem_msk.asc"), result.mask().orElseThrow());
    assertEquals(1, result.validChunks());
    Raster dem = fixtures.read(result.dem().get());
    assertEquals(2, dem.width());
    assertEquals(2d, dem.get(0, 1), 1e-6);
    assertEquals(1d, dem.get(1, 0), 1e-6);
    assertEquals(0d, dem.get(0, 0), 1e-6);
    Raster mask = fixtures.read(result.mask().get());
    assertEquals(1d, mask.get(0, 1), 1e-6);
    assertEquals(0d, mask.get(1, 1), 1e-6);
    assertEquals(List.of(3L), metrics.observed("grid.points.binned"));
  }

  @Test
  void regionWithoutRecordsWritesNothing() throws Exception {
    datalist("10.5 10.5 1");
    GridConfig config = base(Region.of(0, 2, 0, 2)).build();

    GridResult result = useCase(config, Map.of()).run();

    assertTrue(result.dem().isEmpty());
    assertEquals(0, result.validChunks());
    assertFalse(Files.exists(dir.resolve("out")));
  }

  @Test
  void failedChunkIsDroppedFromChunkedRun() throws Exception {
    datalist("0.5 0.5 1", "2.5 0.5 2", "3.5 1.5 3");
    GridConfig config = base(Region.of(0, 4, 0, 2))
        .module(GridModule.IDW)
        .chunkCells(OptionalInt.of(2))
        .writeMask(true)
        .build();

    GridResult result = useCase(config, Map.of("idw", new WestFailingEngine())).run();

    assertEquals(2, result.chunks());
    assertEquals(1, result.validChunks());
    assertEquals(1, result.failedChunks());
    assertEquals(1, metrics.count("grid.chunks.failed"));
    Raster dem = fixtures.read(result.dem().orElseThrow());
    assertTrue(dem.isNoData(dem.get(0, 0)));
    assertTrue(dem.isNoData(dem.get(1, 1)));
    assertEquals(5d, dem.get(2, 0), 1e-6);
    assertEquals(5d, dem.get(3, 1), 1e-6);
    Raster mask = fixtures.read(result.mask().orElseThrow());
    assertEquals(1d, mask.get(2, 1), 1e-6);
    assertEquals(1d, mask.get(3, 0), 1e-6);
    assertEquals(0d, mask.get(0, 1), 1e-6);
  }

  @Test
  void moduleFailureAbortsUnchunkedRun() throws Exception {
    datalist("0.5 0.5 1");
    GridConfig config = base(Region.of(0, 2, 0, 2)).module(GridModule.IDW).build();
    GridUseCase useCase = useCase(config, Map.of("idw", new WestFailingEngine()));

    assertThrows(ExternalToolFailureException.class, useCase::run);
    assertFalse(Files.exists(dir.resolve("out")));
  }

  @Test
  void interpolationReadsTheCatalogAgainInsteadOfHoldingRecords() throws Exception {
    datalist("0.5 0.5 1", "0.6 0.4 3", "1.5 1.5 5");
    GridConfig config = base(Region.of(0, 2, 0, 2)).module(GridModule.IDW).build();
    RecordingEngine engine = new RecordingEngine();

    GridResult result = useCase(config, Map.of("idw", engine)).run();

    assertEquals(1, result.validChunks());
    assertEquals(List.of(
        new PointRecord(0.5, 0.5, 1, 1),
        new PointRecord(0.6, 0.4, 3, 1),
        new PointRecord(1.5, 1.5, 5, 1)), engine.received);
    assertEquals(List.of(3L, 3L), metrics.observed("catalog.records.emitted"));
  }

  @Test
  void blockMeansComeFromTheFirstPass() throws Exception {
    datalist("0.5 0.5 1", "0.6 0.4 3", "1.5 1.5 5");
    GridConfig config = base(Region.of(0, 2, 0, 2)).module(GridModule.IDW).blockMean(true).build();
    RecordingEngine engine = new RecordingEngine();

    useCase(config, Map.of("idw", engine)).run();

    assertEquals(List.of(new PointRecord(1.5, 1.5, 5, 1), new PointRecord(0.5, 0.5, 2, 2)), engine.received);
    assertEquals(List.of(3L), metrics.observed("catalog.records.emitted"));
  }

  @Test
  void interpolatingModuleNeedsRegisteredEngine() throws Exception {
    datalist("0.5 0.5 1");
    GridConfig config = base(Region.of(0, 2, 0, 2)).module(GridModule.PROCESS).build();

    assertThrows(IllegalArgumentException.class, () -> useCase(config, Map.of("idw", new WestFailingEngine())));
  }

  @Test
  void markPresenceFlagsCellsUnderTileData() {
    Raster target = Raster.filled(GridSpec.of(Region.of(0, 4, 0, 2), 1), 0);
    Raster tile = Raster.filled(GridSpec.of(Region.of(2, 4, 0, 2), 1), 0);
    tile.set(0, 0, 1);

    GridUseCase.markPresence(target, tile);

    assertEquals(1d, target.get(2, 0), 1e-12);
    assertEquals(1, (int) target.validSum());
  }

  private GridConfig.Builder base(Region region) {
    return GridConfig.builder()
        .datalist(dir.resolve("survey.datalist").toString())
        .region(region)
        .cellSize(1)
        .name("test_dem")
        .outputDirectory(dir.resolve("out"))
        .extendProc(0);
  }

  private void datalist(String... points) throws Exception {
    PipelineFixtures.write(dir.resolve("points.xyz"), points);
    PipelineFixtures.write(dir.resolve("survey.datalist"), "points.xyz 168 1");
  }

  private GridUseCase useCase(GridConfig config, Map<String, InterpolationEngine> engines) {
    return new GridUseCase(config, fixtures.resolver, new GridBinner(metrics), engines, fixtures.rasterIo, "asc",
        null, null, metrics);
  }

  /** Keeps every record it is given and fills its grid with 1. */
  private static final class RecordingEngine implements InterpolationEngine {
    final List<PointRecord> received = new ArrayList<>();

    @Override
    public String name() {
      return "idw";
    }

    @Override
    public Raster interpolate(GridSpec grid, PointStream points, Map<String, String> params) {
      while (points.hasNext()) {
        received.add(points.next());
      }
      return Raster.filled(grid, 1);
    }
  }

  /** Fills its grid with 5 but fails on any grid west of x = 1. */
  private static final class WestFailingEngine implements InterpolationEngine {
    @Override
    public String name() {
      return "idw";
    }

    @Override
    public Raster interpolate(GridSpec grid, PointStream points, Map<String, String> params)
        throws ExternalToolFailureException {
      try (points) {
        if (grid.region().west() < 1) {
          throw new ExternalToolFailureException("engine exited with status 2");
        }
        return Raster.filled(grid, 5);
      }
    }
  }
}
