package ca.gc.cra.dem.application.grid;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.dem.application.port.RecordingMetricsPort;
import ca.gc.cra.dem.domain.grid.BinningMode;
import ca.gc.cra.dem.domain.grid.GridSpec;
import ca.gc.cra.dem.domain.grid.Raster;
import ca.gc.cra.dem.domain.point.PointRecord;
import ca.gc.cra.dem.domain.point.PointStream;
import ca.gc.cra.dem.domain.region.Region;
import ca.gc.cra.dem.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;
import org.junit.jupiter.api.Test;

class GridBinnerTest {
  private final GridSpec spec = GridSpec.of(Region.of(0, 4, 0, 4), 1);
  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final GridBinner binner = new GridBinner(metrics);

  @Test
  void countsPointsAndIgnoresOutsiders() {
    PointStream points = PointStream.of(List.of(
        PointRecord.of(0.5, 3.5, 1),
        PointRecord.of(0.6, 3.4, 1),
        PointRecord.of(3.5, 0.5, 1),
        PointRecord.of(9, 9, 1)));

    Raster counts = binner.bin(points, spec, BinningMode.COUNT);

    assertEquals(2d, counts.get(0, 0), 1e-9);
    assertEquals(1d, counts.get(3, 3), 1e-9);
    assertEquals(0d, counts.get(1, 1), 1e-9);
    assertEquals(List.of(3L), metrics.observed("grid.points.binned"));
  }

  @Test
  void meanIsWeightedAndEmptyCellsStayNodata() {
    PointStream points = PointStream.of(List.of(
        new PointRecord(1.5, 2.5, 10, 1),
        new PointRecord(1.5, 2.5, 20, 3)));

    Raster mean = binner.bin(points, spec, BinningMode.MEAN);

    assertEquals(17.5, mean.get(1, 1), 1e-9);
    assertTrue(mean.isNoData(mean.get(0, 0)));
  }

  @Test
  void parallelPartitionsMatchSequentialBinning() throws Exception {
    Random random = new Random(3);
    List<PointRecord> all = new ArrayList<>();
    for (int i = 0; i < 2_000; i++) {
      all.add(new PointRecord(random.nextDouble() * 5 - 0.5, random.nextDouble() * 5 - 0.5,
          random.nextGaussian(), 0.5 + random.nextDouble()));
    }
    List<Supplier<PointStream>> partitions = new ArrayList<>();
    for (int p = 0; p < 4; p++) {
      List<PointRecord> part = all.subList(p * 500, (p + 1) * 500);
      partitions.add(() -> PointStream.of(part));
    }
    ExecutorService pool = ExecutorFactories.newWorkerPool(3, "bin-test", null);
    Raster parallel;
    try {
      parallel = binner.binParallel(partitions, spec, BinningMode.MEAN, pool);
    } finally {
      ExecutorFactories.shutdownAndAwait(pool, Duration.ofSeconds(5));
    }

    Raster sequential = binner.bin(PointStream.of(all), spec, BinningMode.MEAN);

    assertArrayEquals(sequential.buffer(), parallel.buffer(), 1e-4f);
  }

  @Test
  void blockMeansEmitOneRecordPerOccupiedCell() {
    PointStream points = PointStream.of(List.of(
        new PointRecord(0.2, 3.2, 4, 1),
        new PointRecord(0.8, 3.8, 8, 1),
        new PointRecord(2.5, 1.5, -2, 2)));

    List<PointRecord> means = new ArrayList<>();
    try (PointStream blocks = binner.blockMeans(points, spec)) {
      while (blocks.hasNext()) {
        means.add(blocks.next());
      }
    }

    assertEquals(List.of(new PointRecord(0.5, 3.5, 6, 2), new PointRecord(2.5, 1.5, -2, 2)), means);
    assertFalse(means.isEmpty());
  }
}
