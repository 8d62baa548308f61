package ca.gc.cra.dem.application.pipeline;

import ca.gc.cra.dem.application.catalog.CatalogResolver;
import ca.gc.cra.dem.application.grid.GridBinner;
import ca.gc.cra.dem.application.port.ExternalToolFailureException;
import ca.gc.cra.dem.application.port.InterpolationEngine;
import ca.gc.cra.dem.application.port.MetricsPort;
import ca.gc.cra.dem.application.port.RasterIoPort;
import ca.gc.cra.dem.application.uncertainty.UncertaintyEstimator;
import ca.gc.cra.dem.application.uncertainty.UncertaintyResult;
import ca.gc.cra.dem.config.GridConfig;
import ca.gc.cra.dem.domain.grid.BinningMode;
import ca.gc.cra.dem.domain.grid.GridAccumulator;
import ca.gc.cra.dem.domain.grid.GridSpec;
import ca.gc.cra.dem.domain.grid.Raster;
import ca.gc.cra.dem.domain.point.PointStream;
import ca.gc.cra.dem.domain.region.Region;
import ca.gc.cra.dem.domain.region.RegionFormat;
import ca.gc.cra.dem.infrastructure.report.UncertaintyReportWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Builds a DEM from a catalog: resolve, grid, write, and optionally estimate its
 * interpolation uncertainty.
 * <p><strong>Role:</strong> Application-layer use case behind the {@code grid} command.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Stream records over each chunk's processing region (chunk buffered by {@code extend + extendProc}
 *   cells); interpolating modules read the region twice instead of holding its records.</li>
 *   <li>Run the configured module and keep the part covering the chunk buffered by {@code extend} cells.</li>
 *   <li>Mosaic valid chunks, write the DEM and the optional {@code _msk} mask.</li>
 *   <li>Run the uncertainty estimator over the finished DEM when requested.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one run per instance at a time.</p>
 * <p><strong>Observability:</strong> Sets MDC keys {@code grid.name} and {@code grid.chunk}; counts
 * {@code grid.chunks.failed}.</p>
 *
 * <p>A module failure drops the chunk when the run is chunked and aborts the run otherwise. When no chunk
 * produced data nothing is written.</p>
 *
 * @since 0.1.0
 */
public final class GridUseCase {
  private static final Logger log = LoggerFactory.getLogger(GridUseCase.class);

  private final GridConfig config;
  private final CatalogResolver resolver;
  private final GridBinner binner;
  private final InterpolationEngine engine;
  private final RasterIoPort rasterIo;
  private final String rasterExtension;
  private final UncertaintyEstimator estimator;
  private final UncertaintyReportWriter reportWriter;
  private final MetricsPort metrics;

  /**
   * Creates the use case.
   *
   * @param config run settings
   * @param resolver catalog resolver
   * @param binner grid binner
   * @param engines interpolation engines by name; must serve the configured module when it interpolates
   * @param rasterIo raster writer
   * @param rasterExtension extension of written rasters, without the dot
   * @param estimator uncertainty estimator; required when {@code config.uncertainty()} is set
   * @param reportWriter uncertainty output writer; required when {@code config.uncertainty()} is set
   * @param metrics metrics sink
   */
  public GridUseCase(
      GridConfig config,
      CatalogResolver resolver,
      GridBinner binner,
      Map<String, InterpolationEngine> engines,
      RasterIoPort rasterIo,
      String rasterExtension,
      UncertaintyEstimator estimator,
      UncertaintyReportWriter reportWriter,
      MetricsPort metrics) {
    this.config = Objects.requireNonNull(config, "config");
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.binner = Objects.requireNonNull(binner, "binner");
    this.rasterIo = Objects.requireNonNull(rasterIo, "rasterIo");
    this.rasterExtension = Objects.requireNonNull(rasterExtension, "rasterExtension");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
    if (config.module().binning().isPresent()) {
      this.engine = null;
    } else {
      this.engine = Objects.requireNonNull(engines, "engines").get(config.module().engineName());
      if (engine == null) {
        throw new IllegalArgumentException("no interpolation engine registered for module " + config.module());
      }
    }
    if (config.uncertainty() && (estimator == null || reportWriter == null)) {
      throw new IllegalArgumentException("uncertainty requested without an estimator");
    }
    this.estimator = estimator;
    this.reportWriter = reportWriter;
  }

  /**
   * Runs the pipeline.
   *
   * @return written files and chunk counters
   * @throws IOException when an output cannot be written
   * @throws ExternalToolFailureException when the module fails on an unchunked run, or the uncertainty
   *     estimate cannot compute proximity or slope
   * @throws InterruptedException when interrupted while waiting for uncertainty workers
   */
  public GridResult run() throws IOException, ExternalToolFailureException, InterruptedException {
    MDC.put("grid.name", config.name());
    try {
      return execute();
    } finally {
      MDC.remove("grid.name");
    }
  }

  private GridResult execute() throws IOException, ExternalToolFailureException, InterruptedException {
    GridSpec outputGrid = config.outputGrid();
    List<Region> chunks = config.chunkCells().isPresent()
        ? config.region().tile(config.cellSize(), config.chunkCells().getAsInt())
        : List.of(config.region());
    boolean chunked = chunks.size() > 1;
    log.info("Gridding {} with module {} onto {}x{} cells in {} chunk(s)", config.datalist(),
        config.module().engineName(), outputGrid.width(), outputGrid.height(), chunks.size());

    Raster dem = Raster.empty(outputGrid);
    Raster mask = Raster.filled(outputGrid, 0d);
    int valid = 0;
    int failed = 0;
    for (Region chunk : chunks) {
      MDC.put("grid.chunk", chunk.format(RegionFormat.FN));
      try {
        Optional<ChunkOutput> output = gridChunk(chunk);
        if (output.isPresent()) {
          dem.paste(output.get().dem());
          markPresence(mask, output.get().mask());
          valid++;
        }
      } catch (ExternalToolFailureException ex) {
        if (!chunked) {
          throw ex;
        }
        failed++;
        metrics.increment("grid.chunks.failed");
        log.warn("Dropping chunk {}: {}", chunk, ex.getMessage());
      } finally {
        MDC.remove("grid.chunk");
      }
    }

    if (valid == 0) {
      log.warn("No chunk of {} produced data; nothing written", config.region());
      return new GridResult(Optional.empty(), Optional.empty(), List.of(), chunks.size(), 0, failed);
    }

    Files.createDirectories(config.outputDirectory());
    Path demPath = rasterIo.write(dem, config.output("." + rasterExtension));
    log.info("Wrote DEM {} from {} of {} chunk(s)", demPath, valid, chunks.size());
    Optional<Path> maskPath = Optional.empty();
    if (config.writeMask()) {
      maskPath = Optional.of(rasterIo.write(mask, config.output("_msk." + rasterExtension)));
      log.info("Wrote data mask {}", maskPath.get());
    }

    List<Path> uncertaintyFiles = List.of();
    if (config.uncertainty()) {
      uncertaintyFiles = estimateUncertainty(dem, mask);
    }
    return new GridResult(Optional.of(demPath), maskPath, uncertaintyFiles, chunks.size(), valid, failed);
  }

  private Optional<ChunkOutput> gridChunk(Region chunk) throws ExternalToolFailureException {
    Region processing = config.processingRegion(chunk);
    Region output = config.outputRegion(chunk);
    GridSpec grid = GridSpec.of(processing, config.cellSize(), config.nodata());

    GridAccumulator accumulator;
    try (PointStream points = resolve(processing)) {
      accumulator = binner.accumulate(points, grid);
    }
    if (accumulator.totalCount() == 0) {
      log.debug("Chunk {} holds no records", chunk);
      return Optional.empty();
    }
    Raster presence = accumulator.toRaster(BinningMode.PRESENCE);
    Raster surface;
    Optional<BinningMode> binning = config.module().binning();
    if (binning.isPresent()) {
      surface = accumulator.toRaster(binning.get());
    } else {
      // interpolation reads a second pass: cell means of the first one, or the catalog again
      try (PointStream input = config.blockMean() ? binner.blockMeans(accumulator) : resolve(processing)) {
        surface = engine.interpolate(grid, input, config.methodParams());
      }
    }

    Optional<Raster> cut = surface.cut(output);
    if (cut.isEmpty() || cut.get().validCount() == 0) {
      log.debug("Chunk {} produced no valid cells", chunk);
      return Optional.empty();
    }
    return Optional.of(new ChunkOutput(cut.get(), presence.cut(output).orElseThrow()));
  }

  private List<Path> estimateUncertainty(Raster dem, Raster mask)
      throws IOException, ExternalToolFailureException, InterruptedException {
    Optional<UncertaintyResult> result = estimator.estimate(dem, mask, config.methodParams());
    if (result.isEmpty()) {
      log.warn("Uncertainty estimate for {} produced too few samples; no uncertainty written", config.name());
      return List.of();
    }
    List<Path> files = reportWriter.write(result.get(), config.outputDirectory(), config.name());
    log.info("Wrote {} uncertainty outputs for {}", files.size(), config.name());
    return files;
  }

  private PointStream resolve(Region processing) {
    return resolver.resolve(config.datalist(), processing, config.zBounds(), config.weightOverride());
  }

  /** Sets every cell of {@code target} under a data cell of {@code tile} to {@code 1}. */
  static void markPresence(Raster target, Raster tile) {
    GridSpec spec = tile.spec();
    for (int row = 0; row < tile.height(); row++) {
      double y = spec.centerY(row);
      for (int col = 0; col < tile.width(); col++) {
        if (tile.get(col, row) > 0d) {
          int index = target.spec().cellOf(spec.centerX(col), y);
          if (index >= 0) {
            target.setAt(index, 1d);
          }
        }
      }
    }
  }

  private record ChunkOutput(Raster dem, Raster mask) {}
}
