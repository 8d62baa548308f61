package ca.gc.cra.dem.application.pipeline;

import ca.gc.cra.dem.application.port.ExternalToolFailureException;
import ca.gc.cra.dem.application.port.RasterInfo;
import ca.gc.cra.dem.application.port.RasterIoPort;
import ca.gc.cra.dem.application.uncertainty.UncertaintyEstimator;
import ca.gc.cra.dem.application.uncertainty.UncertaintyResult;
import ca.gc.cra.dem.config.UncertaintyRunConfig;
import ca.gc.cra.dem.domain.grid.GridSpec;
import ca.gc.cra.dem.domain.grid.Raster;
import ca.gc.cra.dem.domain.grid.SourceWindow;
import ca.gc.cra.dem.infrastructure.report.UncertaintyReportWriter;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Estimates the interpolation uncertainty of an existing DEM from its data mask.
 *
 * <p>The mask must cover the DEM grid cell for cell; any non-zero data cell counts as measured.</p>
 *
 * @since 0.1.0
 */
public final class UncertaintyUseCase {
  private static final Logger log = LoggerFactory.getLogger(UncertaintyUseCase.class);

  private final UncertaintyRunConfig config;
  private final RasterIoPort rasterIo;
  private final UncertaintyEstimator estimator;
  private final UncertaintyReportWriter reportWriter;

  public UncertaintyUseCase(
      UncertaintyRunConfig config,
      RasterIoPort rasterIo,
      UncertaintyEstimator estimator,
      UncertaintyReportWriter reportWriter) {
    this.config = Objects.requireNonNull(config, "config");
    this.rasterIo = Objects.requireNonNull(rasterIo, "rasterIo");
    this.estimator = Objects.requireNonNull(estimator, "estimator");
    this.reportWriter = Objects.requireNonNull(reportWriter, "reportWriter");
  }

  /**
   * Runs the estimate and writes its outputs.
   *
   * @return written files; empty when the trials produced too few samples
   * @throws IOException when an input cannot be read or an output written
   * @throws ExternalToolFailureException when proximity or slope cannot be computed
   * @throws InterruptedException when interrupted while waiting for trial workers
   */
  public List<Path> run() throws IOException, ExternalToolFailureException, InterruptedException {
    MDC.put("unc.dem", config.dem().getFileName().toString());
    try {
      Raster dem = readFully(config.dem());
      Raster mask = alignMask(dem.spec(), readFully(config.mask()));
      log.info("Estimating uncertainty of {} with engine {}", config.dem(), config.engine());
      Optional<UncertaintyResult> result = estimator.estimate(dem, mask, config.methodParams());
      if (result.isEmpty()) {
        log.warn("Too few error samples to fit; no uncertainty written for {}", config.dem());
        return List.of();
      }
      List<Path> files = reportWriter.write(result.get(), config.outputDirectory(), config.name());
      log.info("Wrote {} uncertainty outputs to {}", files.size(), config.outputDirectory());
      return files;
    } finally {
      MDC.remove("unc.dem");
    }
  }

  private Raster readFully(Path path) throws IOException {
    RasterInfo info = rasterIo.open(path);
    return rasterIo.readWindow(path, new SourceWindow(0, 0, info.width(), info.height()));
  }

  /** Presence raster on {@code grid}: {@code 1} where the mask holds non-zero data, else {@code 0}. */
  static Raster alignMask(GridSpec grid, Raster mask) {
    GridSpec spec = mask.spec();
    if (spec.width() != grid.width() || spec.height() != grid.height()
        || Math.abs(spec.cellSize() - grid.cellSize()) > grid.cellSize() * 1e-9
        || Math.abs(spec.region().west() - grid.region().west()) > grid.cellSize() * 1e-6
        || Math.abs(spec.region().north() - grid.region().north()) > grid.cellSize() * 1e-6) {
      throw new IllegalArgumentException("mask grid " + spec.region() + " does not match DEM grid " + grid.region());
    }
    Raster aligned = Raster.filled(grid, 0d);
    for (int i = 0; i < grid.cellCount(); i++) {
      double value = mask.getAt(i);
      if (!mask.isNoData(value) && value != 0d) {
        aligned.setAt(i, 1d);
      }
    }
    return aligned;
  }
}
