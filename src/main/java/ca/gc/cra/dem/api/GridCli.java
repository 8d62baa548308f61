package ca.gc.cra.dem.api;

import ca.gc.cra.dem.application.pipeline.GridResult;
import ca.gc.cra.dem.config.CompositionRoot;
import ca.gc.cra.dem.config.GridConfig;
import ca.gc.cra.dem.config.ResolverConfig;
import ca.gc.cra.dem.config.UncertaintyConfig;
import ca.gc.cra.dem.domain.grid.GridSpec;
import ca.gc.cra.dem.domain.region.RegionFormat;
import ca.gc.cra.dem.validation.Paths;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for building a DEM from a catalog.
 *
 * @since 0.1.0
 */
public final class GridCli {
  private static final Logger log = LoggerFactory.getLogger(GridCli.class);
  private static final String SUMMARY_USAGE =
      "usage: grid datalist=PATH region=W/E/S/N inc=SIZE [module=num|mean|mask|idw|process] [name=NAME] "
          + "[outDir=DIR] [extend=N] [extendProc=N] [chunk=N] [mask=true] [unc=true] [config=FILE] [--dry-run]";
  private static final String HELP_TEXT = """
      dem grid: build a DEM from a catalog

      Usage:
        grid datalist=survey.datalist region=-70/-69/42/43 inc=1s [options]

      Required:
        datalist=PATH            Root catalog (or a single point/raster file)
        region=W/E/S/N           Output region; GMT -R style, optional /zmin/zmax
        inc=SIZE                 Cell size; suffix s (arc-seconds) or m (arc-minutes)

      Optional:
        module=NAME              num, mean, mask, idw or process (default mean)
        param.KEY=VALUE          Module parameter, e.g. param.power=2 or param.cmd=surface
        name=NAME                Output base name (default waffles_dem)
        outDir=DIR               Output directory (default .)
        extend=N                 Cells added around the output region (default 0)
        extendProc=N             Further cells of input gathered for processing (default 10)
        lower=Z upper=Z          Elevation filter
        weights=true             Apply catalog weights
        blockMean=true           Block-average input before interpolating
        chunk=N                  Process in tiles of N x N cells
        mask=true                Also write the <name>_msk data mask
        unc=true                 Estimate interpolation uncertainty (idw and process modules)
        nodata=VALUE             Nodata value (default -9999)
        weightPropagation=MODE   COMPOUND or ROOT_ONLY
        srcEpsg=N dstEpsg=N      Reproject input points
        config=FILE              YAML configuration (common and grid sections)
        --dry-run                Validate settings and print the plan
        metricsExporter=otlp|none  Metrics exporter (default none)
        --verbose | --quiet      DEBUG or WARN logging
        --help                   Show this message
      """;

  private GridCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    CliConfigSupport.applyLogLevel(input, log, "grid");
    CliConfigSupport.Loaded loaded = CliConfigSupport.load("grid", input, log, SUMMARY_USAGE);
    if (loaded.failed()) {
      return loaded.failure();
    }
    Map<String, String> settings = loaded.settings();
    boolean dryRun = CliConfigSupport.dryRun(input, settings);

    ResolverConfig resolverConfig;
    GridConfig config;
    UncertaintyConfig estimatorConfig;
    try {
      resolverConfig = ResolverConfig.fromMap(settings);
      config = GridConfig.fromMap(settings);
      Paths.validateWritableDir(config.outputDirectory(), !dryRun);
      estimatorConfig = UncertaintyConfig.fromMap(settings);
    } catch (IllegalArgumentException ex) {
      return CliConfigSupport.invalid(log, "Invalid grid arguments: " + ex.getMessage(), SUMMARY_USAGE)
          .failure();
    }

    if (dryRun) {
      printDryRunPlan(config, resolverConfig);
      return ExitCode.SUCCESS;
    }

    try (CompositionRoot root = new CompositionRoot(resolverConfig)) {
      GridResult result = root.gridUseCase(config, estimatorConfig).run();
      if (result.dem().isEmpty()) {
        log.warn("Grid {} produced no data; no DEM written", config.name());
      } else {
        log.info("Grid {} complete: {} ({} of {} chunk(s) valid, {} failed)", config.name(),
            result.dem().get(), result.validChunks(), result.chunks(), result.failedChunks());
      }
      return ExitCode.SUCCESS;
    } catch (Exception ex) {
      return CliConfigSupport.failure(ex, log, "grid");
    }
  }

  private static void printDryRunPlan(GridConfig config, ResolverConfig resolverConfig) {
    GridSpec grid = config.outputGrid();
    CliPrinter.printLines(
        "Grid dry-run: no files will be produced.",
        " Catalog          : " + config.datalist(),
        " Region           : " + config.region().format(RegionFormat.GMT),
        " Output region    : " + config.outputRegion().format(RegionFormat.GMT),
        " Cell size        : " + config.cellSize(),
        " Grid size        : " + grid.width() + " x " + grid.height(),
        " Module           : " + config.module().engineName(),
        " Module params    : " + config.methodParams(),
        " Chunk cells      : " + (config.chunkCells().isPresent() ? config.chunkCells().getAsInt() : "<none>"),
        " Weights          : " + config.weights() + " (" + resolverConfig.weightPropagation() + ")",
        " Data mask        : " + config.writeMask(),
        " Uncertainty      : " + config.uncertainty(),
        " Output           : " + config.output("." + CompositionRoot.RASTER_EXTENSION),
        " Re-run without --dry-run to grid.");
  }
}
