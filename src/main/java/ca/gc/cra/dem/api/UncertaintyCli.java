package ca.gc.cra.dem.api;

import ca.gc.cra.dem.config.CompositionRoot;
import ca.gc.cra.dem.config.ResolverConfig;
import ca.gc.cra.dem.config.UncertaintyRunConfig;
import ca.gc.cra.dem.validation.Paths;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for estimating the interpolation uncertainty of an existing DEM.
 *
 * @since 0.1.0
 */
public final class UncertaintyCli {
  private static final Logger log = LoggerFactory.getLogger(UncertaintyCli.class);
  private static final String SUMMARY_USAGE =
      "usage: uncertainty dem=RASTER mask=RASTER [engine=idw|process] [name=NAME] [outDir=DIR] "
          + "[percentile=P] [sims=N] [seed=N] [config=FILE] [--dry-run]";
  private static final String HELP_TEXT = """
      dem uncertainty: estimate interpolation uncertainty by split-sample trials

      Usage:
        uncertainty dem=waffles_dem.asc mask=waffles_dem_msk.asc [options]

      Required:
        dem=RASTER               DEM to evaluate
        mask=RASTER              Data mask on the DEM grid (non-zero marks measured cells)

      Optional:
        engine=idw|process       Engine re-gridding each trial (default idw)
        param.KEY=VALUE          Engine parameter
        name=NAME                Output base name (default waffles_dem)
        outDir=DIR               Output directory (default .)
        percentile=P             Density percentile choosing training tiles
        sims=N                   Simulations per training tile
        chunkLevel=N             Tile size level
        seed=N                   Random seed
        workers=N                Trial worker threads
        config=FILE              YAML configuration (common and uncertainty sections)
        --dry-run                Validate settings and print the plan
        --verbose | --quiet      DEBUG or WARN logging
        --help                   Show this message
      """;

  private UncertaintyCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    CliConfigSupport.applyLogLevel(input, log, "uncertainty");
    CliConfigSupport.Loaded loaded = CliConfigSupport.load("uncertainty", input, log, SUMMARY_USAGE);
    if (loaded.failed()) {
      return loaded.failure();
    }
    Map<String, String> settings = loaded.settings();
    boolean dryRun = CliConfigSupport.dryRun(input, settings);

    ResolverConfig resolverConfig;
    UncertaintyRunConfig config;
    try {
      resolverConfig = ResolverConfig.fromMap(settings);
      config = UncertaintyRunConfig.fromMap(settings);
      Paths.validateWritableDir(config.outputDirectory(), !dryRun);
      Paths.requireReadableFile("dem", config.dem());
      Paths.requireReadableFile("mask", config.mask());
    } catch (IllegalArgumentException ex) {
      return CliConfigSupport.invalid(log, "Invalid uncertainty arguments: " + ex.getMessage(), SUMMARY_USAGE)
          .failure();
    }

    if (dryRun) {
      CliPrinter.printLines(
          "Uncertainty dry-run: no files will be produced.",
          " DEM              : " + config.dem(),
          " Mask             : " + config.mask(),
          " Engine           : " + config.engine() + " " + config.methodParams(),
          " Estimator        : " + config.estimator(),
          " Output prefix    : " + config.output(""),
          " Re-run without --dry-run to estimate.");
      return ExitCode.SUCCESS;
    }

    try (CompositionRoot root = new CompositionRoot(resolverConfig)) {
      List<Path> written = root.uncertaintyUseCase(config).run();
      log.info("Uncertainty for {} complete: {} file(s)", config.dem(), written.size());
      return ExitCode.SUCCESS;
    } catch (Exception ex) {
      return CliConfigSupport.failure(ex, log, "uncertainty");
    }
  }
}
