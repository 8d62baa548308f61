package ca.gc.cra.dem.api;

import ca.gc.cra.dem.config.CompositionRoot;
import ca.gc.cra.dem.config.ResolverConfig;
import ca.gc.cra.dem.config.SpatialMetadataConfig;
import ca.gc.cra.dem.domain.region.RegionFormat;
import ca.gc.cra.dem.validation.Paths;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for writing the spatial metadata layer of a catalog.
 *
 * @since 0.1.0
 */
public final class SpatialMetadataCli {
  private static final Logger log = LoggerFactory.getLogger(SpatialMetadataCli.class);
  private static final String SUMMARY_USAGE =
      "usage: spatial datalist=PATH region=W/E/S/N inc=SIZE [name=NAME] [outDir=DIR] [extend=N] "
          + "[workers=N] [config=FILE] [--dry-run]";
  private static final String HELP_TEXT = """
      dem spatial: polygonize where each sub-catalog has data

      Usage:
        spatial datalist=survey.datalist region=-70/-69/42/43 inc=1s [options]

      Required:
        datalist=PATH            Root catalog whose sub-catalogs are described
        region=W/E/S/N           Region of interest
        inc=SIZE                 Mask cell size (never finer than 1/3 arc-second)

      Optional:
        name=NAME                Output base name; writes <name>_sm.geojson (default waffles_dem)
        outDir=DIR               Output directory (default .)
        extend=N extendProc=N    Cells added around the region and gathered for processing
        weights=true             Apply catalog weights
        workers=N                Worker threads (default 3)
        config=FILE              YAML configuration (common and spatial sections)
        --dry-run                Validate settings and print the plan
        --verbose | --quiet      DEBUG or WARN logging
        --help                   Show this message
      """;

  private SpatialMetadataCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    CliConfigSupport.applyLogLevel(input, log, "spatial");
    CliConfigSupport.Loaded loaded = CliConfigSupport.load("spatial", input, log, SUMMARY_USAGE);
    if (loaded.failed()) {
      return loaded.failure();
    }
    Map<String, String> settings = loaded.settings();
    boolean dryRun = CliConfigSupport.dryRun(input, settings);

    ResolverConfig resolverConfig;
    SpatialMetadataConfig config;
    try {
      resolverConfig = ResolverConfig.fromMap(settings);
      config = SpatialMetadataConfig.fromMap(settings);
      Paths.validateWritableDir(config.outputDirectory(), !dryRun);
    } catch (IllegalArgumentException ex) {
      return CliConfigSupport.invalid(log, "Invalid spatial arguments: " + ex.getMessage(), SUMMARY_USAGE)
          .failure();
    }

    if (dryRun) {
      CliPrinter.printLines(
          "Spatial metadata dry-run: no files will be produced.",
          " Catalog          : " + config.datalist(),
          " Mask region      : " + config.maskRegion().format(RegionFormat.GMT),
          " Cell size        : " + config.cellSize(),
          " Workers          : " + config.workers(),
          " Layer            : " + config.layerPath(),
          " Re-run without --dry-run to polygonize.");
      return ExitCode.SUCCESS;
    }

    try (CompositionRoot root = new CompositionRoot(resolverConfig)) {
      long features = root.spatialMetadataUseCase(config).run();
      log.info("Spatial metadata for {} complete: {} feature(s) in {}", config.datalist(), features,
          config.layerPath());
      return ExitCode.SUCCESS;
    } catch (Exception ex) {
      return CliConfigSupport.failure(ex, log, "spatial");
    }
  }
}
