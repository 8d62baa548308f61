package ca.gc.cra.dem.api;

import ca.gc.cra.dem.config.CatalogConfig;
import ca.gc.cra.dem.config.CompositionRoot;
import ca.gc.cra.dem.config.ResolverConfig;
import java.io.BufferedWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for inspecting catalogs: list entries, build extent caches, dump records.
 *
 * @since 0.1.0
 */
public final class CatalogCli {
  private static final Logger log = LoggerFactory.getLogger(CatalogCli.class);
  private static final String SUMMARY_USAGE =
      "usage: catalog datalist=PATH [action=list|inf|dump] [region=W/E/S/N] [lower=Z] [upper=Z] "
          + "[weights=true] [dumpWeights=true] [out=FILE] [overwriteInf=true] [config=FILE]";
  private static final String HELP_TEXT = """
      dem catalog: inspect a catalog

      Usage:
        catalog datalist=survey.datalist action=dump region=-70/-69/42/43

      Actions:
        list                     One line per direct entry: source, kind, weight, metadata
        inf                      Compute (and cache) the extent of the catalog tree
        dump                     Resolve the tree and print x y z [w] per record

      Options:
        datalist=PATH            Root catalog, point file or raster
        region=W/E/S/N           Query region for dump
        lower=Z upper=Z          Elevation filter for dump
        weights=true             Apply catalog weights
        dumpWeights=true         Print the record weight as a fourth column
        out=FILE                 Write dump output to FILE instead of stdout
        overwriteInf=true        Recompute existing .inf extent caches
        config=FILE              YAML configuration (common and catalog sections)
        --verbose | --quiet      DEBUG or WARN logging
        --help                   Show this message
      """;

  private CatalogCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    CliConfigSupport.applyLogLevel(input, log, "catalog");
    CliConfigSupport.Loaded loaded = CliConfigSupport.load("catalog", input, log, SUMMARY_USAGE);
    if (loaded.failed()) {
      return loaded.failure();
    }
    Map<String, String> settings = loaded.settings();

    ResolverConfig resolverConfig;
    CatalogConfig config;
    try {
      resolverConfig = ResolverConfig.fromMap(settings);
      config = CatalogConfig.fromMap(settings);
    } catch (IllegalArgumentException ex) {
      return CliConfigSupport.invalid(log, "Invalid catalog arguments: " + ex.getMessage(), SUMMARY_USAGE)
          .failure();
    }

    try (CompositionRoot root = new CompositionRoot(resolverConfig)) {
      if (config.output().isPresent()) {
        Path target = config.output().get();
        try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
          root.catalogUseCase(config).run(writer);
        }
        log.info("Catalog output written to {}", target);
      } else {
        Writer writer = CliPrinter.writer();
        root.catalogUseCase(config).run(writer);
      }
      return ExitCode.SUCCESS;
    } catch (Exception ex) {
      return CliConfigSupport.failure(ex, log, "catalog");
    }
  }
}
