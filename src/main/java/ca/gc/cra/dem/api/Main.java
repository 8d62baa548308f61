package ca.gc.cra.dem.api;

import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code dem} command dispatcher.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: dem <grid|uncertainty|catalog|spatial> [options]";
  private static final String HELP_TEXT = """
      dem: gridded elevation models from heterogeneous survey catalogs

      Usage:
        dem <command> [options]

      Commands:
        grid         Build a DEM from a catalog (grid --help for details)
        uncertainty  Estimate interpolation uncertainty of a DEM
        catalog      List, measure or dump a catalog
        spatial      Polygonize the coverage of each sub-catalog

      Global flags:
        --help       Show this message
      """;

  private Main() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Dispatches to a subcommand without exiting the JVM.
   *
   * @param args dispatcher arguments; the first non-flag token names the command
   * @return exit code of the subcommand
   */
  static ExitCode run(String[] args) {
    if (args == null || args.length == 0) {
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String command = args[0].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = Arrays.copyOfRange(args, 1, args.length);
    return switch (command) {
      case "grid" -> GridCli.run(delegateArgs);
      case "uncertainty" -> UncertaintyCli.run(delegateArgs);
      case "catalog" -> CatalogCli.run(delegateArgs);
      case "spatial" -> SpatialMetadataCli.run(delegateArgs);
      case "--help", "-h", "help" -> {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        yield ExitCode.SUCCESS;
      }
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
