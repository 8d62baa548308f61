package ca.gc.cra.dem.api;

import ca.gc.cra.dem.application.port.ExternalToolFailureException;
import ca.gc.cra.dem.config.ConfigMerger;
import ca.gc.cra.dem.config.DefaultsForMode;
import ca.gc.cra.dem.config.YamlConfigLoader;
import ca.gc.cra.dem.domain.catalog.CatalogException;
import ca.gc.cra.dem.domain.catalog.SourceUnavailableException;
import ca.gc.cra.dem.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/**
 * Shared start-up of the {@code dem} subcommands: logging level, argument parsing and the
 * defaults &lt; YAML &lt; CLI merge.
 */
final class CliConfigSupport {
  private CliConfigSupport() {}

  /**
   * Outcome of loading a command's settings: either the mutable effective map or the exit code to stop with.
   *
   * @param settings effective settings, {@code null} on failure
   * @param failure exit code, {@code null} on success
   */
  record Loaded(Map<String, String> settings, ExitCode failure) {
    boolean failed() {
      return failure != null;
    }
  }

  /** Applies {@code --verbose} or {@code --quiet}. */
  static void applyLogLevel(CliInput input, Logger log, String command) {
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for {}", command);
    } else if (input.quiet()) {
      LoggingConfigurator.enableQuietLogging();
    }
  }

  /**
   * Builds the effective settings of {@code mode}.
   *
   * <p>Usage problems print {@code usage} and return {@link ExitCode#INVALID_ARGS}; an unreadable YAML file
   * returns {@link ExitCode#IO_ERROR}. Telemetry keys are consumed from the returned map.</p>
   *
   * @param mode command mode
   * @param input parsed arguments
   * @param log command logger
   * @param usage one-line usage
   * @return loaded settings or the failure exit code
   */
  static Loaded load(String mode, CliInput input, Logger log, String usage) {
    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      return invalid(log, "Invalid argument: " + ex.getMessage(), usage);
    }

    String configPath = extractConfigPath(kv);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        return invalid(log, "Configuration file does not exist: " + yamlPath, usage);
      }
      try {
        yaml = YamlConfigLoader.load(yamlPath, mode);
      } catch (IllegalArgumentException ex) {
        return invalid(log, "Invalid YAML configuration: " + ex.getMessage(), usage);
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return new Loaded(null, ExitCode.IO_ERROR);
      }
    }

    Map<String, String> effective;
    try {
      effective = new LinkedHashMap<>(
          ConfigMerger.buildEffectiveConfig(mode, yaml, kv, DefaultsForMode.asFlatMap(mode), log::warn));
      TelemetryConfigurator.configureMetrics(effective);
    } catch (IllegalArgumentException ex) {
      return invalid(log, "Invalid " + mode + " arguments: " + ex.getMessage(), usage);
    }
    if (!input.verbose() && parseBoolean(effective, "verbose")) {
      LoggingConfigurator.enableVerboseLogging();
    }
    return new Loaded(effective, null);
  }

  /** Dry runs come from {@code --dry-run} or {@code dryRun=true}. */
  static boolean dryRun(CliInput input, Map<String, String> settings) {
    return input.hasFlag("--dry-run") || parseBoolean(settings, "dryRun");
  }

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.get(key);
    return value != null && Boolean.parseBoolean(value.trim());
  }

  static Loaded invalid(Logger log, String message, String usage) {
    log.error(message);
    CliPrinter.println(usage);
    return new Loaded(null, ExitCode.INVALID_ARGS);
  }

  /**
   * Maps a failed run to its exit code and logs it.
   *
   * @param ex failure
   * @param log command logger
   * @param command command name for the log line
   * @return exit code
   */
  static ExitCode failure(Exception ex, Logger log, String command) {
    if (ex instanceof InterruptedException) {
      Thread.currentThread().interrupt();
      log.error("{} interrupted; shutting down", command);
      return ExitCode.INTERRUPTED;
    }
    if (ex instanceof IOException || ex instanceof SourceUnavailableException) {
      log.error("{} I/O failure: {}", command, ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    }
    if (ex instanceof CatalogException || ex instanceof IllegalArgumentException) {
      log.error("{} configuration error: {}", command, ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    }
    if (ex instanceof ExternalToolFailureException) {
      log.error("{} failed: {}", command, ex.getMessage(), ex);
      return ExitCode.RUNTIME_FAILURE;
    }
    log.error("Unexpected failure in {}", command, ex);
    return ExitCode.RUNTIME_FAILURE;
  }
}
