package ca.gc.cra.dem.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Configures runtime logging for CLI-driven workflows.
 * <p><strong>Why:</strong> Lets operators see per-entry resolution and per-trial details with
 * {@code --verbose} without editing {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded CLI startup.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to a warning and keep their defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  static final String APPLICATION_LOGGER = "ca.gc.cra.dem";

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the application logger to DEBUG within the running JVM.
   */
  public static void enableVerboseLogging() {
    setApplicationLevel(Level.DEBUG);
  }

  /**
   * Restricts the application logger to WARN and above, used by {@code --quiet}.
   */
  public static void enableQuietLogging() {
    setApplicationLevel(Level.WARN);
  }

  private static void setApplicationLevel(Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger app = context.getLogger(APPLICATION_LOGGER);
      if (!level.equals(app.getLevel())) {
        app.setLevel(level);
      }
      return;
    }
    log.warn("Log level {} requested but backend {} does not support dynamic level updates",
        level, factory.getClass().getName());
  }
}
