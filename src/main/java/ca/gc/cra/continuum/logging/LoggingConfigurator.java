package ca.gc.cra.continuum.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Bridges the CLI {@code --verbose} flag to the logging backend.
 * <p>Verbose mode raises the service's own loggers to DEBUG while client libraries (Kafka, OkHttp,
 * OpenTelemetry) stay at their configured level, so debug output never includes wire dumps.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded CLI startup.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings log a warning and keep their defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  private static final String SERVICE_LOGGER = "ca.gc.cra.continuum";

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the service loggers to DEBUG within the running JVM.
   */
  public static void enableVerboseLogging() {
    setLevel(SERVICE_LOGGER, Level.DEBUG);
  }

  /**
   * Sets the level of a named logger.
   *
   * @param loggerName logger name, or {@code ROOT}
   * @param level target level
   * @return {@code true} when the backend accepted the change
   */
  static boolean setLevel(String loggerName, Level level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger logger = context.getLogger(loggerName);
      if (!level.equals(logger.getLevel())) {
        logger.setLevel(level);
      }
      return true;
    }
    log.warn("Logger level change for {} requested but backend {} does not support dynamic level updates",
        loggerName, factory.getClass().getName());
    return false;
  }
}
