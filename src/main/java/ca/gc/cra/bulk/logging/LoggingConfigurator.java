package ca.gc.cra.bulk.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts runtime log levels for the bulk CLI.
 * <p><strong>Why:</strong> {@code --verbose} should expose per-command and per-flush debug lines without
 * editing {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded CLI startup.</p>
 *
 * @implNote Works with Logback; other SLF4J bindings keep their configured levels and a warning is logged.
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  private static final String BULK_LOGGER = "ca.gc.cra.bulk";

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Raises the {@code ca.gc.cra.bulk} logger to DEBUG.
   *
   * @return {@code true} when the level was applied
   */
  public static boolean enableVerboseLogging() {
    return setLevel(BULK_LOGGER, Level.DEBUG);
  }

  /**
   * Sets the level of a named logger when the backend is Logback.
   *
   * @param loggerName logger to adjust; {@code ROOT} addresses the root logger
   * @param level new level
   * @return {@code true} when the level was applied
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
    log.warn("Log level change for {} requested but backend {} does not support it",
        loggerName, factory.getClass().getName());
    return false;
  }
}
