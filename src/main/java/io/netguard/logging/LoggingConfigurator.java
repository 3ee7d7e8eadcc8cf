package io.netguard.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * Switches NetGuard logging to DEBUG at runtime when the CLI receives {@code --verbose}.
 *
 * <p>Only Logback supports the switch; other SLF4J backends keep their configuration and a warning is logged.</p>
 *
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  static final String APPLICATION_LOGGER = "io.netguard";

  private LoggingConfigurator() {
    // Utility
  }

  /** Raises the root and {@code io.netguard} loggers to DEBUG. */
  public static void enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      setDebug(context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME));
      setDebug(context.getLogger(APPLICATION_LOGGER));
      return;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
  }

  private static void setDebug(Logger logger) {
    if (!Level.DEBUG.equals(logger.getLevel())) {
      logger.setLevel(Level.DEBUG);
    }
  }
}
