package com.gentoro.jobcontrol.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.ILoggerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for obtaining loggers and for applying logger levels declared in the application
 * configuration.
 *
 * <p>Levels are read from the {@code logging.level} section, one entry per logger name:
 *
 * <pre>
 * logging:
 *   level:
 *     root: INFO
 *     com.gentoro.jobcontrol.jobs: DEBUG
 * </pre>
 */
public final class LoggingService {
  private static final String LEVEL_PREFIX = "logging.level";
  private static final String ROOT = "root";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /**
   * Apply {@code logging.level.*} entries to the active Logback context. Entries with an
   * unrecognized level are reported and skipped.
   *
   * @return number of loggers whose level was changed
   */
  public static int applyConfiguration(Configuration configuration) {
    Logger log = getLogger(LoggingService.class);
    if (configuration == null) return 0;

    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (!(factory instanceof LoggerContext context)) {
      log.debug("Logback is not the active SLF4J backend, skipping level configuration");
      return 0;
    }

    Configuration levels = configuration.subset(LEVEL_PREFIX);
    int applied = 0;
    for (Iterator<String> it = levels.getKeys(); it.hasNext(); ) {
      String key = it.next();
      String value = levels.getString(key);
      // Hierarchical configurations escape dots inside a key name by doubling them.
      String loggerName = key.replace("..", ".");
      Level level = Level.toLevel(value, null);
      if (level == null) {
        log.warn("Ignoring unknown log level '{}' for logger '{}'", value, loggerName);
        continue;
      }
      ch.qos.logback.classic.Logger target =
          ROOT.equalsIgnoreCase(loggerName)
              ? context.getLogger(Logger.ROOT_LOGGER_NAME)
              : context.getLogger(loggerName);
      target.setLevel(level);
      applied++;
    }
    if (applied > 0) {
      log.debug("Applied {} logger level(s) from configuration", applied);
    }
    return applied;
  }
}
