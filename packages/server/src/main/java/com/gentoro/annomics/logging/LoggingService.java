package com.gentoro.annomics.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single entry point for obtaining loggers and for applying the {@code logging.level.*} keys of
 * the application configuration to Logback.
 */
public final class LoggingService {
  private static final String LEVEL_PREFIX = "logging.level";

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  /**
   * Apply logger levels declared as {@code logging.level.<logger>: <LEVEL>}. The special logger
   * name {@code root} targets the root logger. Unknown level names fall back to INFO, as Logback
   * does.
   */
  public static void applyConfiguration(Configuration configuration) {
    if (configuration == null) return;
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
      return;
    }

    Configuration levels = configuration.subset(LEVEL_PREFIX);
    for (Iterator<String> it = levels.getKeys(); it.hasNext(); ) {
      String name = it.next();
      String value = levels.getString(name);
      if (value == null || value.isBlank()) continue;

      // hierarchical keys escape literal dots as ".."
      String unescaped = name.replace("..", ".");
      String loggerName =
          "root".equalsIgnoreCase(unescaped) ? Logger.ROOT_LOGGER_NAME : unescaped;
      context.getLogger(loggerName).setLevel(Level.toLevel(value.trim(), Level.INFO));
    }
  }
}
