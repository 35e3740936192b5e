package com.gentoro.graphdsl.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import java.util.Iterator;
import org.apache.commons.configuration2.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logger access for the engine.
 *
 * <p>Levels come from {@code logback.xml} and can be overridden from application configuration:
 *
 * <pre>
 * logging:
 *   level:
 *     root: WARN
 *     com.gentoro.graphdsl.engine: DEBUG
 *     graphdsl.print: INFO
 * </pre>
 */
public final class LoggingService {

  /** Receives {@code print} output when {@code graphdsl.print.target} is {@code log}. */
  public static final String PRINT_LOGGER = "graphdsl.print";

  static final String LEVEL_PREFIX = "logging.level";

  private static final Logger log = LoggerFactory.getLogger(LoggingService.class);

  private LoggingService() {}

  public static Logger getLogger(Class<?> type) {
    return LoggerFactory.getLogger(type);
  }

  public static Logger printLogger() {
    return LoggerFactory.getLogger(PRINT_LOGGER);
  }

  /**
   * Apply the {@code logging.level.<logger>} entries of the configuration to Logback. {@code root}
   * names the root logger. Unknown levels are skipped with a warning.
   *
   * @return how many loggers had their level set
   */
  public static int applyConfiguration(Configuration config) {
    if (config == null) {
      return 0;
    }
    if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
      log.warn("SLF4J is not bound to Logback; ignoring {}.* settings", LEVEL_PREFIX);
      return 0;
    }
    int applied = 0;
    Iterator<String> keys = config.getKeys(LEVEL_PREFIX);
    while (keys.hasNext()) {
      String key = keys.next();
      if (key.length() <= LEVEL_PREFIX.length() + 1) {
        continue;
      }
      // hierarchical configurations escape the dots of a logger name as ".."
      String name = key.substring(LEVEL_PREFIX.length() + 1).replace("..", ".");
      if ("root".equalsIgnoreCase(name)) {
        name = Logger.ROOT_LOGGER_NAME;
      }
      String value = config.getString(key, "");
      Level level = Level.toLevel(value.trim(), null);
      if (level == null) {
        log.warn("Unknown log level '{}' for logger {}; ignored", value, name);
        continue;
      }
      context.getLogger(name).setLevel(level);
      log.debug("Logger {} set to {}", name, level);
      applied++;
    }
    return applied;
  }
}
