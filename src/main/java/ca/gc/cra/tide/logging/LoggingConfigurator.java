package ca.gc.cra.tide.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import java.util.Locale;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts TIDE logging levels from CLI flags and configuration.
 * <p><strong>Why:</strong> Operators raise verbosity for a single stream run without editing {@code logback.xml}.</p>
 * <p><strong>Role:</strong> Adapter-side utility bridging {@code --verbose} and {@code logLevel=} to Logback.</p>
 * <p><strong>Thread-safety:</strong> Intended for the CLI bootstrap thread before streaming starts.</p>
 *
 * @implNote Logback only; other SLF4J bindings log a warning and keep their defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the root logger to DEBUG.
   */
  public static void enableVerboseLogging() {
    applyLevel(org.slf4j.Logger.ROOT_LOGGER_NAME, "DEBUG");
  }

  /**
   * Sets the level of one logger.
   *
   * @param loggerName logger name, or {@code ROOT}
   * @param level level name such as {@code INFO} or {@code DEBUG}
   * @return {@code true} when the level was applied
   * @throws IllegalArgumentException if {@code level} is not a Logback level name
   */
  public static boolean applyLevel(String loggerName, String level) {
    Level parsed = parseLevel(level);
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger target = context.getLogger(loggerName);
      if (!parsed.equals(target.getLevel())) {
        target.setLevel(parsed);
      }
      return true;
    }
    log.warn("Log level change for {} requested but backend {} does not support dynamic level updates",
        loggerName, factory.getClass().getName());
    return false;
  }

  static Level parseLevel(String level) {
    if (level == null || level.isBlank()) {
      throw new IllegalArgumentException("log level must not be blank");
    }
    String normalized = level.trim().toUpperCase(Locale.ROOT);
    Level parsed = Level.toLevel(normalized, null);
    if (parsed == null) {
      throw new IllegalArgumentException("unknown log level: " + level);
    }
    return parsed;
  }
}
