package ca.gc.cra.relay.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts relay logging at runtime for CLI-driven runs.
 * <ul>
 *   <li>Raise the root level to DEBUG for {@code --verbose}.</li>
 *   <li>Apply {@code service.telemetry.logs.level} from the configuration document.</li>
 * </ul>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to a warning and keep their defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the root logger level to DEBUG within the running JVM.
   */
  public static void enableVerboseLogging() {
    setRootLevel("DEBUG");
  }

  /**
   * Sets the root logger level.
   *
   * @param level level name such as {@code info} or {@code debug}; unknown names fall back to INFO
   * @return {@code true} when the backend accepted the change
   */
  public static boolean setRootLevel(String level) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      Level target = Level.toLevel(level, Level.INFO);
      if (!target.equals(root.getLevel())) {
        root.setLevel(target);
      }
      return true;
    }
    log.warn("Log level {} requested but backend {} does not support dynamic level updates",
        level, factory.getClass().getName());
    return false;
  }
}
