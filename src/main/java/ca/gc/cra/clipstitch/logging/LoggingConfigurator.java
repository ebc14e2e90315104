package ca.gc.cra.clipstitch.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts logging for CLI runs.
 * <p><strong>Role:</strong> Bridges the {@code --verbose} flag to the Logback backend.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded CLI startup.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings keep their configuration and a warning is logged.
 * @since 0.1.0
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  /** Logger namespace of the application. */
  public static final String APPLICATION_LOGGER = "ca.gc.cra.clipstitch";

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Lowers the application logger and the root logger to DEBUG.
   */
  public static void enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger root = context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
      if (!Level.DEBUG.equals(root.getLevel())) {
        root.setLevel(Level.DEBUG);
      }
      context.getLogger(APPLICATION_LOGGER).setLevel(Level.DEBUG);
      // mp4parser logs every box it touches at DEBUG.
      context.getLogger("com.googlecode.mp4parser").setLevel(Level.INFO);
      context.getLogger("com.coremedia").setLevel(Level.INFO);
      return;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
  }
}
