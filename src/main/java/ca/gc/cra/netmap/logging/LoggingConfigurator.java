package ca.gc.cra.netmap.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts NETMAP logging verbosity from the command line.
 * <p><strong>Role:</strong> Adapter-side utility bridging the {@code --verbose} flag to Logback.</p>
 * <p><strong>Thread-safety:</strong> Intended for the single CLI bootstrap thread.</p>
 *
 * @implNote Only Logback supports the level change; other SLF4J bindings keep their defaults and
 *     a warning is logged.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  static final String APPLICATION_LOGGER = "ca.gc.cra.netmap";
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Raises the {@code ca.gc.cra.netmap} logger to DEBUG. Third-party loggers keep the level from
   * {@code logback.xml}.
   *
   * @return {@code true} when the level was changed or already DEBUG
   */
  public static boolean enableVerboseLogging() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger app = context.getLogger(APPLICATION_LOGGER);
      if (!Level.DEBUG.equals(app.getLevel())) {
        app.setLevel(Level.DEBUG);
      }
      return true;
    }
    log.warn("Verbose logging requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
    return false;
  }
}
