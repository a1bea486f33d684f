package ca.gc.cra.unilog.application.port;

import ca.gc.cra.unilog.application.logging.StructuredLogger;
import ca.gc.cra.unilog.config.LoggerConfig;

/**
 * Builds a {@link StructuredLogger} from its configuration.
 *
 * <p>The registry calls this at most once per successful initialization of a name, from whichever thread wins
 * the race; implementations need not be idempotent themselves.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.unilog.infrastructure.sink.FileLoggerFactory
 */
@FunctionalInterface
public interface StructuredLoggerFactory {
  /**
   * Creates a logger.
   *
   * @param config logger configuration
   * @return fully constructed logger
   * @throws ca.gc.cra.unilog.domain.log.LogConfigurationException if sinks cannot be created
   */
  StructuredLogger create(LoggerConfig config);
}
