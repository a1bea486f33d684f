package ca.gc.cra.unilog.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Parsed logging configuration: the optional default logger, the named loggers, and the metrics exporter.
 *
 * @param defaultLogger configuration of the anonymous default logger; {@code null} when not configured
 * @param loggers named logger configurations keyed by name, in declaration order
 * @param metricsExporter {@code otlp} or {@code none}; {@code null} leaves the choice to the environment
 * @since 0.1.0
 */
public record LoggingConfig(LoggerConfig defaultLogger, Map<String, LoggerConfig> loggers, String metricsExporter) {

  /**
   * Copies the logger map, keeping declaration order.
   */
  public LoggingConfig {
    loggers = loggers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(loggers));
  }

  /**
   * Returns a configuration without loggers.
   *
   * @return empty configuration
   */
  public static LoggingConfig empty() {
    return new LoggingConfig(null, Map.of(), null);
  }

  /**
   * Returns the default logger configuration.
   *
   * @return configuration, or empty when no {@code defaults} section was given
   */
  public Optional<LoggerConfig> defaults() {
    return Optional.ofNullable(defaultLogger);
  }
}
