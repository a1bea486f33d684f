package ca.gc.cra.unilog.config;

import ca.gc.cra.unilog.application.logging.LoggerRegistry;
import ca.gc.cra.unilog.application.logging.StructuredLogger;
import ca.gc.cra.unilog.application.port.MetricsPort;
import ca.gc.cra.unilog.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.unilog.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.unilog.infrastructure.sink.FileLoggerFactory;
import ca.gc.cra.unilog.infrastructure.time.SystemClockAdapter;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Composition root turning a {@link LoggingConfig} into a ready {@link LoggerRegistry}.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Pick the metrics adapter from {@link LoggingConfig#metricsExporter()}.</li>
 *   <li>Build a registry over {@link FileLoggerFactory}.</li>
 *   <li>Initialize every configured logger eagerly so configuration errors surface at startup.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded startup; the registry it returns is thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class LoggingBootstrap implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(LoggingBootstrap.class);

  private final LoggerRegistry registry;
  private final MetricsPort metrics;

  private LoggingBootstrap(LoggerRegistry registry, MetricsPort metrics) {
    this.registry = registry;
    this.metrics = metrics;
  }

  /**
   * Wires metrics and a file-backed registry, then initializes every configured logger.
   *
   * @param config parsed configuration
   * @return bootstrap owning the registry and the metrics adapter
   * @throws ca.gc.cra.unilog.domain.log.LogConfigurationException when a logger cannot be created
   */
  public static LoggingBootstrap start(LoggingConfig config) {
    Objects.requireNonNull(config, "config");
    MetricsPort metrics = metricsFor(config.metricsExporter());
    LoggerRegistry registry = new LoggerRegistry(new FileLoggerFactory(new SystemClockAdapter(), metrics));
    LoggingBootstrap bootstrap = new LoggingBootstrap(registry, metrics);
    try {
      initialize(config, registry);
    } catch (RuntimeException ex) {
      try {
        bootstrap.close();
      } catch (IOException closeFailure) {
        ex.addSuppressed(closeFailure);
      }
      throw ex;
    }
    return bootstrap;
  }

  /**
   * Initializes the default logger and every named logger of {@code config} in {@code registry}.
   *
   * @param config parsed configuration
   * @param registry target registry; loggers already present are kept
   * @return the initialized loggers, default first
   * @throws ca.gc.cra.unilog.domain.log.LogConfigurationException when a logger cannot be created
   */
  public static List<StructuredLogger> initialize(LoggingConfig config, LoggerRegistry registry) {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(registry, "registry");
    List<StructuredLogger> loggers = new ArrayList<>();
    config.defaults().ifPresent(defaults -> loggers.add(registry.initializeDefault(defaults)));
    config.loggers().values().forEach(logger -> loggers.add(registry.initializeNamed(logger)));
    log.debug("Initialized {} configured logger(s)", loggers.size());
    return List.copyOf(loggers);
  }

  /**
   * Returns the registry.
   *
   * @return registry holding the configured loggers
   */
  public LoggerRegistry registry() {
    return registry;
  }

  /**
   * Returns the metrics adapter shared by all loggers.
   *
   * @return metrics adapter
   */
  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Closes all loggers, then shuts down metrics export.
   *
   * @throws IOException when a logger fails to close
   */
  @Override
  public void close() throws IOException {
    try {
      registry.close();
    } finally {
      if (metrics instanceof OpenTelemetryMetricsAdapter otel) {
        otel.close();
      }
    }
  }

  private static MetricsPort metricsFor(String exporter) {
    OpenTelemetryMetricsAdapter adapter = OpenTelemetryMetricsAdapter.forExporter(exporter);
    if (adapter.isExporting()) {
      return adapter;
    }
    return new NoOpMetricsAdapter();
  }
}
