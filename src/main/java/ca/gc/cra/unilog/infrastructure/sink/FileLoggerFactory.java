package ca.gc.cra.unilog.infrastructure.sink;

import ca.gc.cra.unilog.application.logging.SeverityRouter;
import ca.gc.cra.unilog.application.logging.StructuredLogger;
import ca.gc.cra.unilog.application.port.ClockPort;
import ca.gc.cra.unilog.application.port.LogFormatter;
import ca.gc.cra.unilog.application.port.MetricsPort;
import ca.gc.cra.unilog.application.port.StructuredLoggerFactory;
import ca.gc.cra.unilog.config.LoggerConfig;
import ca.gc.cra.unilog.domain.log.ErrorMirrorNames;
import ca.gc.cra.unilog.infrastructure.format.JsonLineFormatter;
import java.io.IOException;
import java.util.Objects;

/**
 * Builds file-backed loggers: a JSON-lines formatter, a rotating primary file, and, when
 * {@link LoggerConfig#errorSplit()} is set, a rotating {@code <base>_error<ext>} mirror for ERROR and FATAL events.
 *
 * <p>All sinks of one logger share its {@link ca.gc.cra.unilog.config.RotationPolicy}. If the mirror cannot be
 * opened the primary file is closed again before the failure propagates.</p>
 *
 * @since 0.1.0
 */
public final class FileLoggerFactory implements StructuredLoggerFactory {
  private final ClockPort clock;
  private final MetricsPort metrics;

  /** Creates a factory using the system clock and no metrics. */
  public FileLoggerFactory() {
    this(ClockPort.SYSTEM, MetricsPort.NO_OP);
  }

  /**
   * Creates a factory.
   *
   * @param clock timestamp source for events and rotation
   * @param metrics metrics adapter shared by every logger built here
   */
  public FileLoggerFactory(ClockPort clock, MetricsPort metrics) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public StructuredLogger create(LoggerConfig config) {
    Objects.requireNonNull(config, "config");
    LogFormatter formatter = new JsonLineFormatter(metrics);
    RotatingFileSink primary =
        new RotatingFileSink(config.directory(), config.fileName(), config.rotation(), clock, metrics);
    SeverityRouter router = null;
    if (config.errorSplit()) {
      try {
        RotatingFileSink errors = new RotatingFileSink(
            config.directory(),
            ErrorMirrorNames.deriveErrorFileName(config.fileName()),
            config.rotation(),
            clock,
            metrics);
        router = SeverityRouter.errorMirror(formatter, errors, metrics);
      } catch (RuntimeException ex) {
        try {
          primary.close();
        } catch (IOException closeFailure) {
          ex.addSuppressed(closeFailure);
        }
        throw ex;
      }
    }
    return new StructuredLogger(
        config.name(),
        config.minimumLevel(),
        formatter,
        primary,
        router,
        clock,
        metrics,
        config.reportCaller());
  }
}
