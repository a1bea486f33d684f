package ca.gc.cra.unilog.application.logging;

import ca.gc.cra.unilog.application.port.LogFormatter;
import ca.gc.cra.unilog.application.port.LogSink;
import ca.gc.cra.unilog.application.port.MetricsPort;
import ca.gc.cra.unilog.domain.log.Level;
import ca.gc.cra.unilog.domain.log.LogEvent;
import ca.gc.cra.unilog.logging.Logs;
import java.io.IOException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Mirrors events at or above a threshold to a secondary sink.
 * <p><strong>Why:</strong> Operators get a file holding only errors while the primary file stays complete.</p>
 * <p><strong>Role:</strong> Optional collaborator owned by a {@link StructuredLogger}; it exclusively owns the
 * secondary sink.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the sink, which serializes its own writes.</p>
 * <p><strong>Observability:</strong> Failed forwards are logged at WARN and counted as
 * {@code router.forward.failures}; they never reach the caller of the logger.</p>
 *
 * @since 0.1.0
 */
public final class SeverityRouter implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(SeverityRouter.class);
  private static final int PREVIEW_BYTES = 256;

  private final Level threshold;
  private final LogFormatter formatter;
  private final LogSink secondary;
  private final MetricsPort metrics;

  /**
   * Creates a router.
   *
   * @param threshold minimum level that is mirrored
   * @param formatter formatter shared with the owning logger
   * @param secondary sink receiving mirrored events; owned by this router
   * @param metrics metrics adapter; falls back to {@link MetricsPort#NO_OP} when {@code null}
   */
  public SeverityRouter(Level threshold, LogFormatter formatter, LogSink secondary, MetricsPort metrics) {
    this.threshold = Objects.requireNonNull(threshold, "threshold");
    this.formatter = Objects.requireNonNull(formatter, "formatter");
    this.secondary = Objects.requireNonNull(secondary, "secondary");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Creates a router mirroring {@link Level#ERROR} and above.
   *
   * @param formatter formatter shared with the owning logger
   * @param secondary error sink
   * @param metrics metrics adapter
   * @return router
   */
  public static SeverityRouter errorMirror(LogFormatter formatter, LogSink secondary, MetricsPort metrics) {
    return new SeverityRouter(Level.ERROR, formatter, secondary, metrics);
  }

  /**
   * Re-renders and forwards the event when its level meets the threshold.
   *
   * @param event event already written to the primary sink
   * @return what happened to the event
   */
  public Outcome forward(LogEvent event) {
    if (!event.level().isAtLeast(threshold)) {
      return Outcome.SKIPPED;
    }
    try {
      secondary.append(formatter.render(event));
      return Outcome.FORWARDED;
    } catch (IOException | RuntimeException ex) {
      metrics.increment("router.forward.failures");
      log.warn("Failed to mirror {} event to {}: {}", event.level(), secondary.path(),
          Logs.truncate(event.message(), PREVIEW_BYTES), ex);
      return Outcome.FAILED;
    }
  }

  /**
   * Returns the mirroring threshold.
   *
   * @return minimum mirrored level
   */
  public Level threshold() {
    return threshold;
  }

  /**
   * Returns the secondary sink.
   *
   * @return error sink
   */
  public LogSink secondary() {
    return secondary;
  }

  /**
   * Closes the secondary sink.
   *
   * @throws IOException if closing fails
   */
  @Override
  public void close() throws IOException {
    secondary.close();
  }

  /** Result of {@link #forward(LogEvent)}. */
  public enum Outcome {
    /** Below threshold. */
    SKIPPED,
    /** Written to the secondary sink. */
    FORWARDED,
    /** The secondary write failed; already reported. */
    FAILED
  }
}
