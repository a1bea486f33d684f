package ca.gc.cra.unilog.application.health;

import ca.gc.cra.unilog.application.logging.StructuredLogger;
import ca.gc.cra.unilog.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs a {@link HealthCheck} at a fixed interval and logs the outcome.
 * <p><strong>Role:</strong> Background collaborator writing through a {@link StructuredLogger}: {@code INFO "OK!"}
 * when healthy, {@code ERROR "Health check failed: <cause>"} otherwise.</p>
 * <p><strong>Thread-safety:</strong> Checks run on one daemon thread; {@link #close()} may be called from any
 * thread.</p>
 *
 * @since 0.1.0
 */
public final class HealthMonitor implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);
  static final String HEALTHY_MESSAGE = "OK!";
  static final String FAILURE_PREFIX = "Health check failed: ";

  private final StructuredLogger logger;
  private final Duration interval;
  private final HealthCheck check;
  private ScheduledExecutorService scheduler;

  /**
   * Creates a monitor; call {@link #start()} to schedule it.
   *
   * @param logger destination of the health lines
   * @param interval delay between checks; the first check runs after one interval
   * @param check probe to run
   */
  public HealthMonitor(StructuredLogger logger, Duration interval, HealthCheck check) {
    this.logger = Objects.requireNonNull(logger, "logger");
    this.interval = Objects.requireNonNull(interval, "interval");
    this.check = Objects.requireNonNull(check, "check");
    if (interval.isZero() || interval.isNegative()) {
      throw new IllegalArgumentException("interval must be positive");
    }
  }

  /**
   * Creates and starts a monitor.
   *
   * @param logger destination of the health lines
   * @param interval delay between checks
   * @param check probe to run
   * @return running monitor; close it to stop
   */
  public static HealthMonitor start(StructuredLogger logger, Duration interval, HealthCheck check) {
    HealthMonitor monitor = new HealthMonitor(logger, interval, check);
    monitor.start();
    return monitor;
  }

  /**
   * Schedules the periodic check.
   *
   * @throws IllegalStateException when already started
   */
  public synchronized void start() {
    if (scheduler != null) {
      throw new IllegalStateException("Health monitor already started");
    }
    scheduler = ExecutorFactories.newDaemonScheduler(
        "unilog-health", (thread, ex) -> log.error("Health monitor thread {} failed", thread.getName(), ex));
    long nanos = interval.toNanos();
    scheduler.scheduleAtFixedRate(this::runOnce, nanos, nanos, TimeUnit.NANOSECONDS);
  }

  /**
   * Runs the check once and logs its outcome.
   *
   * @return the status that was logged
   */
  public HealthStatus runOnce() {
    HealthStatus status;
    try {
      status = Objects.requireNonNullElse(check.check(), HealthStatus.failed("no status returned"));
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      status = HealthStatus.failed("interrupted");
    } catch (Exception ex) {
      status = HealthStatus.failed(ex.toString());
    }
    if (status.healthy()) {
      logger.info(HEALTHY_MESSAGE);
    } else {
      logger.error(FAILURE_PREFIX + status.detail());
    }
    return status;
  }

  /** Stops the schedule; a check already running finishes. */
  @Override
  public synchronized void close() {
    if (scheduler != null) {
      scheduler.shutdownNow();
      scheduler = null;
    }
  }
}
