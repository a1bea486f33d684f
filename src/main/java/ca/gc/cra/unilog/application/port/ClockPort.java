package ca.gc.cra.unilog.application.port;

import java.time.Instant;

/**
 * <strong>What:</strong> Port supplying emit-time timestamps to loggers and rotation decisions to sinks.
 * <p><strong>Why:</strong> Keeps log timestamps and rotation ages deterministic under test.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; loggers read the clock on every emit.</p>
 *
 * @implNote Default implementation delegates to {@link Instant#now()}.
 * @since 0.1.0
 * @see ca.gc.cra.unilog.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current instant.
   *
   * @return wall-clock time in UTC, at the best precision the platform offers
   */
  Instant now();

  /**
   * Default {@link ClockPort} using {@link Instant#now()}.
   */
  ClockPort SYSTEM = Instant::now;
}
