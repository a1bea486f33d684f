package ca.gc.cra.unilog.infrastructure.time;

import ca.gc.cra.unilog.application.port.ClockPort;
import java.time.Clock;
import java.time.Instant;
import java.util.Objects;

/**
 * {@link ClockPort} implementation backed by a {@link Clock}, UTC by default.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  private final Clock clock;

  /**
   * Creates an adapter over the UTC system clock.
   */
  public SystemClockAdapter() {
    this(Clock.systemUTC());
  }

  /**
   * Creates an adapter over the supplied clock.
   *
   * @param clock time source, for example {@link Clock#fixed} in tests
   */
  public SystemClockAdapter(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Returns the current instant.
   *
   * @return current instant
   * @implNote {@link Clock#systemUTC()} reports microsecond precision on most JDK 17 platforms.
   */
  @Override
  public Instant now() {
    return clock.instant();
  }
}
