package ca.gc.cra.unilog.testutil;

import ca.gc.cra.unilog.application.port.ClockPort;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/** Test clock that only moves when told to. */
public final class MutableClock implements ClockPort {
  private final AtomicReference<Instant> now;

  public MutableClock(Instant start) {
    this.now = new AtomicReference<>(start);
  }

  @Override
  public Instant now() {
    return now.get();
  }

  public void advance(Duration duration) {
    now.updateAndGet(current -> current.plus(duration));
  }
}
