package ca.gc.cra.unilog.application.health;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.unilog.application.logging.StructuredLogger;
import ca.gc.cra.unilog.domain.log.Level;
import ca.gc.cra.unilog.infrastructure.format.JsonLineFormatter;
import ca.gc.cra.unilog.testutil.CapturingSink;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class HealthMonitorTest {
  private final CapturingSink sink = new CapturingSink();
  private final StructuredLogger logger =
      new StructuredLogger("health", Level.DEBUG, new JsonLineFormatter(), sink, null, null, null, false);

  @Test
  void healthyCheckLogsOk() {
    HealthMonitor monitor = new HealthMonitor(logger, Duration.ofSeconds(1), HealthStatus::ok);

    assertTrue(monitor.runOnce().healthy());

    assertEquals(1, sink.lines().size());
    assertTrue(sink.lines().get(0).contains("\"level\":\"INFO\""));
    assertTrue(sink.lines().get(0).contains("\"msg\":\"OK!\""));
  }

  @Test
  void failedStatusLogsError() {
    HealthMonitor monitor =
        new HealthMonitor(logger, Duration.ofSeconds(1), () -> HealthStatus.failed("db unreachable"));

    assertFalse(monitor.runOnce().healthy());

    String line = sink.lines().get(0);
    assertTrue(line.contains("\"level\":\"ERROR\""));
    assertTrue(line.contains("\"msg\":\"Health check failed: db unreachable\""));
  }

  @Test
  void throwingCheckIsReportedAsFailure() {
    HealthMonitor monitor = new HealthMonitor(logger, Duration.ofSeconds(1), () -> {
      throw new IOException("connection refused");
    });

    HealthStatus status = monitor.runOnce();

    assertEquals("java.io.IOException: connection refused", status.detail());
    assertTrue(sink.lines().get(0).contains("connection refused"));
  }

  @Test
  void nullStatusIsAFailure() {
    HealthMonitor monitor = new HealthMonitor(logger, Duration.ofSeconds(1), () -> null);

    assertEquals("no status returned", monitor.runOnce().detail());
  }

  @Test
  void rejectsNonPositiveInterval() {
    assertThrows(IllegalArgumentException.class, () -> new HealthMonitor(logger, Duration.ZERO, HealthStatus::ok));
  }

  @Test
  void scheduledChecksRunUntilClosed() throws Exception {
    CountDownLatch ran = new CountDownLatch(2);
    try (HealthMonitor monitor = HealthMonitor.start(logger, Duration.ofMillis(10), () -> {
      ran.countDown();
      return HealthStatus.ok();
    })) {
      assertTrue(ran.await(5, TimeUnit.SECONDS));
      assertThrows(IllegalStateException.class, monitor::start);
    }
    assertTrue(sink.lines().size() >= 2);
  }
}
