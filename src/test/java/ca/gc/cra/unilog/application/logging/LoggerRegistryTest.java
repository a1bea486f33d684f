package ca.gc.cra.unilog.application.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.unilog.application.port.StructuredLoggerFactory;
import ca.gc.cra.unilog.config.LoggerConfig;
import ca.gc.cra.unilog.domain.log.Level;
import ca.gc.cra.unilog.domain.log.LogConfigurationException;
import ca.gc.cra.unilog.domain.log.LoggerNotInitializedException;
import ca.gc.cra.unilog.infrastructure.format.JsonLineFormatter;
import ca.gc.cra.unilog.testutil.CapturingSink;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LoggerRegistryTest {
  @TempDir Path tempDir;

  private final CountingFactory factory = new CountingFactory();
  private final LoggerRegistry registry = new LoggerRegistry(factory);

  @Test
  void initializingTwiceReturnsFirstInstance() {
    StructuredLogger first = registry.initializeNamed("svc", "warn", tempDir);
    StructuredLogger second = registry.initializeNamed("svc", "debug", tempDir);

    assertSame(first, second);
    assertEquals(Level.WARN, second.minimumLevel());
    assertEquals(1, factory.calls.get());
  }

  @Test
  void lookupFallsBackToDefault() {
    StructuredLogger fallback = registry.initializeDefault("info", tempDir);

    assertSame(fallback, registry.lookup("unknown"));
    assertSame(fallback, registry.lookup(null));
    assertSame(registry.lookup("a"), registry.lookup("b"));
    assertTrue(registry.hasDefault());
  }

  @Test
  void namedLoggerWinsOverDefault() {
    registry.initializeDefault("info", tempDir);
    StructuredLogger named = registry.initializeNamed("svc", "info", tempDir);

    assertSame(named, registry.lookup("svc"));
  }

  @Test
  void lookupWithoutAnyLoggerThrows() {
    LoggerNotInitializedException ex =
        assertThrows(LoggerNotInitializedException.class, () -> registry.lookup("missing"));

    assertTrue(ex.getMessage().contains("missing"));
    assertTrue(registry.find("missing").isEmpty());
    assertSame(StructuredLogger.noOp(), registry.lookupOrNoOp("missing"));
  }

  @Test
  void failedConstructionLeavesNameUninitializedAndRetryable() {
    factory.failNext.set(true);

    assertThrows(LogConfigurationException.class, () -> registry.initializeNamed("svc", "info", tempDir));
    assertTrue(registry.names().isEmpty());
    assertThrows(LoggerNotInitializedException.class, () -> registry.lookup("svc"));

    StructuredLogger logger = registry.initializeNamed("svc", "info", tempDir);
    assertSame(logger, registry.lookup("svc"));
  }

  @Test
  void twoLoggersMayNotShareAFile() {
    registry.initializeNamed(LoggerConfig.named("a", "info", tempDir));
    LoggerConfig clash = new LoggerConfig(
        "b", Level.INFO, tempDir, "a.log", null, false, true);

    LogConfigurationException ex =
        assertThrows(LogConfigurationException.class, () -> registry.initializeNamed(clash));

    assertTrue(ex.getMessage().contains("already used by logger a"));
    assertEquals(Set.of("a"), registry.names());
  }

  @Test
  void errorMirrorPathIsClaimedToo() {
    registry.initializeNamed(LoggerConfig.named("app", "info", tempDir).withErrorSplit(true));
    LoggerConfig clash = new LoggerConfig("other", Level.INFO, tempDir, "app_error.log", null, false, true);

    assertThrows(LogConfigurationException.class, () -> registry.initializeNamed(clash));
  }

  @Test
  void failedConstructionReleasesItsPaths() {
    factory.failNext.set(true);
    assertThrows(LogConfigurationException.class, () -> registry.initializeNamed("first", "info", tempDir));

    LoggerConfig sameFile = new LoggerConfig("second", Level.INFO, tempDir, "first.log", null, false, true);
    assertEquals("second", registry.initializeNamed(sameFile).name().orElseThrow());
  }

  @Test
  void initializeNamedRejectsAnonymousConfig() {
    assertThrows(IllegalArgumentException.class,
        () -> registry.initializeNamed(LoggerConfig.anonymous("info", tempDir)));
  }

  @Test
  void namesAreSortedAndOnlyIncludeInitializedLoggers() {
    registry.initializeNamed("zeta", "info", tempDir);
    registry.initializeNamed("alpha", "info", tempDir);
    factory.failNext.set(true);
    assertThrows(LogConfigurationException.class, () -> registry.initializeNamed("broken", "info", tempDir));

    assertEquals(List.of("alpha", "zeta"), new ArrayList<>(registry.names()));
    assertFalse(registry.hasDefault());
  }

  @Test
  void racingInitializationsConstructOnce() throws Exception {
    factory.delayMillis = 50;
    int threads = 12;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    try {
      List<Future<StructuredLogger>> futures = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        futures.add(pool.submit(() -> {
          start.await();
          return registry.initializeNamed("shared", "info", tempDir);
        }));
      }
      start.countDown();
      StructuredLogger first = futures.get(0).get(10, TimeUnit.SECONDS);
      for (Future<StructuredLogger> future : futures) {
        assertSame(first, future.get(10, TimeUnit.SECONDS));
      }
    } finally {
      pool.shutdownNow();
    }
    assertEquals(1, factory.calls.get());
  }

  @Test
  void racingDefaultInitializationsConstructOnce() throws Exception {
    int threads = 12;
    factory.arrivals = new CountDownLatch(threads);
    factory.delayMillis = 100;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    try {
      List<Future<StructuredLogger>> futures = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        futures.add(pool.submit(() -> {
          factory.arrivals.countDown();
          return registry.initializeDefault("info", tempDir);
        }));
      }
      StructuredLogger first = futures.get(0).get(10, TimeUnit.SECONDS);
      for (Future<StructuredLogger> future : futures) {
        assertSame(first, future.get(10, TimeUnit.SECONDS));
      }
    } finally {
      pool.shutdownNow();
    }
    assertEquals(1, factory.calls.get());
    assertTrue(registry.hasDefault());
  }

  @Test
  void racingFailedInitializationSharesOneException() throws Exception {
    int threads = 12;
    factory.arrivals = new CountDownLatch(threads);
    factory.delayMillis = 100;
    factory.failNext.set(true);
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    Set<Throwable> failures = ConcurrentHashMap.newKeySet();
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int i = 0; i < threads; i++) {
        futures.add(pool.submit(() -> {
          factory.arrivals.countDown();
          try {
            registry.initializeDefault("info", tempDir);
          } catch (LogConfigurationException ex) {
            failures.add(ex);
          }
        }));
      }
      for (Future<?> future : futures) {
        future.get(10, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }
    assertEquals(1, failures.size(), "every caller joined the one failed attempt");
    assertEquals(1, factory.attempts.get());
    assertEquals(0, factory.calls.get());
    assertFalse(registry.hasDefault());

    factory.arrivals = null;
    factory.delayMillis = 0;
    assertTrue(registry.initializeDefault("info", tempDir).isEnabled(Level.INFO));
  }

  @Test
  void repeatNamedInitializationSkipsValidation() {
    StructuredLogger first = registry.initializeNamed("svc", "info", tempDir);

    assertSame(first, registry.initializeNamed("svc", "info", null));
    assertEquals(1, factory.calls.get());
  }

  @Test
  void closeClosesEveryLogger() throws IOException {
    registry.initializeNamed("svc", "info", tempDir);
    registry.initializeDefault("info", tempDir);

    registry.close();

    assertEquals(2, factory.sinks.size());
    assertTrue(factory.sinks.stream().allMatch(CapturingSink::closed));
  }

  private static final class CountingFactory implements StructuredLoggerFactory {
    final AtomicInteger attempts = new AtomicInteger();
    final AtomicInteger calls = new AtomicInteger();
    final AtomicBoolean failNext = new AtomicBoolean();
    final List<CapturingSink> sinks = new ArrayList<>();
    volatile long delayMillis;
    volatile CountDownLatch arrivals;

    @Override
    public StructuredLogger create(LoggerConfig config) {
      attempts.incrementAndGet();
      pause();
      if (failNext.getAndSet(false)) {
        throw new LogConfigurationException("cannot open " + config.primaryPath());
      }
      calls.incrementAndGet();
      CapturingSink sink = new CapturingSink();
      synchronized (sinks) {
        sinks.add(sink);
      }
      return new StructuredLogger(config.name(), config.minimumLevel(), new JsonLineFormatter(), sink, null,
          null, null, config.reportCaller());
    }

    // Holds the first attempt until every racing caller is about to join it.
    private void pause() {
      try {
        CountDownLatch latch = arrivals;
        if (latch != null) {
          latch.await(10, TimeUnit.SECONDS);
        }
        if (delayMillis > 0) {
          Thread.sleep(delayMillis);
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    }
  }
}
