package ca.gc.cra.unilog.infrastructure.sink;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.unilog.config.RotationPolicy;
import ca.gc.cra.unilog.domain.log.LogConfigurationException;
import ca.gc.cra.unilog.testutil.LogCapture;
import ca.gc.cra.unilog.testutil.MutableClock;
import ca.gc.cra.unilog.testutil.RecordingMetrics;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.zip.GZIPInputStream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RotatingFileSinkTest {
  private static final Instant NOON = Instant.parse("2025-01-22T12:00:00Z");

  @TempDir Path tempDir;

  private final MutableClock clock = new MutableClock(NOON);
  private final RecordingMetrics metrics = new RecordingMetrics();

  @Test
  void appendsToExistingFileAndStartsSizeFromIt() throws IOException {
    Files.writeString(tempDir.resolve("app.log"), "old\n");

    try (RotatingFileSink sink = open(RotationPolicy.disabled())) {
      assertEquals(4, sink.size());
      sink.append(bytes("new\n"));
      assertEquals(8, sink.size());
    }

    assertEquals("old\nnew\n", Files.readString(tempDir.resolve("app.log")));
    assertEquals(4, metrics.observed("sink.bytes.written"));
  }

  @Test
  void rotatesOncePerThresholdCrossing() throws IOException {
    String line = "123456789\n";
    try (RotatingFileSink sink = open(RotationPolicy.bySize(20, 0, false))) {
      sink.append(bytes(line));
      sink.append(bytes(line));
      assertTrue(sink.backups().isEmpty());

      sink.append(bytes(line));
      sink.append(bytes("later\n"));

      List<Path> backups = sink.backups();
      assertEquals(1, backups.size());
      assertEquals("app-20250122-120000-0000.log", backups.get(0).getFileName().toString());
      assertEquals(line.repeat(3), Files.readString(backups.get(0)));
      assertEquals("later\n", Files.readString(sink.path()));
    }
    assertEquals(1, metrics.count("sink.rotations"));
    assertEquals(0, metrics.count("sink.rotation.failures"));
  }

  @Test
  void compressedBackupsAreValidGzipOfTheRotatedBytes() throws IOException {
    try (RotatingFileSink sink = open(RotationPolicy.bySize(5, 0, true))) {
      sink.append(bytes("0123456789\n"));

      List<Path> backups = sink.backups();
      assertEquals(1, backups.size());
      Path gz = backups.get(0);
      assertEquals("app-20250122-120000-0000.log.gz", gz.getFileName().toString());
      assertFalse(Files.exists(tempDir.resolve("app-20250122-120000-0000.log")));
      try (InputStream in = new GZIPInputStream(Files.newInputStream(gz))) {
        assertEquals("0123456789\n", new String(in.readAllBytes(), StandardCharsets.UTF_8));
      }
      assertEquals(0, Files.size(sink.path()));
    }
  }

  @Test
  void keepsOnlyNewestBackupsBeyondMaxBackups() throws IOException {
    try (RotatingFileSink sink = open(RotationPolicy.bySize(1, 2, false))) {
      for (int i = 0; i < 4; i++) {
        sink.append(bytes("line-" + i + "\n"));
      }

      List<Path> backups = sink.backups();
      assertEquals(2, backups.size());
      assertEquals("line-3\n", Files.readString(backups.get(0)));
      assertEquals("line-2\n", Files.readString(backups.get(1)));
    }
    assertEquals(4, metrics.count("sink.rotations"));
  }

  @Test
  void pruningLeavesOtherSinksBackupsAlone() throws IOException {
    Path foreign = Files.writeString(tempDir.resolve("app_error-20250101-000000-0000.log"), "error backup\n");
    Path unrelated = Files.writeString(tempDir.resolve("app.log.bak"), "manual copy\n");

    try (RotatingFileSink sink = open(RotationPolicy.bySize(1, 1, false))) {
      sink.append(bytes("a\n"));
      sink.append(bytes("b\n"));
      assertEquals(1, sink.backups().size());
    }

    assertTrue(Files.exists(foreign));
    assertTrue(Files.exists(unrelated));
  }

  @Test
  void deletesBackupsOlderThanMaxAge() throws IOException {
    Path stale = Files.writeString(tempDir.resolve("app-20200101-000000-0000.log"), "ancient\n");
    Files.setLastModifiedTime(stale, FileTime.from(Instant.parse("2020-01-01T00:00:00Z")));
    RotationPolicy policy = new RotationPolicy(1, 0, Duration.ofDays(1), Duration.ZERO, false);

    try (RotatingFileSink sink = open(policy)) {
      sink.append(bytes("fresh\n"));

      assertFalse(Files.exists(stale));
      assertEquals(1, sink.backups().size());
    }
  }

  @Test
  void skipsBackupNamesThatAlreadyExist() throws IOException {
    Files.writeString(tempDir.resolve("app-20250122-120000-0000.log"), "earlier run\n");

    try (RotatingFileSink sink = open(RotationPolicy.bySize(1, 0, false))) {
      sink.append(bytes("x\n"));
    }

    assertEquals("earlier run\n", Files.readString(tempDir.resolve("app-20250122-120000-0000.log")));
    assertEquals("x\n", Files.readString(tempDir.resolve("app-20250122-120000-0001.log")));
  }

  @Test
  void rotatesWhenIntervalHasElapsed() throws IOException {
    RotationPolicy hourly = new RotationPolicy(0, 0, Duration.ZERO, Duration.ofHours(1), false);
    try (RotatingFileSink sink = open(hourly)) {
      sink.append(bytes("first\n"));
      assertFalse(sink.rotateIfNeeded());

      clock.advance(Duration.ofMinutes(61));
      assertTrue(sink.rotateIfNeeded());
      assertEquals("app-20250122-130100-0000.log", sink.backups().get(0).getFileName().toString());
      assertEquals(0, Files.size(sink.path()));

      clock.advance(Duration.ofHours(2));
      assertFalse(sink.rotateIfNeeded(), "an empty file is not rotated");
    }
  }

  @Test
  void rotationFailureKeepsTheLineAndTheSinkUsable() throws IOException {
    Path blocker = Files.createDirectory(tempDir.resolve("app-20200101-000000-0000.log"));
    Files.writeString(blocker.resolve("pinned"), "cannot prune a non-empty directory\n");

    try (LogCapture capture = LogCapture.attach(RotatingFileSink.class);
        RotatingFileSink sink = open(RotationPolicy.bySize(10, 1, false))) {
      sink.append(bytes("first line\n"));
      assertTrue(capture.contains(ch.qos.logback.classic.Level.WARN, "line kept"));

      assertEquals("first line\n", Files.readString(tempDir.resolve("app-20250122-120000-0000.log")));
      assertEquals(1, metrics.count("sink.rotation.failures"));
      assertEquals(0, metrics.count("sink.rotations"));

      sink.append(bytes("b\n"));
      assertEquals("b\n", Files.readString(sink.path()));
    }
    assertTrue(Files.isDirectory(blocker));
  }

  @Test
  void appendAfterCloseReopensTheFile() throws IOException {
    RotatingFileSink sink = open(RotationPolicy.disabled());
    sink.append(bytes("a\n"));
    sink.close();
    sink.append(bytes("b\n"));
    sink.close();

    assertEquals("a\nb\n", Files.readString(tempDir.resolve("app.log")));
  }

  @Test
  void constructionFailsWhenDirectoryIsUnusable() throws IOException {
    Path blocker = Files.writeString(tempDir.resolve("not-a-dir"), "");

    assertThrows(LogConfigurationException.class,
        () -> new RotatingFileSink(blocker, "app.log", RotationPolicy.disabled(), clock, metrics));
  }

  @Test
  void constructionFailsWhenFileIsADirectory() throws IOException {
    Files.createDirectory(tempDir.resolve("app.log"));

    assertThrows(LogConfigurationException.class, () -> open(RotationPolicy.disabled()));
  }

  @Test
  void concurrentAppendsNeverInterleaveAcrossRotations() throws Exception {
    int threads = 8;
    int perThread = 200;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    try (RotatingFileSink sink = open(RotationPolicy.bySize(4_096, 0, false))) {
      List<Future<?>> futures = new ArrayList<>();
      for (int t = 0; t < threads; t++) {
        int id = t;
        futures.add(pool.submit(() -> {
          start.await();
          for (int i = 0; i < perThread; i++) {
            sink.append(bytes(String.format("{\"thread\":%d,\"seq\":%04d}\n", id, i)));
          }
          return null;
        }));
      }
      start.countDown();
      for (Future<?> future : futures) {
        future.get(30, TimeUnit.SECONDS);
      }

      List<String> lines = new ArrayList<>(Files.readAllLines(sink.path()));
      for (Path backup : sink.backups()) {
        lines.addAll(Files.readAllLines(backup));
      }
      assertEquals(threads * perThread, lines.size());
      assertTrue(lines.stream().allMatch(l -> l.matches("\\{\"thread\":\\d,\"seq\":\\d{4}}")));
      assertFalse(sink.backups().isEmpty());
    } finally {
      pool.shutdownNow();
    }
  }

  private RotatingFileSink open(RotationPolicy policy) {
    return new RotatingFileSink(tempDir, "app.log", policy, clock, metrics);
  }

  private static byte[] bytes(String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }
}
