package ca.gc.cra.unilog.infrastructure.sink;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.unilog.application.logging.EmitResult;
import ca.gc.cra.unilog.application.logging.LoggerRegistry;
import ca.gc.cra.unilog.application.logging.StructuredLogger;
import ca.gc.cra.unilog.config.LoggerConfig;
import ca.gc.cra.unilog.config.RotationPolicy;
import ca.gc.cra.unilog.domain.log.Level;
import ca.gc.cra.unilog.domain.log.LogConfigurationException;
import ca.gc.cra.unilog.testutil.MutableClock;
import ca.gc.cra.unilog.testutil.RecordingMetrics;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileLoggerFactoryTest {
  private static final ObjectMapper MAPPER = new ObjectMapper();

  @TempDir Path tempDir;

  private final RecordingMetrics metrics = new RecordingMetrics();
  private final LoggerRegistry registry = new LoggerRegistry(
      new FileLoggerFactory(new MutableClock(Instant.parse("2025-01-22T12:00:00Z")), metrics));

  @AfterEach
  void closeRegistry() throws IOException {
    registry.close();
  }

  @Test
  void namedLoggerWritesOneJsonObjectPerLine() throws IOException {
    StructuredLogger logger = registry.initializeNamed("svc", "info", tempDir);

    logger.emit(Level.INFO, "hello", Map.of("extra", "x"));

    List<String> lines = Files.readAllLines(tempDir.resolve("svc.log"));
    assertEquals(1, lines.size());
    JsonNode node = MAPPER.readTree(lines.get(0));
    assertEquals("INFO", node.get("level").asText());
    assertEquals("svc", node.get("logger").asText());
    assertEquals("hello", node.get("msg").asText());
    assertEquals("x", node.get("extra").asText());
    assertTrue(node.get("line").asInt() > 0);
  }

  @Test
  void warnThresholdDropsInfo() throws IOException {
    StructuredLogger logger = registry.initializeNamed("svc", "warn", tempDir);

    assertEquals(EmitResult.FILTERED, logger.info("dropped"));
    assertEquals(EmitResult.WRITTEN, logger.warn("kept"));

    List<String> lines = Files.readAllLines(tempDir.resolve("svc.log"));
    assertEquals(1, lines.size());
    assertTrue(lines.get(0).contains("\"msg\":\"kept\""));
  }

  @Test
  void unknownLevelMeansInfo() throws IOException {
    StructuredLogger logger = registry.initializeNamed("svc", "bogus", tempDir);

    logger.debug("dropped");
    logger.info("kept");

    assertEquals(Level.INFO, logger.minimumLevel());
    assertEquals(1, Files.readAllLines(tempDir.resolve("svc.log")).size());
  }

  @Test
  void errorSplitMirrorsErrorsWhilePrimaryKeepsEveryEvent() throws IOException {
    StructuredLogger logger =
        registry.initializeDefault(LoggerConfig.anonymous("debug", tempDir).withErrorSplit(true));

    logger.info("routine");
    logger.error("broken");

    // The primary file is the complete record; the error file is an extra copy of ERROR and above.
    List<String> primary = Files.readAllLines(tempDir.resolve("app.log"));
    List<String> errors = Files.readAllLines(tempDir.resolve("app_error.log"));
    assertEquals(2, primary.size());
    assertTrue(primary.get(0).contains("\"msg\":\"routine\""));
    assertTrue(primary.get(1).contains("\"msg\":\"broken\""));
    assertEquals(1, errors.size());
    assertEquals(primary.get(1), errors.get(0));
    assertFalse(errors.get(0).contains("\"logger\""));
  }

  @Test
  void errorFileIsNotCreatedWithoutSplit() {
    registry.initializeNamed("svc", "info", tempDir).error("single file");

    assertFalse(Files.exists(tempDir.resolve("svc_error.log")));
  }

  @Test
  void createsMissingDirectories() {
    Path nested = tempDir.resolve("a").resolve("b");

    registry.initializeNamed("svc", "info", nested).info("deep");

    assertTrue(Files.exists(nested.resolve("svc.log")));
  }

  @Test
  void unusableDirectoryFailsInitialization() throws IOException {
    Path blocker = Files.writeString(tempDir.resolve("blocker"), "");

    assertThrows(LogConfigurationException.class, () -> registry.initializeNamed("svc", "info", blocker));
    assertTrue(registry.names().isEmpty());
  }

  @Test
  void failingMirrorClosesThePrimary() throws IOException {
    Files.createDirectory(tempDir.resolve("svc_error.log"));
    LoggerConfig config = LoggerConfig.named("svc", "info", tempDir).withErrorSplit(true);

    assertThrows(LogConfigurationException.class, () -> new FileLoggerFactory().create(config));
    assertTrue(Files.exists(tempDir.resolve("svc.log")));
  }

  @Test
  void rotationFailureDoesNotFailTheEmit() throws IOException {
    Path blocker = Files.createDirectory(tempDir.resolve("svc-20200101-000000-0000.log"));
    Files.writeString(blocker.resolve("pinned"), "x");
    StructuredLogger logger = registry.initializeNamed(
        LoggerConfig.named("svc", "info", tempDir).withRotation(RotationPolicy.bySize(10, 1, false)));

    assertEquals(EmitResult.WRITTEN, logger.info("rotates and fails to prune"));

    assertEquals(0, metrics.count("logger.write.failures"));
    assertEquals(1, metrics.count("sink.rotation.failures"));
    assertTrue(Files.readString(tempDir.resolve("svc-20250122-120000-0000.log")).contains("fails to prune"));
    assertEquals(EmitResult.WRITTEN, logger.info("next"));
  }

  @Test
  void writesAreCountedAsBytes() throws IOException {
    registry.initializeNamed("svc", "info", tempDir).info("count me");

    assertEquals(Files.size(tempDir.resolve("svc.log")), metrics.observed("sink.bytes.written"));
  }
}
