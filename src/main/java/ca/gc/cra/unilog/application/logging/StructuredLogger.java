package ca.gc.cra.unilog.application.logging;

import ca.gc.cra.unilog.application.port.ClockPort;
import ca.gc.cra.unilog.application.port.LogFormatter;
import ca.gc.cra.unilog.application.port.LogSink;
import ca.gc.cra.unilog.application.port.MetricsPort;
import ca.gc.cra.unilog.domain.log.FieldValue;
import ca.gc.cra.unilog.domain.log.Level;
import ca.gc.cra.unilog.domain.log.LogEvent;
import ca.gc.cra.unilog.logging.Logs;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.helpers.FormattingTuple;
import org.slf4j.helpers.MessageFormatter;

/**
 * <strong>What:</strong> Level-gated structured logger writing JSON lines to a primary sink and, optionally,
 * mirroring severe events through a {@link SeverityRouter}.
 * <p><strong>Role:</strong> The object handed out by {@link LoggerRegistry}; binds formatter, primary sink,
 * router, and minimum level.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Drop events below the minimum level without side effects.</li>
 *   <li>Stamp passing events with the emit time and, when enabled, the call-site line.</li>
 *   <li>Report write failures through {@link EmitResult} and the self-log; never throw them.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; the only mutable state lives in the sinks, which
 * serialize their own writes.</p>
 * <p><strong>Observability:</strong> Primary write failures are logged at WARN and counted as
 * {@code logger.write.failures}.</p>
 *
 * @since 0.1.0
 */
public final class StructuredLogger implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(StructuredLogger.class);
  private static final String SELF = StructuredLogger.class.getName();
  private static final StackWalker WALKER = StackWalker.getInstance();
  private static final int PREVIEW_BYTES = 256;

  private static final StructuredLogger NO_OP =
      new StructuredLogger(null, Level.FATAL, event -> new byte[0], new LogSink() {
        @Override
        public void append(byte[] line) {}
      }, null, ClockPort.SYSTEM, MetricsPort.NO_OP, false, false);

  private final String name;
  private final Level minimumLevel;
  private final LogFormatter formatter;
  private final LogSink primary;
  private final SeverityRouter router;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final boolean reportCaller;
  private final boolean enabled;

  /**
   * Creates a logger.
   *
   * @param name logger name written to each line; {@code null} for an anonymous logger
   * @param minimumLevel events below this level are dropped
   * @param formatter line formatter; shared with {@code router}
   * @param primary primary sink; owned by this logger
   * @param router optional error mirror; {@code null} disables mirroring
   * @param clock timestamp source
   * @param metrics metrics adapter; falls back to {@link MetricsPort#NO_OP} when {@code null}
   * @param reportCaller whether to capture the call-site line number
   */
  public StructuredLogger(
      String name,
      Level minimumLevel,
      LogFormatter formatter,
      LogSink primary,
      SeverityRouter router,
      ClockPort clock,
      MetricsPort metrics,
      boolean reportCaller) {
    this(name, minimumLevel, formatter, primary, router, clock, metrics, reportCaller, true);
  }

  private StructuredLogger(
      String name,
      Level minimumLevel,
      LogFormatter formatter,
      LogSink primary,
      SeverityRouter router,
      ClockPort clock,
      MetricsPort metrics,
      boolean reportCaller,
      boolean enabled) {
    this.name = name;
    this.minimumLevel = Objects.requireNonNull(minimumLevel, "minimumLevel");
    this.formatter = Objects.requireNonNull(formatter, "formatter");
    this.primary = Objects.requireNonNull(primary, "primary");
    this.router = router;
    this.clock = clock == null ? ClockPort.SYSTEM : clock;
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.reportCaller = reportCaller;
    this.enabled = enabled;
  }

  /**
   * Returns a shared logger that discards every event.
   *
   * @return no-op logger; every emit returns {@link EmitResult#FILTERED}
   */
  public static StructuredLogger noOp() {
    return NO_OP;
  }

  /**
   * Emits an event.
   *
   * @param level event level; must not be {@code null}
   * @param message message text
   * @param fields structured fields; values are converted with {@link FieldValue#of(Object)}; may be {@code null};
   *     a {@code null} key is written as {@code "null"} and reported as an encoding error
   * @return what happened to the event
   */
  public EmitResult emit(Level level, String message, Map<String, ?> fields) {
    Objects.requireNonNull(level, "level");
    if (!isEnabled(level)) {
      return EmitResult.FILTERED;
    }
    int line = reportCaller ? callerLine() : 0;
    if (fields != null && fields.keySet().stream().anyMatch(Objects::isNull)) {
      metrics.increment("formatter.field.encodingErrors");
      log.warn("Field with null name written as \"null\" for logger {}", loggerLabel());
    }
    LogEvent event = new LogEvent(clock.now(), level, message, line, name, FieldValue.fromMap(fields));
    return write(event);
  }

  /**
   * Emits an event without structured fields.
   *
   * @param level event level
   * @param message message text
   * @return what happened to the event
   */
  public EmitResult emit(Level level, String message) {
    return emit(level, message, Map.of());
  }

  /**
   * Returns whether events at {@code level} pass this logger's minimum level.
   *
   * @param level level to test
   * @return {@code true} when such events would be written
   */
  public boolean isEnabled(Level level) {
    return enabled && level.isAtLeast(minimumLevel);
  }

  /**
   * Logs a DEBUG message.
   *
   * @param message message text
   * @return emit outcome
   */
  public EmitResult debug(String message) {
    return emit(Level.DEBUG, message);
  }

  /**
   * Logs a DEBUG message built from an SLF4J-style {@code {}} template.
   *
   * @param template message template
   * @param args template arguments; a trailing {@link Throwable} is recorded in the {@code error} field
   * @return emit outcome
   */
  public EmitResult debug(String template, Object... args) {
    return emitFormatted(Level.DEBUG, template, args);
  }

  /**
   * Logs an INFO message.
   *
   * @param message message text
   * @return emit outcome
   */
  public EmitResult info(String message) {
    return emit(Level.INFO, message);
  }

  /**
   * Logs an INFO message built from an SLF4J-style {@code {}} template.
   *
   * @param template message template
   * @param args template arguments
   * @return emit outcome
   */
  public EmitResult info(String template, Object... args) {
    return emitFormatted(Level.INFO, template, args);
  }

  /**
   * Logs a WARN message.
   *
   * @param message message text
   * @return emit outcome
   */
  public EmitResult warn(String message) {
    return emit(Level.WARN, message);
  }

  /**
   * Logs a WARN message built from an SLF4J-style {@code {}} template.
   *
   * @param template message template
   * @param args template arguments
   * @return emit outcome
   */
  public EmitResult warn(String template, Object... args) {
    return emitFormatted(Level.WARN, template, args);
  }

  /**
   * Logs an ERROR message.
   *
   * @param message message text
   * @return emit outcome
   */
  public EmitResult error(String message) {
    return emit(Level.ERROR, message);
  }

  /**
   * Logs an ERROR message built from an SLF4J-style {@code {}} template.
   *
   * @param template message template
   * @param args template arguments
   * @return emit outcome
   */
  public EmitResult error(String template, Object... args) {
    return emitFormatted(Level.ERROR, template, args);
  }

  /**
   * Logs a FATAL message. The JVM keeps running; callers decide whether to exit.
   *
   * @param message message text
   * @return emit outcome
   */
  public EmitResult fatal(String message) {
    return emit(Level.FATAL, message);
  }

  /**
   * Logs a FATAL message built from an SLF4J-style {@code {}} template.
   *
   * @param template message template
   * @param args template arguments
   * @return emit outcome
   */
  public EmitResult fatal(String template, Object... args) {
    return emitFormatted(Level.FATAL, template, args);
  }

  /**
   * Returns the logger name.
   *
   * @return name, or empty for an anonymous logger
   */
  public Optional<String> name() {
    return Optional.ofNullable(name);
  }

  /**
   * Returns the minimum level.
   *
   * @return events below this level are dropped
   */
  public Level minimumLevel() {
    return minimumLevel;
  }

  /**
   * Returns the error mirror, when configured.
   *
   * @return router, or empty
   */
  public Optional<SeverityRouter> router() {
    return Optional.ofNullable(router);
  }

  /**
   * Returns the primary sink.
   *
   * @return primary sink
   */
  public LogSink primary() {
    return primary;
  }

  /**
   * Closes the primary sink and the router's sink.
   *
   * @throws IOException if either sink fails to close; the other is still closed
   */
  @Override
  public void close() throws IOException {
    try {
      primary.close();
    } finally {
      if (router != null) {
        router.close();
      }
    }
  }

  private EmitResult emitFormatted(Level level, String template, Object[] args) {
    if (!isEnabled(level)) {
      return EmitResult.FILTERED;
    }
    FormattingTuple tuple = MessageFormatter.arrayFormat(template, args);
    Throwable throwable = tuple.getThrowable();
    if (throwable == null) {
      return emit(level, tuple.getMessage(), Map.of());
    }
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("error", throwable.toString());
    return emit(level, tuple.getMessage(), fields);
  }

  private EmitResult write(LogEvent event) {
    EmitResult result = EmitResult.WRITTEN;
    try {
      primary.append(formatter.render(event));
    } catch (IOException | RuntimeException ex) {
      metrics.increment("logger.write.failures");
      log.warn("Failed to write {} event for logger {} to {}: {}", event.level(), loggerLabel(), primary.path(),
          Logs.truncate(event.message(), PREVIEW_BYTES), ex);
      result = EmitResult.WRITE_FAILED;
    }
    if (router != null && router.forward(event) == SeverityRouter.Outcome.FAILED && result == EmitResult.WRITTEN) {
      result = EmitResult.MIRROR_FAILED;
    }
    return result;
  }

  private String loggerLabel() {
    return name == null ? "<default>" : name;
  }

  private static int callerLine() {
    return WALKER.walk(frames -> frames
        .filter(frame -> !SELF.equals(frame.getClassName()))
        .findFirst()
        .map(StackWalker.StackFrame::getLineNumber)
        .filter(line -> line > 0)
        .orElse(0));
  }
}
