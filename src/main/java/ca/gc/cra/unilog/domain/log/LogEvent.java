package ca.gc.cra.unilog.domain.log;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Immutable log event handed from a logger to its formatter.
 * <p><strong>Thread-safety:</strong> Records are immutable and safe to share across threads; the field map is
 * copied on construction.</p>
 *
 * @param timestamp emit time in UTC with nanosecond precision; never {@code null}
 * @param level severity; never {@code null}
 * @param message message text; {@code null} becomes the empty string
 * @param line call-site line number, {@code 0} when unknown
 * @param loggerName name of the emitting logger, {@code null} for the anonymous default logger
 * @param fields structured fields; never {@code null}, may be empty
 * @since 0.1.0
 */
public record LogEvent(
    Instant timestamp,
    Level level,
    String message,
    int line,
    String loggerName,
    Map<String, FieldValue> fields) {

  /**
   * Validates the event and copies the field map.
   */
  public LogEvent {
    timestamp = Objects.requireNonNull(timestamp, "timestamp");
    level = Objects.requireNonNull(level, "level");
    message = message == null ? "" : message;
    line = Math.max(0, line);
    fields = fields == null ? Map.of() : Map.copyOf(fields);
  }

  /**
   * Creates an event without a logger name, line number, or fields.
   *
   * @param timestamp emit time
   * @param level severity
   * @param message message text
   * @return new event
   */
  public static LogEvent of(Instant timestamp, Level level, String message) {
    return new LogEvent(timestamp, level, message, 0, null, Map.of());
  }

  /**
   * Returns whether the event was emitted by a named logger.
   *
   * @return {@code true} when {@link #loggerName()} is present
   */
  public boolean isNamed() {
    return loggerName != null;
  }
}
