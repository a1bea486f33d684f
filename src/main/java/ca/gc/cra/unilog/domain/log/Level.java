package ca.gc.cra.unilog.domain.log;

import java.util.Locale;
import java.util.Optional;

/**
 * <strong>What:</strong> Ordered severity of a log event.
 * <p><strong>Why:</strong> Loggers filter on a minimum level and the severity router mirrors events at or above
 * {@link #ERROR}; both use {@link #isAtLeast(Level)} so the ordering is defined in one place.</p>
 * <p><strong>Role:</strong> Domain enumeration shared by formatter, logger, router, and configuration.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and globally shareable.</p>
 * <p><strong>Observability:</strong> {@link #label()} is the upper-case value written to the {@code level} key.</p>
 *
 * @since 0.1.0
 */
public enum Level {
  /** Diagnostic detail. */
  DEBUG,
  /** Normal operational messages. */
  INFO,
  /** Unexpected but recoverable conditions. */
  WARN,
  /** Failures that operators must look at; mirrored to the error file when enabled. */
  ERROR,
  /** Failures that leave the process unusable. */
  FATAL;

  /**
   * Returns {@code true} when this level meets or exceeds {@code threshold}.
   *
   * @param threshold minimum level; must not be {@code null}
   * @return whether an event at this level passes the threshold
   */
  public boolean isAtLeast(Level threshold) {
    return compareTo(threshold) >= 0;
  }

  /**
   * Returns the upper-case name written to log lines.
   *
   * @return level label such as {@code "INFO"}
   */
  public String label() {
    return name();
  }

  /**
   * Parses a configured level, falling back to {@link #INFO} for anything unrecognized.
   *
   * @param raw level text such as {@code debug}, {@code info}, {@code warn}, {@code error}; may be {@code null}
   * @return parsed level, never {@code null}
   */
  public static Level parse(String raw) {
    return tryParse(raw).orElse(INFO);
  }

  /**
   * Parses a configured level without applying the fallback.
   *
   * @param raw level text; may be {@code null}
   * @return parsed level, or empty when the text is not a known level
   */
  public static Optional<Level> tryParse(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "debug" -> Optional.of(DEBUG);
      case "info" -> Optional.of(INFO);
      case "warn", "warning" -> Optional.of(WARN);
      case "error" -> Optional.of(ERROR);
      case "fatal" -> Optional.of(FATAL);
      default -> Optional.empty();
    };
  }
}
