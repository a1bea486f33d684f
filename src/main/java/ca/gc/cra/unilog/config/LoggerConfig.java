package ca.gc.cra.unilog.config;

import ca.gc.cra.unilog.domain.log.Level;
import ca.gc.cra.unilog.validation.Numbers;
import ca.gc.cra.unilog.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration of one logger, supplied once at creation and never mutated.
 *
 * <p>Recognized keys for {@link #fromMap(String, Map)}: {@code level}, {@code dir}, {@code file},
 * {@code rotation.maxSizeMiB}, {@code rotation.maxBackups}, {@code rotation.maxAgeDays},
 * {@code rotation.intervalMinutes}, {@code rotation.compress}, {@code errorSplit}, {@code reportCaller}.</p>
 *
 * @param name logger name written to the {@code logger} key; {@code null} for the anonymous default logger
 * @param minimumLevel events below this level are dropped
 * @param directory directory holding the primary file, the error mirror, and rotated backups
 * @param fileName primary file name
 * @param rotation rotation and retention thresholds for every sink of the logger
 * @param errorSplit whether ERROR and FATAL events are mirrored to the derived error file
 * @param reportCaller whether the call-site line number is captured
 * @since 0.1.0
 */
public record LoggerConfig(
    String name,
    Level minimumLevel,
    Path directory,
    String fileName,
    RotationPolicy rotation,
    boolean errorSplit,
    boolean reportCaller) {

  private static final Logger log = LoggerFactory.getLogger(LoggerConfig.class);

  /** File name used by the anonymous default logger. */
  public static final String DEFAULT_FILE_NAME = "app.log";

  private static final Path DEFAULT_DIRECTORY = Path.of("logs");
  private static final long MAX_SIZE_MIB = 1_024L * 1_024L;
  private static final long MAX_BACKUPS = 10_000;
  private static final long MAX_AGE_DAYS = 36_500;
  private static final long MAX_INTERVAL_MINUTES = 525_600;

  /**
   * Validates configuration values.
   */
  public LoggerConfig {
    if (name != null) {
      name = Strings.requireSafeName("name", name);
    }
    minimumLevel = Objects.requireNonNullElse(minimumLevel, Level.INFO);
    directory = Objects.requireNonNull(directory, "directory").toAbsolutePath().normalize();
    fileName = Strings.requireSafeName("file", fileName);
    rotation = Objects.requireNonNullElse(rotation, RotationPolicy.defaults());
  }

  /**
   * Named logger writing to {@code <name>.log} with default rotation, no error mirror, and caller lines.
   *
   * @param name logger name
   * @param level level text; unrecognized values fall back to {@code info}
   * @param directory log directory
   * @return configuration
   */
  public static LoggerConfig named(String name, String level, Path directory) {
    String safeName = Strings.requireSafeName("name", name);
    return new LoggerConfig(
        safeName, parseLevel(level), directory, safeName + ".log", RotationPolicy.defaults(), false, true);
  }

  /**
   * Anonymous default logger writing to {@value #DEFAULT_FILE_NAME}.
   *
   * @param level level text; unrecognized values fall back to {@code info}
   * @param directory log directory
   * @return configuration
   */
  public static LoggerConfig anonymous(String level, Path directory) {
    return new LoggerConfig(
        null, parseLevel(level), directory, DEFAULT_FILE_NAME, RotationPolicy.defaults(), false, true);
  }

  /**
   * Builds a configuration from flattened {@code key=value} settings.
   *
   * @param name logger name, or {@code null} for the anonymous default logger
   * @param kv flattened settings; missing keys take defaults
   * @return configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static LoggerConfig fromMap(String name, Map<String, String> kv) {
    Objects.requireNonNull(kv, "kv");
    String safeName = name == null ? null : Strings.requireSafeName("name", name);
    Level level = parseLevel(kv.get("level"));
    Path directory = parsePath("dir", kv.get("dir"), DEFAULT_DIRECTORY);
    String defaultFile = safeName == null ? DEFAULT_FILE_NAME : safeName + ".log";
    String file = kv.get("file");
    String fileName = file == null || file.isBlank() ? defaultFile : Strings.requireSafeName("file", file);

    RotationPolicy defaults = RotationPolicy.defaults();
    long maxSizeMiB = parseBoundedLong(kv, "rotation.maxSizeMiB", defaults.maxSizeBytes() / RotationPolicy.MIB, 0,
        MAX_SIZE_MIB);
    long maxBackups = parseBoundedLong(kv, "rotation.maxBackups", defaults.maxBackups(), 0, MAX_BACKUPS);
    long maxAgeDays = parseBoundedLong(kv, "rotation.maxAgeDays", defaults.maxBackupAge().toDays(), 0, MAX_AGE_DAYS);
    long intervalMinutes = parseBoundedLong(kv, "rotation.intervalMinutes", 0, 0, MAX_INTERVAL_MINUTES);
    boolean compress = parseBoolean(kv.get("rotation.compress"), defaults.compress());
    RotationPolicy rotation = new RotationPolicy(
        maxSizeMiB * RotationPolicy.MIB,
        Math.toIntExact(maxBackups),
        Duration.ofDays(maxAgeDays),
        Duration.ofMinutes(intervalMinutes),
        compress);

    boolean errorSplit = parseBoolean(kv.get("errorSplit"), false);
    boolean reportCaller = parseBoolean(kv.get("reportCaller"), true);
    return new LoggerConfig(safeName, level, directory, fileName, rotation, errorSplit, reportCaller);
  }

  /**
   * Returns a copy with a different rotation policy.
   *
   * @param policy new policy
   * @return updated configuration
   */
  public LoggerConfig withRotation(RotationPolicy policy) {
    return new LoggerConfig(name, minimumLevel, directory, fileName, policy, errorSplit, reportCaller);
  }

  /**
   * Returns a copy with error mirroring switched on or off.
   *
   * @param enabled whether ERROR+ events are mirrored
   * @return updated configuration
   */
  public LoggerConfig withErrorSplit(boolean enabled) {
    return new LoggerConfig(name, minimumLevel, directory, fileName, rotation, enabled, reportCaller);
  }

  /**
   * Returns a copy with call-site line capture switched on or off.
   *
   * @param enabled whether line numbers are captured
   * @return updated configuration
   */
  public LoggerConfig withReportCaller(boolean enabled) {
    return new LoggerConfig(name, minimumLevel, directory, fileName, rotation, errorSplit, enabled);
  }

  /**
   * Returns whether this configuration describes a named logger.
   *
   * @return {@code true} when {@link #name()} is present
   */
  public boolean isNamed() {
    return name != null;
  }

  /**
   * Resolves the primary log file.
   *
   * @return {@code directory/fileName}
   */
  public Path primaryPath() {
    return directory.resolve(fileName);
  }

  private static Level parseLevel(String raw) {
    return Level.tryParse(raw).orElseGet(() -> {
      if (raw != null && !raw.isBlank()) {
        log.debug("Unrecognized log level '{}'; using INFO", raw);
      }
      return Level.INFO;
    });
  }

  private static long parseBoundedLong(Map<String, String> kv, String key, long defaultValue, long min, long max) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      long parsed = Long.parseLong(raw.trim());
      Numbers.requireRange(key, parsed, min, max);
      return parsed;
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer between " + min + " and " + max, ex);
    }
  }

  private static boolean parseBoolean(String value, boolean fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    return Boolean.parseBoolean(value.trim());
  }

  private static Path parsePath(String name, String value, Path fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    try {
      return Path.of(Strings.requireNonBlank(name, value)).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }
}
