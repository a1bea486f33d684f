package ca.gc.cra.unilog.config;

import ca.gc.cra.unilog.validation.Numbers;
import java.time.Duration;
import java.util.Objects;

/**
 * Rotation and retention thresholds for a rotating file sink.
 *
 * @param maxSizeBytes size after which the active file is rotated; {@code 0} disables size-based rotation
 * @param maxBackups number of rotated files kept; {@code 0} keeps all
 * @param maxBackupAge rotated files older than this are deleted; {@link Duration#ZERO} keeps all
 * @param rotateInterval age of the active file after which it is rotated; {@link Duration#ZERO} disables
 * @param compress whether rotated files are gzip-compressed
 * @since 0.1.0
 */
public record RotationPolicy(
    long maxSizeBytes,
    int maxBackups,
    Duration maxBackupAge,
    Duration rotateInterval,
    boolean compress) {

  /** Bytes per mebibyte, the unit used by {@code rotation.maxSizeMiB}. */
  public static final long MIB = 1_024L * 1_024L;

  private static final long DEFAULT_MAX_SIZE_MIB = 100;
  private static final int DEFAULT_MAX_BACKUPS = 5;
  private static final Duration DEFAULT_MAX_AGE = Duration.ofDays(30);

  /**
   * Validates thresholds.
   */
  public RotationPolicy {
    Numbers.requireNonNegative("rotation.maxSizeBytes", maxSizeBytes);
    Numbers.requireNonNegative("rotation.maxBackups", maxBackups);
    maxBackupAge = Objects.requireNonNullElse(maxBackupAge, Duration.ZERO);
    rotateInterval = Objects.requireNonNullElse(rotateInterval, Duration.ZERO);
    if (maxBackupAge.isNegative()) {
      throw new IllegalArgumentException("rotation.maxBackupAge must not be negative");
    }
    if (rotateInterval.isNegative()) {
      throw new IllegalArgumentException("rotation.rotateInterval must not be negative");
    }
  }

  /**
   * Plain append-only file: no rotation, no retention.
   *
   * @return disabled policy
   */
  public static RotationPolicy disabled() {
    return new RotationPolicy(0, 0, Duration.ZERO, Duration.ZERO, false);
  }

  /**
   * Default policy: rotate at 100 MiB, keep 5 backups for at most 30 days, no compression.
   *
   * @return default policy
   */
  public static RotationPolicy defaults() {
    return new RotationPolicy(DEFAULT_MAX_SIZE_MIB * MIB, DEFAULT_MAX_BACKUPS, DEFAULT_MAX_AGE, Duration.ZERO, false);
  }

  /**
   * Size-only policy, mostly useful for tests and small tools.
   *
   * @param maxSizeBytes rotation threshold in bytes
   * @param maxBackups number of backups to keep; {@code 0} keeps all
   * @param compress whether rotated files are compressed
   * @return policy without age limits
   */
  public static RotationPolicy bySize(long maxSizeBytes, int maxBackups, boolean compress) {
    return new RotationPolicy(maxSizeBytes, maxBackups, Duration.ZERO, Duration.ZERO, compress);
  }

  /**
   * Returns whether any rotation trigger is configured.
   *
   * @return {@code true} when size- or time-based rotation is enabled
   */
  public boolean rotates() {
    return maxSizeBytes > 0 || !rotateInterval.isZero();
  }
}
