package ca.gc.cra.unilog.api;

/**
 * <strong>What:</strong> Process exit codes returned by the {@code unilog} commands.
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments or input documents were invalid. */
  INVALID_ARGS(2),
  /** A file could not be read or a log line could not be written. */
  IO_ERROR(3),
  /** Logging configuration was malformed or a logger could not be created. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value passed to {@link System#exit(int)}.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
