package ca.gc.cra.unilog.domain.log;

/**
 * Raised when a logger or sink cannot be constructed from its configuration, for example because the log
 * directory cannot be created or the file cannot be opened.
 *
 * @since 0.1.0
 */
public class LogConfigurationException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  public LogConfigurationException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param message human-readable error
   * @param cause filesystem or validation failure
   */
  public LogConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
