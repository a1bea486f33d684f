package ca.gc.cra.unilog.domain.log;

/**
 * Raised by a registry lookup when neither the requested logger nor a default logger has been initialized.
 *
 * @since 0.1.0
 */
public class LoggerNotInitializedException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  private final String loggerName;

  /**
   * Creates an exception for the missing logger.
   *
   * @param loggerName name that was looked up
   */
  public LoggerNotInitializedException(String loggerName) {
    super("Logger '" + loggerName + "' is not initialized and no default logger is configured");
    this.loggerName = loggerName;
  }

  /**
   * Returns the name that was looked up.
   *
   * @return requested logger name
   */
  public String loggerName() {
    return loggerName;
  }
}
