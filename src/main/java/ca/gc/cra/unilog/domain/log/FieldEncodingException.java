package ca.gc.cra.unilog.domain.log;

/**
 * Raised when a structured field value cannot be represented in the JSON line.
 *
 * @since 0.1.0
 */
public class FieldEncodingException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String field;

  /**
   * Creates an exception naming the offending field.
   *
   * @param field field name
   * @param message human-readable error
   */
  public FieldEncodingException(String field, String message) {
    super(message);
    this.field = field;
  }

  /**
   * Returns the name of the field that could not be encoded.
   *
   * @return field name
   */
  public String field() {
    return field;
  }
}
