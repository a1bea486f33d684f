package ca.gc.cra.unilog.domain.log;

import ca.gc.cra.unilog.util.PathUtils;
import java.util.Objects;

/**
 * Derives the error-mirror file name from a primary log file name.
 *
 * <p>{@code app.log -> app_error.log}; {@code service -> service_error}. Only the last extension counts and a
 * leading dot does not start an extension ({@code .log -> .log_error}).</p>
 *
 * @since 0.1.0
 */
public final class ErrorMirrorNames {
  /** Suffix inserted before the extension. */
  public static final String ERROR_SUFFIX = "_error";

  private ErrorMirrorNames() {}

  /**
   * Returns the error-mirror file name for {@code fileName}.
   *
   * @param fileName primary file name without directory components; must not be {@code null}
   * @return derived file name
   */
  public static String deriveErrorFileName(String fileName) {
    Objects.requireNonNull(fileName, "fileName");
    return PathUtils.baseName(fileName) + ERROR_SUFFIX + PathUtils.extension(fileName);
  }
}
