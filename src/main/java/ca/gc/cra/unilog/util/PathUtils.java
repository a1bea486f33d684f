package ca.gc.cra.unilog.util;

import java.nio.file.Path;
import java.util.Optional;

/** Utility helpers for working with {@link Path} instances and log file names. */
public final class PathUtils {
  private PathUtils() {}

  /**
   * Returns the file name for the supplied path when available.
   *
   * @param path source path; may be {@code null}
   * @return optional file name string
   */
  public static Optional<String> fileName(Path path) {
    if (path == null) {
      return Optional.empty();
    }
    Path name = path.getFileName();
    return name == null ? Optional.empty() : Optional.of(name.toString());
  }

  /**
   * Returns the file name without its last extension ({@code app.log -> app}).
   *
   * @param fileName file name; a leading dot does not start an extension
   * @return base name
   */
  public static String baseName(String fileName) {
    int dot = fileName.lastIndexOf('.');
    return dot <= 0 ? fileName : fileName.substring(0, dot);
  }

  /**
   * Returns the last extension including its dot ({@code app.log -> .log}), or the empty string.
   *
   * @param fileName file name; a leading dot does not start an extension
   * @return extension with leading dot, or {@code ""}
   */
  public static String extension(String fileName) {
    int dot = fileName.lastIndexOf('.');
    return dot <= 0 ? "" : fileName.substring(dot);
  }
}
