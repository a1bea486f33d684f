package ca.gc.cra.unilog.application.port;

import java.io.IOException;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Output port for rendered log lines.
 * <p><strong>Why:</strong> Lets loggers and the severity router write bytes without knowing about files,
 * rotation, or compression.</p>
 * <p><strong>Role:</strong> Output port on the sink side; implemented by {@code RotatingFileSink}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Append each rendered line in call order without interleaving concurrent writers.</li>
 *   <li>Rotate atomically with respect to {@link #append(byte[])}.</li>
 *   <li>Release the underlying file on {@link #close()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must serialize concurrent {@link #append(byte[])} calls.</p>
 * <p><strong>Observability:</strong> Implementations emit {@code sink.*} metrics.</p>
 *
 * @since 0.1.0
 */
public interface LogSink extends AutoCloseable {
  /**
   * Appends one rendered line.
   *
   * @param line bytes to write; must not be {@code null}
   * @throws IOException if the write fails; a rotation triggered by a successful write never fails the call,
   *     and the sink stays usable for later calls
   */
  void append(byte[] line) throws IOException;

  /**
   * Rotates the active file when a configured threshold has been crossed.
   *
   * @return {@code true} when a rotation happened
   * @throws IOException if rotation fails
   */
  default boolean rotateIfNeeded() throws IOException {
    return false;
  }

  /**
   * Flushes buffered bytes to the underlying store.
   *
   * @throws IOException if flushing fails
   */
  default void flush() throws IOException {}

  /**
   * Returns the path of the active file, when the sink is file-backed.
   *
   * @return active path, or {@code null}
   */
  default Path path() {
    return null;
  }

  /**
   * Closes the sink.
   *
   * @throws IOException if closing fails
   */
  @Override
  default void close() throws IOException {}
}
