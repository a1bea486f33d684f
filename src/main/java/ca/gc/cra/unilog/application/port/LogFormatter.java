package ca.gc.cra.unilog.application.port;

import ca.gc.cra.unilog.domain.log.LogEvent;

/**
 * Renders a {@link LogEvent} into a single newline-terminated line.
 *
 * <p>Implementations are pure and safe for concurrent use; one instance is shared by a logger and its severity
 * router.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface LogFormatter {
  /**
   * Renders the event.
   *
   * @param event event to render; must not be {@code null}
   * @return UTF-8 bytes of one line including the trailing {@code '\n'}
   */
  byte[] render(LogEvent event);
}
