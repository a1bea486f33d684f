package ca.gc.cra.unilog.api;

import ca.gc.cra.unilog.application.messages.MessageEnvelopes;
import ca.gc.cra.unilog.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code unilog event-type}: prints {@code head.event_type} of a JSON message envelope.
 *
 * @since 0.1.0
 */
public final class EventTypeCli {
  private static final Logger log = LoggerFactory.getLogger(EventTypeCli.class);
  static final String SUMMARY_USAGE = "usage: unilog event-type file=PATH";
  private static final String HELP_TEXT = """
      unilog event-type: print head.event_type of a JSON envelope

      Usage:
        unilog event-type file=./message.json

      Prints an empty line when the envelope has no event type.
      """;

  private EventTypeCli() {}

  /**
   * Runs the command.
   *
   * @param args arguments after the {@code event-type} token
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String file = kv.get("file");
    if (file == null || file.isBlank()) {
      log.error("Missing required argument file");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Path path = Path.of(file);
    try {
      CliPrinter.println(MessageEnvelopes.eventType(Files.readAllBytes(path)));
      return ExitCode.SUCCESS;
    } catch (IllegalArgumentException ex) {
      log.error("Invalid envelope in {}: {}", path, ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read {}", path, ex);
      return ExitCode.IO_ERROR;
    }
  }
}
