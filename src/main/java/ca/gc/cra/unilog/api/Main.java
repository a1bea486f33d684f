package ca.gc.cra.unilog.api;

import ca.gc.cra.unilog.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code unilog} command dispatcher.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: unilog <emit|event-type> [options]";
  private static final String HELP_TEXT = """
      unilog command dispatcher

      Usage:
        unilog <command> [options]

      Commands:
        emit        Write one structured log event (emit --help for details)
        event-type  Print head.event_type of a JSON message envelope

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to the command
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  /**
   * Dispatches a command and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments; the first non-flag token is the command
   * @return exit code reported by the command
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    String[] remainder = input.keyValueArgs();
    if (remainder.length == 0) {
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }

    String command = remainder[0].toLowerCase(Locale.ROOT);
    String[] delegateArgs = withoutFirst(args, remainder[0]);
    return switch (command) {
      case "emit" -> EmitCli.run(delegateArgs);
      case "event-type" -> EventTypeCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static String[] withoutFirst(String[] args, String token) {
    for (int i = 0; i < args.length; i++) {
      if (args[i] != null && args[i].trim().equals(token)) {
        String[] rest = new String[args.length - 1];
        System.arraycopy(args, 0, rest, 0, i);
        System.arraycopy(args, i + 1, rest, i, args.length - i - 1);
        return rest;
      }
    }
    return Arrays.copyOf(args, args.length);
  }
}
