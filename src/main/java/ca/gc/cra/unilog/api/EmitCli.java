package ca.gc.cra.unilog.api;

import ca.gc.cra.unilog.application.logging.EmitResult;
import ca.gc.cra.unilog.application.logging.LoggerRegistry;
import ca.gc.cra.unilog.application.logging.StructuredLogger;
import ca.gc.cra.unilog.config.LoggerConfig;
import ca.gc.cra.unilog.config.LoggingBootstrap;
import ca.gc.cra.unilog.config.LoggingConfig;
import ca.gc.cra.unilog.config.YamlConfigLoader;
import ca.gc.cra.unilog.domain.log.Level;
import ca.gc.cra.unilog.domain.log.LogConfigurationException;
import ca.gc.cra.unilog.domain.log.LoggerNotInitializedException;
import ca.gc.cra.unilog.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code unilog emit}: writes one event through a logger built from arguments or a YAML file.
 *
 * @since 0.1.0
 */
public final class EmitCli {
  private static final Logger log = LoggerFactory.getLogger(EmitCli.class);
  private static final String FIELD_PREFIX = "field.";
  static final String SUMMARY_USAGE =
      "usage: unilog emit msg=TEXT [name=NAME] [level=LEVEL] [dir=PATH] [minLevel=LEVEL] "
          + "[errorSplit=true|false] [config=FILE] [field.KEY=VALUE ...]";
  private static final String HELP_TEXT = """
      unilog emit: write one structured log event

      Usage:
        unilog emit msg="payment failed" name=orders level=error dir=./logs

      Required:
        msg=TEXT               Event message

      Optional:
        name=NAME              Logger name; omitted means the default logger (app.log)
        level=LEVEL            Event level: debug|info|warn|error|fatal (default info)
        dir=PATH               Log directory (default ./logs)
        minLevel=LEVEL         Logger minimum level (default debug); unknown values mean info
        errorSplit=true|false  Mirror ERROR and FATAL events to <base>_error<ext>
        config=FILE            YAML logging configuration; replaces dir/minLevel/errorSplit
        field.KEY=VALUE        Structured field; repeatable
        --verbose              Enable DEBUG logging
        --help                 Show this message
      """;

  private EmitCli() {}

  /**
   * Runs the command.
   *
   * @param args arguments after the {@code emit} token
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
      log.debug("Verbose logging enabled for emit");
    }

    Map<String, String> kv;
    try {
      kv = CliArgsParser.toMap(input.keyValueArgs());
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String message = kv.get("msg");
    if (message == null) {
      log.error("Missing required argument msg");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    Optional<Level> level = Level.tryParse(kv.getOrDefault("level", "info"));
    if (level.isEmpty()) {
      log.error("Unknown event level: {}", kv.get("level"));
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    String name = blankToNull(kv.get("name"));

    LoggingConfig config;
    try {
      config = resolveConfig(kv, name);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid logging configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file {}", kv.get("config"), ex);
      return ExitCode.IO_ERROR;
    }

    try (LoggingBootstrap bootstrap = LoggingBootstrap.start(config)) {
      LoggerRegistry registry = bootstrap.registry();
      StructuredLogger logger = registry.lookup(name);
      EmitResult result = logger.emit(level.get(), message, fields(kv));
      CliPrinter.println(result.name());
      return result == EmitResult.WRITE_FAILED || result == EmitResult.MIRROR_FAILED
          ? ExitCode.IO_ERROR
          : ExitCode.SUCCESS;
    } catch (LoggerNotInitializedException ex) {
      log.error("No logger named {} and no default logger in {}", ex.loggerName(), kv.get("config"));
      return ExitCode.CONFIG_ERROR;
    } catch (LogConfigurationException ex) {
      log.error("Cannot create logger: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (IOException ex) {
      log.error("Failed to close log files", ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected failure while emitting", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static LoggingConfig resolveConfig(Map<String, String> kv, String name) throws IOException {
    String configPath = blankToNull(kv.get("config"));
    if (configPath != null) {
      Path path = Path.of(configPath);
      return YamlConfigLoader.load(path)
          .orElseThrow(() -> new IllegalArgumentException("configuration file does not exist: " + path));
    }
    Map<String, String> settings = new LinkedHashMap<>();
    settings.put("level", kv.getOrDefault("minLevel", "debug"));
    if (kv.containsKey("dir")) {
      settings.put("dir", kv.get("dir"));
    }
    settings.put("errorSplit", kv.getOrDefault("errorSplit", "false"));
    LoggerConfig logger = LoggerConfig.fromMap(name, settings);
    return name == null
        ? new LoggingConfig(logger, Map.of(), "none")
        : new LoggingConfig(null, Map.of(name, logger), "none");
  }

  private static Map<String, Object> fields(Map<String, String> kv) {
    Map<String, Object> fields = new LinkedHashMap<>();
    kv.forEach((key, value) -> {
      if (key.startsWith(FIELD_PREFIX) && key.length() > FIELD_PREFIX.length()) {
        fields.put(key.substring(FIELD_PREFIX.length()), value);
      }
    });
    return fields;
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value;
  }
}
