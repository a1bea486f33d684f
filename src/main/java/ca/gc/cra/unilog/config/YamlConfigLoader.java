package ca.gc.cra.unilog.config;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Loads logging configuration from YAML.
 *
 * <p>Expected layout: an optional {@code defaults} section for the anonymous default logger, a {@code loggers}
 * mapping with one section per named logger, and an optional {@code metrics} section. Each logger section is
 * flattened to dotted keys ({@code rotation.maxSizeMiB}) and handed to
 * {@link LoggerConfig#fromMap(String, Map)}.</p>
 */
public final class YamlConfigLoader {

  private YamlConfigLoader() {}

  /**
   * Loads the YAML file at {@code path}.
   *
   * @param path location of the YAML configuration
   * @return parsed configuration, or empty when the file does not exist
   * @throws IOException when the file cannot be read
   * @throws IllegalArgumentException when the YAML structure or a value is invalid
   */
  public static Optional<LoggingConfig> load(Path path) throws IOException {
    Objects.requireNonNull(path, "path");
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
      return Optional.of(parse(reader, path.toString()));
    }
  }

  /**
   * Parses YAML text.
   *
   * @param yaml YAML document
   * @return parsed configuration
   * @throws IllegalArgumentException when the YAML structure or a value is invalid
   */
  public static LoggingConfig parse(String yaml) {
    Objects.requireNonNull(yaml, "yaml");
    return parse(new StringReader(yaml), "<inline>");
  }

  private static LoggingConfig parse(Reader reader, String source) {
    Object document;
    try {
      document = new Yaml().load(reader);
    } catch (YAMLException ex) {
      throw new IllegalArgumentException("Failed to parse YAML config at " + source, ex);
    }
    if (document == null) {
      return LoggingConfig.empty();
    }
    Map<String, Object> root = asMap(document, "root");

    LoggerConfig defaults = null;
    Object defaultsSection = root.get("defaults");
    if (defaultsSection != null) {
      defaults = LoggerConfig.fromMap(null, flatten(asMap(defaultsSection, "defaults")));
    }

    Map<String, LoggerConfig> loggers = new LinkedHashMap<>();
    Object loggersSection = root.get("loggers");
    if (loggersSection != null) {
      for (Map.Entry<String, Object> entry : asMap(loggersSection, "loggers").entrySet()) {
        String name = entry.getKey();
        Map<String, String> settings =
            entry.getValue() == null ? Map.of() : flatten(asMap(entry.getValue(), "loggers." + name));
        loggers.put(name, LoggerConfig.fromMap(name, settings));
      }
    }

    String exporter = null;
    Object metricsSection = root.get("metrics");
    if (metricsSection != null) {
      exporter = flatten(asMap(metricsSection, "metrics")).get("exporter");
    }
    return new LoggingConfig(defaults, loggers, exporter);
  }

  private static Map<String, Object> asMap(Object node, String context) {
    if (!(node instanceof Map<?, ?> raw)) {
      throw new IllegalArgumentException(context + " section must be a mapping");
    }
    Map<String, Object> map = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      if (!(entry.getKey() instanceof String key)) {
        throw new IllegalArgumentException(context + " section contains non-string key");
      }
      map.put(key, entry.getValue());
    }
    return map;
  }

  private static Map<String, String> flatten(Map<String, Object> section) {
    Map<String, String> flattened = new LinkedHashMap<>();
    flatten(section, "", flattened);
    return flattened;
  }

  private static void flatten(Map<String, Object> source, String prefix, Map<String, String> target) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = entry.getKey();
      if (key.isBlank()) {
        throw new IllegalArgumentException("YAML contains blank keys");
      }
      String composite = prefix.isEmpty() ? key : prefix + '.' + key;
      Object value = entry.getValue();
      if (value == null) {
        target.put(composite, "");
      } else if (value instanceof Map<?, ?> nested) {
        flatten(asMap(nested, composite), composite, target);
      } else if (value instanceof Iterable<?>) {
        throw new IllegalArgumentException("YAML arrays are not supported for key " + composite);
      } else {
        target.put(composite, value.toString());
      }
    }
  }
}
