package ca.gc.cra.unilog.infrastructure.format;

import ca.gc.cra.unilog.application.port.LogFormatter;
import ca.gc.cra.unilog.application.port.MetricsPort;
import ca.gc.cra.unilog.domain.log.FieldEncodingException;
import ca.gc.cra.unilog.domain.log.FieldValue;
import ca.gc.cra.unilog.domain.log.LogEvent;
import com.fasterxml.jackson.core.JsonEncoding;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Renders log events as single-line JSON objects terminated by {@code '\n'}.
 * <p><strong>Why:</strong> Every line must stay valid JSON whatever the message or field contents, so all strings
 * go through Jackson's escaping.</p>
 * <p><strong>Role:</strong> Adapter implementing {@link LogFormatter}; shared by a logger and its severity
 * router.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Write {@code time}, {@code level}, {@code logger} (named loggers only), {@code line}, {@code msg}, then
 *   the fields in sorted key order.</li>
 *   <li>Prefix field keys that collide with the fixed keys with {@code fields.}; a prefixed key that is already
 *   taken gets a numeric suffix ({@code fields.time.1}).</li>
 *   <li>Write nested fields as a JSON string holding the compact nested object, keys sorted.</li>
 *   <li>Replace numbers JSON cannot carry (NaN, infinities) with an {@code !ENCODING_ERROR(...)} placeholder.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from the thread-safe {@link JsonFactory}.</p>
 * <p><strong>Observability:</strong> Placeholder substitutions are logged at WARN and counted as
 * {@code formatter.field.encodingErrors}.</p>
 *
 * @since 0.1.0
 */
public final class JsonLineFormatter implements LogFormatter {
  private static final Logger log = LoggerFactory.getLogger(JsonLineFormatter.class);

  static final DateTimeFormatter TIME_FORMAT =
      DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSSSSS'Z'").withZone(ZoneOffset.UTC);
  static final Set<String> RESERVED_KEYS = Set.of("time", "level", "logger", "line", "msg");
  private static final String RESERVED_PREFIX = "fields.";
  private static final int INITIAL_BUFFER = 256;

  private final JsonFactory factory = new JsonFactory();
  private final MetricsPort metrics;

  /** Creates a formatter without metrics. */
  public JsonLineFormatter() {
    this(MetricsPort.NO_OP);
  }

  /**
   * Creates a formatter.
   *
   * @param metrics receives {@code formatter.field.encodingErrors}; {@code null} means no metrics
   */
  public JsonLineFormatter(MetricsPort metrics) {
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  @Override
  public byte[] render(LogEvent event) {
    ByteArrayOutputStream out = new ByteArrayOutputStream(INITIAL_BUFFER);
    try (JsonGenerator gen = factory.createGenerator(out, JsonEncoding.UTF8)) {
      gen.writeStartObject();
      gen.writeStringField("time", TIME_FORMAT.format(event.timestamp()));
      gen.writeStringField("level", event.level().label());
      if (event.isNamed()) {
        gen.writeStringField("logger", event.loggerName());
      }
      gen.writeNumberField("line", event.line());
      gen.writeStringField("msg", event.message());
      for (Map.Entry<String, FieldValue> field : sortedFields(event.fields()).entrySet()) {
        writeField(gen, field.getKey(), field.getValue());
      }
      gen.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to render log event", ex);
    }
    out.write('\n');
    return out.toByteArray();
  }

  private void writeField(JsonGenerator gen, String key, FieldValue value) throws IOException {
    gen.writeFieldName(key);
    if (value instanceof FieldValue.Numeric numeric) {
      try {
        writeNumber(gen, key, numeric);
      } catch (FieldEncodingException ex) {
        metrics.increment("formatter.field.encodingErrors");
        log.warn("Field {} written as placeholder: {}", ex.field(), ex.getMessage());
        gen.writeString("!ENCODING_ERROR(" + numeric.text() + ")");
      }
      return;
    }
    if (value instanceof FieldValue.Nested nested) {
      gen.writeString(nestedJson(key, nested));
      return;
    }
    gen.writeString(value.text());
  }

  private String nestedJson(String key, FieldValue.Nested nested) throws IOException {
    StringWriter text = new StringWriter();
    try (JsonGenerator inner = factory.createGenerator(text)) {
      writeNestedObject(inner, key, nested);
    }
    return text.toString();
  }

  private static void writeNestedObject(JsonGenerator gen, String key, FieldValue.Nested nested)
      throws IOException {
    gen.writeStartObject();
    for (Map.Entry<String, FieldValue> entry : nested.sorted().entrySet()) {
      gen.writeFieldName(entry.getKey());
      FieldValue value = entry.getValue();
      if (value instanceof FieldValue.Nested child) {
        writeNestedObject(gen, key + "." + entry.getKey(), child);
      } else if (value instanceof FieldValue.Numeric numeric && numeric.isFinite()) {
        try {
          writeNumber(gen, key + "." + entry.getKey(), numeric);
        } catch (FieldEncodingException ex) {
          gen.writeString(numeric.text());
        }
      } else {
        gen.writeString(value.text());
      }
    }
    gen.writeEndObject();
  }

  private static void writeNumber(JsonGenerator gen, String key, FieldValue.Numeric numeric)
      throws IOException, FieldEncodingException {
    if (!numeric.isFinite()) {
      throw new FieldEncodingException(key, "value " + numeric.text() + " is not a finite JSON number");
    }
    Number value = numeric.value();
    if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
      gen.writeNumber(value.longValue());
    } else if (value instanceof Double d) {
      gen.writeNumber(d);
    } else if (value instanceof Float f) {
      gen.writeNumber(f);
    } else if (value instanceof BigDecimal decimal) {
      gen.writeNumber(decimal);
    } else if (value instanceof BigInteger integer) {
      gen.writeNumber(integer);
    } else {
      double d = value.doubleValue();
      if (!Double.isFinite(d)) {
        throw new FieldEncodingException(key, "value " + numeric.text() + " is not a finite JSON number");
      }
      if (d == Math.rint(d) && Math.abs(d) < 0x1p53) {
        gen.writeNumber(value.longValue());
      } else {
        gen.writeNumber(d);
      }
    }
  }

  private static Map<String, FieldValue> sortedFields(Map<String, FieldValue> fields) {
    Map<String, FieldValue> sorted = new TreeMap<>();
    fields.forEach((key, value) -> {
      if (!RESERVED_KEYS.contains(key)) {
        sorted.put(key, value);
      }
    });
    for (String reserved : new TreeSet<>(RESERVED_KEYS)) {
      FieldValue value = fields.get(reserved);
      if (value == null) {
        continue;
      }
      String renamed = RESERVED_PREFIX + reserved;
      if (sorted.containsKey(renamed)) {
        String base = renamed;
        int suffix = 1;
        while (sorted.containsKey(base + "." + suffix)) {
          suffix++;
        }
        renamed = base + "." + suffix;
        log.warn("Field {} collides with field {}; written as {}", reserved, base, renamed);
      }
      sorted.put(renamed, value);
    }
    return sorted;
  }
}
