package ca.gc.cra.unilog.domain.log;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Typed value of a structured log field.
 *
 * <p>Each variant has a fixed serialization contract: {@link Numeric} is written as a JSON number, {@link Nested}
 * as a JSON string holding its compact JSON object, every other variant as a JSON string of its {@link #text()}.</p>
 *
 * @since 0.1.0
 */
public sealed interface FieldValue permits FieldValue.Text, FieldValue.Numeric, FieldValue.Bool, FieldValue.Nested {

  /**
   * Natural text representation of the value.
   *
   * @return text form; never {@code null}
   */
  String text();

  /**
   * Converts an arbitrary object into a field value.
   *
   * @param value source object; {@code null} becomes the text {@code "null"}
   * @return typed field value
   */
  static FieldValue of(Object value) {
    if (value instanceof FieldValue field) {
      return field;
    }
    if (value instanceof CharSequence chars) {
      return new Text(chars.toString());
    }
    if (value instanceof Number number) {
      return new Numeric(number);
    }
    if (value instanceof Boolean bool) {
      return new Bool(bool);
    }
    if (value instanceof Map<?, ?> map) {
      Map<String, FieldValue> nested = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        nested.put(String.valueOf(entry.getKey()), of(entry.getValue()));
      }
      return new Nested(nested);
    }
    return new Text(String.valueOf(value));
  }

  /**
   * Converts a map of raw objects into typed field values.
   *
   * @param fields raw fields; {@code null} yields an empty map, a {@code null} key becomes {@code "null"}
   * @return immutable map of typed values
   */
  static Map<String, FieldValue> fromMap(Map<String, ?> fields) {
    if (fields == null || fields.isEmpty()) {
      return Map.of();
    }
    Map<String, FieldValue> converted = new LinkedHashMap<>();
    for (Map.Entry<String, ?> entry : fields.entrySet()) {
      converted.put(String.valueOf(entry.getKey()), of(entry.getValue()));
    }
    return Map.copyOf(converted);
  }

  /**
   * Plain text.
   *
   * @param value text; never {@code null}
   */
  record Text(String value) implements FieldValue {
    public Text {
      Objects.requireNonNull(value, "value");
    }

    @Override
    public String text() {
      return value;
    }
  }

  /**
   * Numeric value written as a JSON number.
   *
   * @param value number; never {@code null}
   */
  record Numeric(Number value) implements FieldValue {
    public Numeric {
      Objects.requireNonNull(value, "value");
    }

    /**
     * Returns whether the value can be represented as a JSON number.
     *
     * @return {@code false} for NaN and infinities
     */
    public boolean isFinite() {
      if (value instanceof Double d) {
        return Double.isFinite(d);
      }
      if (value instanceof Float f) {
        return Float.isFinite(f);
      }
      return true;
    }

    @Override
    public String text() {
      return value.toString();
    }
  }

  /**
   * Boolean value.
   *
   * @param value flag
   */
  record Bool(boolean value) implements FieldValue {
    @Override
    public String text() {
      return Boolean.toString(value);
    }
  }

  /**
   * Nested map of field values. Formatters render it as a compact JSON object; {@link #text()} is a readable
   * {@code {key=value, ...}} form with keys in sorted order.
   *
   * @param values nested fields; never {@code null}
   */
  record Nested(Map<String, FieldValue> values) implements FieldValue {
    public Nested {
      values = Map.copyOf(Objects.requireNonNull(values, "values"));
    }

    /**
     * Returns the entries in sorted key order.
     *
     * @return sorted view of {@link #values()}
     */
    public SortedMap<String, FieldValue> sorted() {
      return Collections.unmodifiableSortedMap(new TreeMap<>(values));
    }

    @Override
    public String text() {
      StringJoiner joiner = new StringJoiner(", ", "{", "}");
      sorted().forEach((key, value) -> joiner.add(key + "=" + value.text()));
      return joiner.toString();
    }
  }
}
