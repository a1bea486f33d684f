package ca.gc.cra.unilog.application.messages;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.util.Objects;

/**
 * Stateless helpers for {@link Message} envelopes.
 *
 * <p>{@link #eventType(byte[])} streams through the document and keeps only {@code head.event_type}; the body is
 * tokenized but never bound, so envelopes with unknown body shapes can be dispatched before decoding.</p>
 *
 * @since 0.1.0
 */
public final class MessageEnvelopes {
  private static final ObjectMapper MAPPER = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
      .configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);
  private static final JsonFactory FACTORY = MAPPER.getFactory();

  private MessageEnvelopes() {}

  /**
   * Reads {@code head.event_type} from a JSON envelope.
   *
   * @param data UTF-8 JSON document
   * @return event type, or {@code ""} when the head or its event type is absent or {@code null}
   * @throws IllegalArgumentException when the document is not a well-formed JSON object or the event type is not
   *     a string
   */
  public static String eventType(byte[] data) {
    Objects.requireNonNull(data, "data");
    try (JsonParser parser = FACTORY.createParser(data)) {
      if (parser.nextToken() != JsonToken.START_OBJECT) {
        throw new IllegalArgumentException("Envelope is not a JSON object");
      }
      String eventType = "";
      while (parser.nextToken() == JsonToken.FIELD_NAME) {
        String field = parser.getCurrentName();
        JsonToken value = parser.nextToken();
        if ("head".equals(field) && value == JsonToken.START_OBJECT) {
          eventType = readEventType(parser);
        } else {
          parser.skipChildren();
        }
      }
      if (parser.nextToken() != null) {
        throw new IllegalArgumentException("Envelope contains trailing content");
      }
      return eventType;
    } catch (IOException ex) {
      throw new IllegalArgumentException("Failed to read envelope head: " + ex.getMessage(), ex);
    }
  }

  /**
   * Decodes a JSON payload, ignoring unknown properties.
   *
   * @param data UTF-8 JSON document
   * @param type target type
   * @param <T> target type
   * @return decoded value
   * @throws IllegalArgumentException when the payload cannot be decoded into {@code type}
   */
  public static <T> T convert(byte[] data, Class<T> type) {
    Objects.requireNonNull(data, "data");
    Objects.requireNonNull(type, "type");
    try {
      return MAPPER.readValue(data, type);
    } catch (IOException ex) {
      throw new IllegalArgumentException("Failed to decode payload as " + type.getSimpleName(), ex);
    }
  }

  /**
   * Decodes a JSON payload into a generic type such as {@code Message<IncomingMessageBody>}.
   *
   * @param data UTF-8 JSON document
   * @param type target type reference
   * @param <T> target type
   * @return decoded value
   * @throws IllegalArgumentException when the payload cannot be decoded into {@code type}
   */
  public static <T> T convert(byte[] data, TypeReference<T> type) {
    Objects.requireNonNull(data, "data");
    Objects.requireNonNull(type, "type");
    try {
      return MAPPER.readValue(data, type);
    } catch (IOException ex) {
      throw new IllegalArgumentException("Failed to decode payload as " + type.getType().getTypeName(), ex);
    }
  }

  private static String readEventType(JsonParser parser) throws IOException {
    String eventType = "";
    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      String field = parser.getCurrentName();
      JsonToken value = parser.nextToken();
      if ("event_type".equals(field)) {
        if (value == JsonToken.VALUE_STRING) {
          eventType = parser.getText();
        } else if (value != JsonToken.VALUE_NULL) {
          throw new IllegalArgumentException("head.event_type must be a string but was " + value);
        }
      } else {
        parser.skipChildren();
      }
    }
    return eventType;
  }
}
