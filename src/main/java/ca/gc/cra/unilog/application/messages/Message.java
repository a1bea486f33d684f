package ca.gc.cra.unilog.application.messages;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Envelope of the shape {@code {"head": {...}, "body": ...}}.
 *
 * @param head routing header
 * @param body payload; its type depends on {@link Head#eventType()}
 * @param <T> body type
 * @since 0.1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Message<T>(@JsonProperty("head") Head head, @JsonProperty("body") T body) {}
