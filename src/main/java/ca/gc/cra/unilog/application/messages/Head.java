package ca.gc.cra.unilog.application.messages;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Routing header carried by every message envelope.
 *
 * @param destination target service
 * @param time producer timestamp
 * @param correlationId id shared by a request and its replies
 * @param eventType event type used to dispatch the body
 * @param source producing service
 * @since 0.1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Head(
    @JsonProperty("destination") String destination,
    @JsonProperty("time") long time,
    @JsonProperty("correlation_id") String correlationId,
    @JsonProperty("event_type") String eventType,
    @JsonProperty("source") String source) {}
