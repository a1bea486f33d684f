package ca.gc.cra.unilog.application.messages;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of an outgoing message: tenant context plus an arbitrary payload.
 *
 * @param context tenant identifiers
 * @param message payload; decoded as maps, lists, and scalars
 * @since 0.1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SendingMessageBody(
    @JsonProperty("context") MessageContext context, @JsonProperty("message") Object message) {}
