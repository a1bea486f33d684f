package ca.gc.cra.unilog.application.messages;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of an incoming notification message.
 *
 * @param clientId client id
 * @param companyId company id
 * @param instanceId instance id
 * @param message notification text
 * @param link related link
 * @since 0.1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IncomingMessageBody(
    @JsonProperty("client_id") long clientId,
    @JsonProperty("company_id") long companyId,
    @JsonProperty("instance_id") long instanceId,
    @JsonProperty("message") String message,
    @JsonProperty("link") String link) {}
