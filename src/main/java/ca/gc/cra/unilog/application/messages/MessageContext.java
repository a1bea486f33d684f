package ca.gc.cra.unilog.application.messages;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Tenant identifiers attached to outgoing messages.
 *
 * @param clientId client id
 * @param firmId firm id
 * @param instanceId instance id
 * @since 0.1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MessageContext(
    @JsonProperty("client_id") long clientId,
    @JsonProperty("firm_id") long firmId,
    @JsonProperty("instance_id") long instanceId) {}
