package com.toolfederation.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Envelope for peer-to-peer discovery traffic posted to {@code /federation/message}.
 *
 * <p>{@code signature} is carried on the wire but never verified: peers are trusted on
 * first contact.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DiscoveryMessage(
    @JsonProperty("type")      MessageType type,
    @JsonProperty("senderId")  String senderId,
    @JsonProperty("timestamp") long timestamp,
    @JsonProperty("payload")   JsonNode payload,
    @JsonProperty("signature") String signature
) {
    public static DiscoveryMessage of(MessageType type, String senderId, long timestamp, JsonNode payload) {
        return new DiscoveryMessage(type, senderId, timestamp, payload, null);
    }
}
