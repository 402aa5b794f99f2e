package com.toolfederation.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Answer to an inbound {@link DiscoveryMessage}. {@code reply} is set for messages that
 * expect one (ping → pong, query → response).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MessageReceipt(
    @JsonProperty("received") boolean received,
    @JsonProperty("reply")    DiscoveryMessage reply
) {
    public static MessageReceipt acknowledged() {
        return new MessageReceipt(true, null);
    }

    public static MessageReceipt replying(DiscoveryMessage reply) {
        return new MessageReceipt(true, reply);
    }
}
