package com.toolfederation.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Request body of {@code POST /federation/gossip}. */
public record GossipExchange(
    @JsonProperty("type")     String type,
    @JsonProperty("senderId") String senderId,
    @JsonProperty("servers")  List<ServerSummary> servers
) {
    public static final String EXCHANGE = "exchange";

    public GossipExchange {
        servers = servers != null ? List.copyOf(servers) : List.of();
    }

    public static GossipExchange of(String senderId, List<ServerSummary> servers) {
        return new GossipExchange(EXCHANGE, senderId, servers);
    }
}
