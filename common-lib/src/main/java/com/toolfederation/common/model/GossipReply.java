package com.toolfederation.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Response body of {@code POST /federation/gossip}. */
public record GossipReply(
    @JsonProperty("servers") List<ServerSummary> servers
) {
    public GossipReply {
        servers = servers != null ? List.copyOf(servers) : List.of();
    }
}
