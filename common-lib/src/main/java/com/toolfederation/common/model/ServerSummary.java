package com.toolfederation.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** The subset of a {@link FederatedServer} exchanged during gossip. */
public record ServerSummary(
    @JsonProperty("id")         String id,
    @JsonProperty("name")       String name,
    @JsonProperty("endpoint")   String endpoint,
    @JsonProperty("trustScore") int    trustScore,
    @JsonProperty("lastSeenAt") long   lastSeenAt
) {
    public static ServerSummary from(FederatedServer server) {
        return new ServerSummary(server.id(), server.name(), server.endpoint(),
            server.trustScore(), server.lastSeenAt());
    }
}
