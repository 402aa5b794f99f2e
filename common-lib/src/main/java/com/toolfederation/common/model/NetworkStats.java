package com.toolfederation.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Point-in-time summary of this node's view of the federation.
 * {@code averageTrust} is rounded to the nearest integer; 0 when no servers are known.
 */
public record NetworkStats(
    @JsonProperty("totalServers") int    totalServers,
    @JsonProperty("totalTools")   int    totalTools,
    @JsonProperty("totalPeers")   int    totalPeers,
    @JsonProperty("averageTrust") long   averageTrust,
    @JsonProperty("networkId")    String networkId
) {}
