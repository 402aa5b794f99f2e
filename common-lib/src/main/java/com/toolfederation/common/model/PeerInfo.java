package com.toolfederation.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Lightweight gossip-partner record. A node may know peers that are not (yet) full
 * registry entries, and registry entries that are not peers.
 */
public record PeerInfo(
    @JsonProperty("serverId")    String serverId,
    @JsonProperty("endpoint")    String endpoint,
    @JsonProperty("lastContact") long   lastContact,
    @JsonProperty("trustScore")  int    trustScore
) {
    public PeerInfo withLastContact(long timestamp) {
        return new PeerInfo(serverId, endpoint, timestamp, trustScore);
    }
}
