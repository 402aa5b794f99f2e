package com.toolfederation.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Identity and capability record of one server known to the federation.
 *
 * <p>Immutable: the registry replaces the record whenever {@code trustScore} or
 * {@code lastSeenAt} change. {@code trustScore} is a cached projection of the server's
 * {@link TrustMetrics}; only the registry writes it. Timestamps are epoch milliseconds.
 */
public record FederatedServer(
    @JsonProperty("id")           String id,
    @JsonProperty("name")         String name,
    @JsonProperty("description")  String description,
    @JsonProperty("endpoint")     String endpoint,
    @JsonProperty("mcpVersion")   String mcpVersion,
    @JsonProperty("owner")        String owner,
    @JsonProperty("tools")        List<FederatedTool> tools,
    @JsonProperty("capabilities") ServerCapabilities capabilities,
    @JsonProperty("trustScore")   int trustScore,
    @JsonProperty("registeredAt") long registeredAt,
    @JsonProperty("lastSeenAt")   long lastSeenAt,
    @JsonProperty("metadata")     ServerMetadata metadata
) {
    public FederatedServer {
        tools = tools != null ? List.copyOf(tools) : List.of();
    }

    public FederatedServer withId(String newId) {
        return new FederatedServer(newId, name, description, endpoint, mcpVersion, owner, tools,
            capabilities, trustScore, registeredAt, lastSeenAt, metadata);
    }

    public FederatedServer withTrustScore(int score) {
        return new FederatedServer(id, name, description, endpoint, mcpVersion, owner, tools,
            capabilities, score, registeredAt, lastSeenAt, metadata);
    }

    public FederatedServer withLastSeenAt(long timestamp) {
        return new FederatedServer(id, name, description, endpoint, mcpVersion, owner, tools,
            capabilities, trustScore, registeredAt, timestamp, metadata);
    }

    /** Stamps a freshly registered server with its registration time and starting trust. */
    public FederatedServer registeredAt(long timestamp, int initialTrust) {
        return new FederatedServer(id, name, description, endpoint, mcpVersion, owner, tools,
            capabilities, initialTrust, timestamp, timestamp, metadata);
    }

    public boolean hasTool(String toolName) {
        return tools.stream().anyMatch(t -> t.name() != null && t.name().equals(toolName));
    }

    public boolean hasToolInCategory(String category) {
        return tools.stream().anyMatch(t -> category.equals(t.category()));
    }

    public FederatedTool findTool(String toolName) {
        return tools.stream()
            .filter(t -> t.name() != null && t.name().equals(toolName))
            .findFirst()
            .orElse(null);
    }
}
