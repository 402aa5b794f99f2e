package com.toolfederation.federation.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.List;

/**
 * Federation node settings, bound from {@code federation.*}.
 *
 * <p>All intervals, timeouts and TTLs are milliseconds.
 */
@ConfigurationProperties("federation")
public record FederationProperties(
    @DefaultValue("opensvm-mcp-mainnet") String networkId,
    @DefaultValue List<String> bootstrapPeers,
    @DefaultValue("100")    int maxPeers,
    @DefaultValue("60000")  long gossipIntervalMs,
    @DefaultValue("30000")  long healthCheckIntervalMs,
    @DefaultValue("true")   boolean discoveryEnabled,
    @DefaultValue("false")  boolean announceEnabled,
    String announceEndpoint,
    @DefaultValue("20")     int minTrustScore,
    @DefaultValue("0.99")   double trustDecayRate,
    @DefaultValue("30")     int newServerTrust,
    @DefaultValue("30000")  long requestTimeoutMs,
    @DefaultValue("10000")  long connectionTimeoutMs,
    @DefaultValue("300000") long cacheServerListMs,
    @DefaultValue("60000")  long cacheToolResultsMs,
    @DefaultValue Self self
) {
    public FederationProperties {
        bootstrapPeers = bootstrapPeers != null ? List.copyOf(bootstrapPeers) : List.of();
        self = self != null ? self : new Self(null, null, null, null, null);
    }

    /** Same values as an empty {@code federation:} block. */
    public static FederationProperties defaults() {
        return new FederationProperties("opensvm-mcp-mainnet", List.of(), 100, 60_000, 30_000,
            true, false, null, 20, 0.99, 30, 30_000, 10_000, 300_000, 60_000, null);
    }

    public Duration requestTimeout() {
        return Duration.ofMillis(requestTimeoutMs);
    }

    public Duration connectionTimeout() {
        return Duration.ofMillis(connectionTimeoutMs);
    }

    public Duration gossipInterval() {
        return Duration.ofMillis(gossipIntervalMs);
    }

    public Duration healthCheckInterval() {
        return Duration.ofMillis(healthCheckIntervalMs);
    }

    /**
     * Descriptor of this node as served on {@code /federation/info}. When
     * {@code endpoint} is blank the node runs as a pure client and has no self entry.
     */
    public record Self(String id, String name, String description, String endpoint, String owner) {}
}
