package com.toolfederation.federation.service;

import com.toolfederation.common.model.DiscoveryMessage;
import com.toolfederation.common.model.FederatedServer;
import com.toolfederation.common.model.GossipExchange;
import com.toolfederation.common.model.GossipReply;
import com.toolfederation.common.model.MessageReceipt;
import com.toolfederation.common.model.NetworkStats;
import com.toolfederation.common.model.RegistrationResult;
import com.toolfederation.common.model.ToolCallRequest;
import com.toolfederation.common.model.ToolCallResponse;
import com.toolfederation.common.model.ToolMatch;
import com.toolfederation.common.model.TrustMetrics;
import com.toolfederation.common.trust.TrustCalculator;
import com.toolfederation.federation.config.FederationProperties;
import com.toolfederation.federation.discovery.LocalNode;
import com.toolfederation.federation.discovery.PeerDirectory;
import com.toolfederation.federation.discovery.PeerDiscovery;
import com.toolfederation.federation.registry.ListOptions;
import com.toolfederation.federation.registry.SearchOptions;
import com.toolfederation.federation.registry.ServerRegistry;
import com.toolfederation.federation.router.AutoCallOptions;
import com.toolfederation.federation.router.ToolRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * The operations a gateway or peer can invoke on this node.
 *
 * <p>Registration is the only operation that fails: validation errors are thrown, an
 * unreachable endpoint fails the returned {@link Mono}. Everything else returns a value
 * describing the outcome.
 */
@Service
public class FederationService {

    private static final Logger log = LoggerFactory.getLogger(FederationService.class);

    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private final ServerRegistry registry;
    private final ToolRouter router;
    private final PeerDiscovery discovery;
    private final PeerDirectory peerDirectory;
    private final LocalNode localNode;
    private final FederationProperties properties;
    private final Clock clock;

    public FederationService(ServerRegistry registry, ToolRouter router, PeerDiscovery discovery,
                             PeerDirectory peerDirectory, LocalNode localNode,
                             FederationProperties properties, Clock clock) {
        this.registry      = registry;
        this.router        = router;
        this.discovery     = discovery;
        this.peerDirectory = peerDirectory;
        this.localNode     = localNode;
        this.properties    = properties;
        this.clock         = clock;
    }

    // ── registry ──────────────────────────────────────────────────────────────

    public Mono<RegistrationResult> register(FederatedServer server) {
        return registry.registerServer(server);
    }

    public FederatedServer getServer(String serverId) {
        return registry.getServer(serverId);
    }

    public TrustMetrics getTrustMetrics(String serverId) {
        return registry.getTrustMetrics(serverId);
    }

    public List<FederatedServer> listServers(ListOptions options) {
        return registry.listServers(options);
    }

    public List<ToolMatch> searchTools(String query, SearchOptions options) {
        return registry.searchTools(query, options);
    }

    // ── routing ───────────────────────────────────────────────────────────────

    public Mono<ToolCallResponse> callTool(ToolCallRequest request) {
        return router.callTool(request);
    }

    public Mono<ToolCallResponse> callToolAuto(String toolName, Map<String, Object> params,
                                               AutoCallOptions options) {
        return router.callToolAuto(toolName, params, options);
    }

    // ── trust ─────────────────────────────────────────────────────────────────

    /** Counts an abuse report against the server. Unknown ids are logged and ignored. */
    public void reportServer(String serverId, String reason, String reporter) {
        boolean known = registry.recordReport(serverId);
        log.info("SERVER_REPORTED serverId={} reason={} reporter={} known={}",
                 serverId, reason, reporter != null ? reporter : "anonymous", known);
    }

    /**
     * Marks the server's owner as verified.
     *
     * <p>The signature is not checked; any caller can verify any registered server.
     * Verification is not blindly acknowledged: an id this node has never registered is
     * reported as unverified, so callers must not treat the result as always
     * {@code true}.
     *
     * @return {@code false} only when the server is not registered
     */
    public boolean verifyOwner(String serverId, String signature) {
        boolean verified = registry.markOwnerVerified(serverId);
        log.info("OWNER_VERIFIED serverId={} verified={} signaturePresent={}",
                 serverId, verified, signature != null && !signature.isBlank());
        return verified;
    }

    /** @return {@code false} when the server is not registered */
    public boolean markAudited(String serverId) {
        boolean audited = registry.markAudited(serverId);
        log.info("SERVER_AUDITED serverId={} audited={}", serverId, audited);
        return audited;
    }

    /**
     * The server's trust as it would read after decaying for the time since it was last
     * seen, at {@code trustDecayRate} per day. Does not change the stored score.
     *
     * @return the decayed score, or {@code null} if the server is not registered
     */
    public Integer decayedTrust(String serverId) {
        FederatedServer server = registry.getServer(serverId);
        if (server == null) {
            return null;
        }
        double days = Math.max(0L, clock.millis() - server.lastSeenAt()) / MILLIS_PER_DAY;
        return TrustCalculator.applyDecay(server.trustScore(), days, properties.trustDecayRate());
    }

    public NetworkStats stats() {
        List<FederatedServer> servers = registry.allServers();
        int totalTools = servers.stream().mapToInt(s -> s.tools().size()).sum();
        double averageTrust = servers.stream().mapToInt(FederatedServer::trustScore).average().orElse(0.0);
        return new NetworkStats(servers.size(), totalTools, peerDirectory.size(),
                                Math.round(averageTrust), properties.networkId());
    }

    // ── peer traffic ──────────────────────────────────────────────────────────

    public GossipReply handleGossip(GossipExchange exchange) {
        return discovery.handleGossip(exchange);
    }

    public Mono<MessageReceipt> handleMessage(DiscoveryMessage message) {
        return discovery.handleMessage(message);
    }

    /** @return this node's descriptor, or {@code null} when it has none */
    public FederatedServer localServer() {
        return localNode.server();
    }
}
