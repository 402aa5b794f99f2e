package com.toolfederation.federation.router;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.toolfederation.common.model.FederatedServer;
import com.toolfederation.common.model.FederatedTool;
import com.toolfederation.common.model.ToolCallRequest;
import com.toolfederation.common.model.ToolCallResponse;
import com.toolfederation.federation.client.PeerClient;
import com.toolfederation.federation.config.FederationProperties;
import com.toolfederation.federation.discovery.LocalNode;
import com.toolfederation.federation.registry.ListOptions;
import com.toolfederation.federation.registry.ServerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Routes tool invocations to federated servers.
 *
 * <p>Every call resolves to a {@link ToolCallResponse}; unknown servers, low trust,
 * remote errors and timeouts become {@code success=false} values. Each remote outcome is
 * fed back into the server's metrics via {@link ServerRegistry#recordSuccess} or
 * {@link ServerRegistry#recordError}. Cache hits touch no metrics.
 */
@Component
public class ToolRouter {

    private static final Logger log = LoggerFactory.getLogger(ToolRouter.class);

    private final ServerRegistry registry;
    private final PeerClient peerClient;
    private final LocalNode localNode;
    private final FederationProperties properties;
    private final Clock clock;
    private final ToolResultCache resultCache;

    public ToolRouter(ServerRegistry registry, PeerClient peerClient, LocalNode localNode,
                      FederationProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.registry    = registry;
        this.peerClient  = peerClient;
        this.localNode   = localNode;
        this.properties  = properties;
        this.clock       = clock;
        this.resultCache = new ToolResultCache(objectMapper, properties.cacheToolResultsMs());
    }

    /**
     * Calls {@code request.tool} on {@code request.serverId}.
     *
     * <ol>
     *   <li>unknown server → failure ("Server not found")</li>
     *   <li>trust below {@code minTrustScore} → failure ("trust score too low")</li>
     *   <li>fresh cached result → success with {@code fromCache=true}</li>
     *   <li>otherwise a remote call bounded by {@code requestTimeoutMs}</li>
     * </ol>
     */
    public Mono<ToolCallResponse> callTool(ToolCallRequest request) {
        return Mono.defer(() -> {
            long start = clock.millis();
            String serverId = request.serverId();

            FederatedServer server = registry.getServer(serverId);
            if (server == null) {
                return Mono.just(ToolCallResponse.failure(serverId, request.tool(),
                    "Server not found: " + serverId, clock.millis() - start));
            }
            if (server.trustScore() < properties.minTrustScore()) {
                return Mono.just(ToolCallResponse.failure(serverId, request.tool(),
                    "Server trust score too low: " + server.trustScore(), clock.millis() - start));
            }

            String cacheKey = resultCache.key(serverId, request.tool(), request.params());
            CachedToolResult cached = resultCache.get(cacheKey, start);
            if (cached != null) {
                log.debug("Tool result served from cache. serverId={} tool={}", serverId, request.tool());
                return Mono.just(ToolCallResponse.cached(serverId, request.tool(), cached.result(),
                    clock.millis() - start));
            }

            return peerClient.invokeTool(server.endpoint(), request.tool(), request.params(),
                                         request.apiKey(), localNode.callerId())
                .map(result -> {
                    long durationMs = clock.millis() - start;
                    registry.recordSuccess(serverId, durationMs);
                    resultCache.put(cacheKey, result, clock.millis());
                    log.info("TOOL_CALL_OK serverId={} tool={} durationMs={}", serverId, request.tool(), durationMs);
                    return ToolCallResponse.success(serverId, request.tool(), result, durationMs,
                        costOf(server, request.tool()));
                })
                .onErrorResume(e -> {
                    long durationMs = clock.millis() - start;
                    registry.recordError(serverId);
                    log.warn("TOOL_CALL_FAILED serverId={} tool={} durationMs={} reason={}",
                             serverId, request.tool(), durationMs, e.getMessage());
                    return Mono.just(ToolCallResponse.failure(serverId, request.tool(),
                        e.getMessage() != null ? e.getMessage() : "Unknown error", durationMs));
                });
        });
    }

    /**
     * Calls {@code toolName} on the most trusted server offering it, falling through to
     * the next one on failure. Servers are tried one at a time, highest trust first.
     * A missing tool name matches no server.
     */
    public Mono<ToolCallResponse> callToolAuto(String toolName, Map<String, Object> params,
                                               AutoCallOptions options) {
        AutoCallOptions opts = options != null ? options : AutoCallOptions.none();
        return Mono.defer(() -> {
            if (toolName == null || toolName.isBlank()) {
                return Mono.just(ToolCallResponse.failure("", toolName,
                    "No servers found with tool: " + toolName, 0));
            }
            List<FederatedServer> candidates = registry.listServers(
                new ListOptions(opts.minTrust(), null, List.of(toolName), null));

            if (candidates.isEmpty()) {
                return Mono.just(ToolCallResponse.failure("", toolName,
                    "No servers found with tool: " + toolName, 0));
            }

            return Flux.fromIterable(candidates)
                .concatMap(server -> callTool(new ToolCallRequest(
                    server.id(), toolName, params, opts.userId(), opts.apiKey())))
                .filter(ToolCallResponse::success)
                .next()
                .switchIfEmpty(Mono.fromSupplier(() -> {
                    log.warn("TOOL_CALL_EXHAUSTED tool={} serversTried={}", toolName, candidates.size());
                    return ToolCallResponse.failure("", toolName,
                        "All " + candidates.size() + " servers failed for tool: " + toolName, 0);
                }));
        });
    }

    private static Long costOf(FederatedServer server, String toolName) {
        FederatedTool tool = server.findTool(toolName);
        if (tool == null || tool.pricing() == null) {
            return null;
        }
        return tool.pricing().baseCostMicro();
    }
}
