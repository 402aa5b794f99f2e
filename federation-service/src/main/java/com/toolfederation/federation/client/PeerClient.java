package com.toolfederation.federation.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.toolfederation.common.model.DiscoveryMessage;
import com.toolfederation.common.model.FederatedServer;
import com.toolfederation.common.model.GossipExchange;
import com.toolfederation.common.model.GossipReply;
import com.toolfederation.federation.config.FederationProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Every outbound call this node makes to another federation member.
 *
 * <p>Each call races a deadline ({@code requestTimeoutMs} for tool calls,
 * {@code connectionTimeoutMs} for everything else). Non-2xx responses, transport errors
 * and missed deadlines all surface as {@link RemoteCallException}, except for
 * {@link #ping(String)} which folds every failure into {@code false}. A missed deadline
 * only cancels the local subscription; whatever the peer already did stays done.
 */
@Component
public class PeerClient {

    private static final Logger log = LoggerFactory.getLogger(PeerClient.class);

    public static final String NETWORK_HEADER = "X-Federation-Network";
    public static final String CALLER_HEADER  = "X-Federation-Caller";

    private final WebClient peerWebClient;
    private final FederationProperties properties;

    public PeerClient(WebClient peerWebClient, FederationProperties properties) {
        this.peerWebClient = peerWebClient;
        this.properties    = properties;
    }

    /**
     * Liveness probe: {@code GET {endpoint}/health}.
     *
     * @return {@code true} only for a 2xx answer within {@code connectionTimeoutMs}
     */
    public Mono<Boolean> ping(String endpoint) {
        return bounded(peerWebClient.get()
                .uri(endpoint + "/health")
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> failure("Health probe", response))
                .toBodilessEntity(),
            properties.connectionTimeout(), "Health probe " + endpoint)
            .map(response -> response.getStatusCode().is2xxSuccessful())
            .onErrorResume(e -> {
                log.debug("Health probe failed. endpoint={} reason={}", endpoint, e.getMessage());
                return Mono.just(false);
            });
    }

    /** {@code GET {endpoint}/federation/info}: the peer's own server descriptor. */
    public Mono<FederatedServer> fetchInfo(String endpoint) {
        return bounded(peerWebClient.get()
                .uri(endpoint + "/federation/info")
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> failure("Server info fetch", response))
                .bodyToMono(FederatedServer.class),
            properties.connectionTimeout(), "Server info fetch " + endpoint);
    }

    /** {@code POST {endpoint}/federation/gossip}: trade server summaries with a peer. */
    public Mono<GossipReply> exchangeGossip(String endpoint, GossipExchange exchange) {
        return bounded(peerWebClient.post()
                .uri(endpoint + "/federation/gossip")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(exchange)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> failure("Gossip exchange", response))
                .bodyToMono(GossipReply.class)
                .defaultIfEmpty(new GossipReply(null)),
            properties.connectionTimeout(), "Gossip exchange " + endpoint);
    }

    /** {@code POST {endpoint}/federation/message}: deliver a discovery message. */
    public Mono<Void> sendMessage(String endpoint, DiscoveryMessage message) {
        return bounded(peerWebClient.post()
                .uri(endpoint + "/federation/message")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(message)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> failure("Discovery message", response))
                .toBodilessEntity(),
            properties.connectionTimeout(), "Discovery message " + endpoint)
            .then();
    }

    /**
     * {@code POST {endpoint}/tools/{tool}} with {@code params} as the JSON body.
     *
     * @param apiKey   optional; sent as a bearer token when present
     * @param callerId id of this node, sent as {@value #CALLER_HEADER}
     * @return the parsed JSON result; {@link NullNode} when the peer returns no body
     */
    public Mono<JsonNode> invokeTool(String endpoint, String tool, Map<String, Object> params,
                                     String apiKey, String callerId) {
        return bounded(peerWebClient.post()
                .uri(endpoint + "/tools/{tool}", tool)
                .contentType(MediaType.APPLICATION_JSON)
                .headers(headers -> {
                    if (apiKey != null && !apiKey.isBlank()) {
                        headers.set(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
                    }
                    headers.set(NETWORK_HEADER, properties.networkId());
                    headers.set(CALLER_HEADER, callerId);
                })
                .bodyValue(params)
                .retrieve()
                .onStatus(HttpStatusCode::isError, response -> failure("Remote call", response))
                .bodyToMono(JsonNode.class)
                .defaultIfEmpty(NullNode.getInstance()),
            properties.requestTimeout(), "Remote call " + tool);
    }

    private static Mono<? extends Throwable> failure(String what, ClientResponse response) {
        return Mono.just(new RemoteCallException(what + " failed: " + response.statusCode().value()
            + " " + reasonPhrase(response.statusCode())));
    }

    private static String reasonPhrase(HttpStatusCode status) {
        HttpStatus known = HttpStatus.resolve(status.value());
        return known != null ? known.getReasonPhrase() : "";
    }

    private static <T> Mono<T> bounded(Mono<T> call, Duration deadline, String what) {
        return call
            .timeout(deadline)
            .onErrorMap(e -> !(e instanceof RemoteCallException), e -> {
                if (e instanceof TimeoutException) {
                    return new RemoteCallException(what + " timed out after " + deadline.toMillis() + "ms", e);
                }
                return new RemoteCallException(what + " failed: " + e.getMessage(), e);
            });
    }
}
