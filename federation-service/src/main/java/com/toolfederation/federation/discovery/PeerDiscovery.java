package com.toolfederation.federation.discovery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.toolfederation.common.exception.ServerValidationException;
import com.toolfederation.common.model.DiscoveryMessage;
import com.toolfederation.common.model.FederatedServer;
import com.toolfederation.common.model.GossipExchange;
import com.toolfederation.common.model.GossipReply;
import com.toolfederation.common.model.MessageReceipt;
import com.toolfederation.common.model.MessageType;
import com.toolfederation.common.model.PeerInfo;
import com.toolfederation.common.model.RegistrationResult;
import com.toolfederation.common.model.ServerSummary;
import com.toolfederation.federation.client.PeerClient;
import com.toolfederation.federation.config.FederationProperties;
import com.toolfederation.federation.registry.ListOptions;
import com.toolfederation.federation.registry.ServerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Bootstrap, gossip and inbound discovery traffic.
 *
 * <p>All outbound work here is best-effort. A peer that cannot be reached, answers with
 * an error or times out is logged and skipped; nothing returned from {@link #bootstrap()},
 * {@link #gossipRound()} or {@link #discoverServer(String)} ever errors.
 *
 * <p>Servers learned from peers are registered on the peer's word: announce payloads
 * and gossip summaries carry no verified signature.
 */
@Component
public class PeerDiscovery {

    private static final Logger log = LoggerFactory.getLogger(PeerDiscovery.class);

    static final int GOSSIP_FANOUT = 3;

    private final ServerRegistry registry;
    private final PeerDirectory peerDirectory;
    private final PeerClient peerClient;
    private final LocalNode localNode;
    private final FederationProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public PeerDiscovery(ServerRegistry registry, PeerDirectory peerDirectory, PeerClient peerClient,
                         LocalNode localNode, FederationProperties properties,
                         ObjectMapper objectMapper, Clock clock) {
        this.registry      = registry;
        this.peerDirectory = peerDirectory;
        this.peerClient    = peerClient;
        this.localNode     = localNode;
        this.properties    = properties;
        this.objectMapper  = objectMapper;
        this.clock         = clock;
    }

    // ── bootstrap ─────────────────────────────────────────────────────────────

    /**
     * Contacts every configured seed in turn: registers the seed's own server if it is
     * new, then records the seed as a gossip peer. A failing seed does not stop the rest.
     */
    public Mono<Void> bootstrap() {
        List<String> seeds = properties.bootstrapPeers();
        log.info("BOOTSTRAP_START seeds={}", seeds.size());
        return Flux.fromIterable(seeds)
            .concatMap(this::bootstrapFrom)
            .then()
            .doOnSuccess(v -> log.info("BOOTSTRAP_DONE peers={} servers={}", peerDirectory.size(), registry.size()));
    }

    private Mono<Void> bootstrapFrom(String seed) {
        return discoverServer(seed)
            .then(Mono.defer(() -> peerClient.fetchInfo(seed)))
            .doOnNext(info -> {
                if (info.id() == null || info.id().isBlank()) {
                    log.warn("Bootstrap seed returned no server id. endpoint={}", seed);
                    return;
                }
                peerDirectory.add(new PeerInfo(info.id(), seed, clock.millis(), info.trustScore()));
                log.info("PEER_ADDED serverId={} endpoint={} source=bootstrap", info.id(), seed);
            })
            .then()
            .onErrorResume(e -> {
                log.warn("Failed to bootstrap from seed. endpoint={} reason={}", seed, e.getMessage());
                return Mono.empty();
            });
    }

    /**
     * Fetches {@code {endpoint}/federation/info} and registers the described server when
     * this node does not know it yet. A descriptor without an id is skipped, as is one
     * whose id or endpoint is already registered. Every failure is swallowed.
     */
    public Mono<Void> discoverServer(String endpoint) {
        return peerClient.fetchInfo(endpoint)
            .flatMap(server -> {
                if (server.id() == null || server.id().isBlank()) {
                    log.debug("Discovery skipped, descriptor has no id. endpoint={}", endpoint);
                    return Mono.<RegistrationResult>empty();
                }
                if (registry.contains(server.id()) || registry.containsEndpoint(server.endpoint())
                        || isSelf(server.id(), server.endpoint())) {
                    return Mono.<RegistrationResult>empty();
                }
                return registry.registerServer(server)
                    .doOnNext(r -> log.info("SERVER_DISCOVERED serverId={} endpoint={}", r.serverId(), endpoint));
            })
            .then()
            .onErrorResume(e -> {
                log.debug("Discovery failed. endpoint={} reason={}", endpoint, e.getMessage());
                return Mono.empty();
            });
    }

    // ── gossip ────────────────────────────────────────────────────────────────

    /**
     * Exchanges server lists with up to {@value #GOSSIP_FANOUT} random peers, one after
     * another. Without peers this completes immediately and makes no calls.
     */
    public Mono<Void> gossipRound() {
        if (peerDirectory.isEmpty()) {
            return Mono.empty();
        }
        List<PeerInfo> selected = selectRandomPeers(peerDirectory.all(), GOSSIP_FANOUT);
        return Flux.fromIterable(selected)
            .concatMap(this::exchangeServerList)
            .then()
            .doOnSuccess(v -> log.debug("Gossip round complete. peersContacted={} servers={}",
                                        selected.size(), registry.size()));
    }

    static List<PeerInfo> selectRandomPeers(List<PeerInfo> peers, int count) {
        List<PeerInfo> shuffled = new ArrayList<>(peers);
        Collections.shuffle(shuffled, ThreadLocalRandom.current());
        return shuffled.subList(0, Math.min(count, shuffled.size()));
    }

    private Mono<Void> exchangeServerList(PeerInfo peer) {
        GossipExchange exchange = GossipExchange.of(localNode.callerId(), summaries(registry.allServers()));
        return peerClient.exchangeGossip(peer.endpoint(), exchange)
            .flatMap(reply -> Flux.fromIterable(reply.servers())
                .filter(this::isUnknown)
                .concatMap(summary -> discoverServer(summary.endpoint()))
                .then(Mono.fromRunnable(() -> peerDirectory.touch(peer.serverId(), clock.millis()))))
            .then()
            .onErrorResume(e -> {
                log.warn("Gossip failed with peer. serverId={} endpoint={} reason={}",
                         peer.serverId(), peer.endpoint(), e.getMessage());
                return Mono.empty();
            });
    }

    private boolean isUnknown(ServerSummary summary) {
        return summary.endpoint() != null
            && !registry.contains(summary.id())
            && !registry.containsEndpoint(summary.endpoint())
            && !isSelf(summary.id(), summary.endpoint());
    }

    private boolean isSelf(String serverId, String endpoint) {
        FederatedServer self = localNode.server();
        return self != null && (Objects.equals(self.id(), serverId) || Objects.equals(self.endpoint(), endpoint));
    }

    // ── inbound ───────────────────────────────────────────────────────────────

    /** Answers a peer's gossip with summaries of the servers this node lists. */
    public GossipReply handleGossip(GossipExchange exchange) {
        log.debug("Gossip received. senderId={} servers={}",
                  exchange == null ? null : exchange.senderId(),
                  exchange == null ? 0 : exchange.servers().size());
        return new GossipReply(summaries(registry.listServers(ListOptions.none())));
    }

    /**
     * Handles an inbound discovery message.
     *
     * <p>{@code announce} registers the payload as a server; its registration errors
     * propagate. {@code ping} is answered with {@code pong} and {@code query} with a
     * {@code response} carrying this node's server summaries. Anything else is
     * acknowledged.
     */
    public Mono<MessageReceipt> handleMessage(DiscoveryMessage message) {
        if (message == null || message.type() == null) {
            return Mono.just(MessageReceipt.acknowledged());
        }
        log.debug("Discovery message received. type={} senderId={}", message.type(), message.senderId());
        return switch (message.type()) {
            case ANNOUNCE -> handleAnnounce(message);
            case PING -> Mono.just(MessageReceipt.replying(reply(MessageType.PONG, null)));
            case QUERY -> Mono.just(MessageReceipt.replying(reply(MessageType.RESPONSE,
                objectMapper.valueToTree(summaries(registry.listServers(ListOptions.none()))))));
            case RESPONSE, PONG -> Mono.just(MessageReceipt.acknowledged());
        };
    }

    private Mono<MessageReceipt> handleAnnounce(DiscoveryMessage message) {
        if (message.payload() == null || message.payload().isNull()) {
            return Mono.just(MessageReceipt.acknowledged());
        }
        FederatedServer announced;
        try {
            announced = objectMapper.treeToValue(message.payload(), FederatedServer.class);
        } catch (JsonProcessingException e) {
            return Mono.error(new ServerValidationException(message.senderId(),
                "announce payload is not a server descriptor: " + e.getOriginalMessage()));
        }
        return Mono.defer(() -> registry.registerServer(announced))
            .doOnNext(r -> log.info("SERVER_ANNOUNCE_ACCEPTED serverId={} senderId={}", r.serverId(), message.senderId()))
            .thenReturn(MessageReceipt.acknowledged());
    }

    private DiscoveryMessage reply(MessageType type, JsonNode payload) {
        return DiscoveryMessage.of(type, localNode.callerId(), clock.millis(), payload);
    }

    private static List<ServerSummary> summaries(List<FederatedServer> servers) {
        return servers.stream().map(ServerSummary::from).toList();
    }
}
