package com.toolfederation.federation.discovery;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.toolfederation.common.model.DiscoveryMessage;
import com.toolfederation.common.model.FederatedServer;
import com.toolfederation.common.model.MessageType;
import com.toolfederation.common.model.PeerInfo;
import com.toolfederation.federation.client.PeerClient;
import com.toolfederation.federation.config.FederationProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * Broadcasts discovery messages to every known peer.
 *
 * <p>Delivery is best-effort: a peer that fails to accept the message is logged and
 * skipped. Messages are unsigned.
 */
@Component
public class ServerAnnouncer {

    private static final Logger log = LoggerFactory.getLogger(ServerAnnouncer.class);

    private final PeerDirectory peerDirectory;
    private final PeerClient peerClient;
    private final FederationProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ServerAnnouncer(PeerDirectory peerDirectory, PeerClient peerClient,
                           FederationProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.peerDirectory = peerDirectory;
        this.peerClient    = peerClient;
        this.properties    = properties;
        this.objectMapper  = objectMapper;
        this.clock         = clock;
    }

    /**
     * Announces {@code server} to all peers. No-op unless {@code announceEnabled}.
     */
    public Mono<Void> announce(FederatedServer server) {
        if (!properties.announceEnabled()) {
            return Mono.empty();
        }
        DiscoveryMessage message = DiscoveryMessage.of(
            MessageType.ANNOUNCE, server.id(), clock.millis(), objectMapper.valueToTree(server));
        return broadcast(message)
            .doOnSuccess(v -> log.info("SERVER_ANNOUNCED serverId={} peers={}", server.id(), peerDirectory.size()));
    }

    public Mono<Void> broadcast(DiscoveryMessage message) {
        return Flux.fromIterable(peerDirectory.all())
            .concatMap(peer -> deliver(peer, message))
            .then();
    }

    private Mono<Void> deliver(PeerInfo peer, DiscoveryMessage message) {
        return peerClient.sendMessage(peer.endpoint(), message)
            .onErrorResume(e -> {
                log.debug("Discovery message not delivered. peer={} type={} reason={}",
                          peer.serverId(), message.type(), e.getMessage());
                return Mono.empty();
            });
    }
}
