package com.toolfederation.federation.discovery;

import com.toolfederation.common.model.PeerInfo;
import com.toolfederation.federation.config.FederationProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Gossip partners known to this node, keyed by server id.
 *
 * <p>Capped at {@code maxPeers}: adding a new peer to a full directory drops the peer
 * with the oldest {@code lastContact}.
 */
@Component
public class PeerDirectory {

    private static final Logger log = LoggerFactory.getLogger(PeerDirectory.class);

    private final ConcurrentHashMap<String, PeerInfo> peers = new ConcurrentHashMap<>();
    private final int maxPeers;

    public PeerDirectory(FederationProperties properties) {
        this.maxPeers = Math.max(1, properties.maxPeers());
    }

    public synchronized void add(PeerInfo peer) {
        if (!peers.containsKey(peer.serverId()) && peers.size() >= maxPeers) {
            peers.values().stream()
                .min(Comparator.comparingLong(PeerInfo::lastContact))
                .ifPresent(oldest -> {
                    peers.remove(oldest.serverId());
                    log.info("PEER_DROPPED serverId={} reason=maxPeers({}) reached", oldest.serverId(), maxPeers);
                });
        }
        peers.put(peer.serverId(), peer);
    }

    public void touch(String serverId, long timestamp) {
        peers.computeIfPresent(serverId, (id, peer) -> peer.withLastContact(timestamp));
    }

    public PeerInfo get(String serverId) {
        return peers.get(serverId);
    }

    public List<PeerInfo> all() {
        return new ArrayList<>(peers.values());
    }

    public int size() {
        return peers.size();
    }

    public boolean isEmpty() {
        return peers.isEmpty();
    }
}
