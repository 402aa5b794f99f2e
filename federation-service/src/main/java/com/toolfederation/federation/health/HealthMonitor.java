package com.toolfederation.federation.health;

import com.toolfederation.common.model.FederatedServer;
import com.toolfederation.federation.client.PeerClient;
import com.toolfederation.federation.registry.ProbeOutcome;
import com.toolfederation.federation.registry.ServerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Re-probes servers that have gone quiet.
 *
 * <p>A server is stale once {@link #STALE_THRESHOLD} has passed since its
 * {@code lastSeenAt}. Each stale server gets one {@code GET /health}; the answer is
 * applied through {@link ServerRegistry#recordProbe}, which evicts servers whose trust
 * drops below {@link #EVICTION_TRUST_THRESHOLD}. Eviction is immediate and permanent.
 */
@Component
public class HealthMonitor {

    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    public static final Duration STALE_THRESHOLD = Duration.ofMinutes(5);
    public static final int EVICTION_TRUST_THRESHOLD = 5;

    private final ServerRegistry registry;
    private final PeerClient peerClient;
    private final Clock clock;

    public HealthMonitor(ServerRegistry registry, PeerClient peerClient, Clock clock) {
        this.registry   = registry;
        this.peerClient = peerClient;
        this.clock      = clock;
    }

    /** Probes every stale server once, sequentially. Never errors. */
    public Mono<HealthReport> healthCheckRound() {
        return Mono.defer(() -> {
            long now = clock.millis();
            List<FederatedServer> stale = registry.allServers().stream()
                .filter(s -> now - s.lastSeenAt() > STALE_THRESHOLD.toMillis())
                .toList();
            if (stale.isEmpty()) {
                return Mono.just(HealthReport.empty());
            }

            return Flux.fromIterable(stale)
                .concatMap(this::probe)
                .collectList()
                .map(outcomes -> summarize(stale.size(), outcomes));
        });
    }

    private Mono<ProbeOutcome> probe(FederatedServer server) {
        return peerClient.ping(server.endpoint())
            .onErrorReturn(false)
            .map(alive -> {
                ProbeOutcome outcome = registry.recordProbe(server.id(), alive, EVICTION_TRUST_THRESHOLD);
                if (outcome == ProbeOutcome.EVICTED) {
                    log.warn("SERVER_EVICTED serverId={} endpoint={} reason=trust below {}",
                             server.id(), server.endpoint(), EVICTION_TRUST_THRESHOLD);
                } else if (outcome == ProbeOutcome.DEGRADED) {
                    log.debug("Health probe failed. serverId={} endpoint={}", server.id(), server.endpoint());
                }
                return outcome;
            });
    }

    private static HealthReport summarize(int probed, List<ProbeOutcome> outcomes) {
        Map<ProbeOutcome, Integer> counts = new EnumMap<>(ProbeOutcome.class);
        outcomes.forEach(o -> counts.merge(o, 1, Integer::sum));
        HealthReport report = new HealthReport(probed,
            counts.getOrDefault(ProbeOutcome.REFRESHED, 0),
            counts.getOrDefault(ProbeOutcome.DEGRADED, 0),
            counts.getOrDefault(ProbeOutcome.EVICTED, 0));
        log.info("HEALTH_CHECK_ROUND probed={} refreshed={} degraded={} evicted={}",
                 report.probed(), report.refreshed(), report.degraded(), report.evicted());
        return report;
    }
}
