package com.toolfederation.federation.job;

import com.toolfederation.common.model.FederatedServer;
import com.toolfederation.federation.config.FederationProperties;
import com.toolfederation.federation.discovery.LocalNode;
import com.toolfederation.federation.discovery.PeerDiscovery;
import com.toolfederation.federation.discovery.ServerAnnouncer;
import com.toolfederation.federation.health.HealthMonitor;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Drives the node's background work: bootstrap and self-announce once at startup, then
 * two independent fixed-delay loops (gossip, health).
 *
 * <p>Each loop cycle is a fresh pipeline:
 * <pre>
 *   delay(interval) → run round → reschedule
 * </pre>
 * A failed round is logged and the loop carries on. {@link #stop()} disposes the pending
 * delay of each loop so no new round starts; a round that is already running finishes.
 */
@Component
public class FederationScheduler {

    private static final Logger log = LoggerFactory.getLogger(FederationScheduler.class);

    private final PeerDiscovery peerDiscovery;
    private final HealthMonitor healthMonitor;
    private final ServerAnnouncer announcer;
    private final LocalNode localNode;
    private final FederationProperties properties;

    private final AtomicReference<Disposable> gossipCycle = new AtomicReference<>();
    private final AtomicReference<Disposable> healthCycle = new AtomicReference<>();
    private volatile boolean running;

    public FederationScheduler(PeerDiscovery peerDiscovery, HealthMonitor healthMonitor,
                               ServerAnnouncer announcer, LocalNode localNode,
                               FederationProperties properties) {
        this.peerDiscovery = peerDiscovery;
        this.healthMonitor = healthMonitor;
        this.announcer     = announcer;
        this.localNode     = localNode;
        this.properties    = properties;
    }

    @PostConstruct
    public void start() {
        running = true;
        log.info("FEDERATION_START networkId={} seeds={} discoveryEnabled={} announceEnabled={}",
                 properties.networkId(), properties.bootstrapPeers().size(),
                 properties.discoveryEnabled(), properties.announceEnabled());

        peerDiscovery.bootstrap()
            .then(Mono.defer(this::announceSelf))
            .subscribe(
                v -> { },
                err -> log.error("Federation startup sequence failed", err));

        if (properties.discoveryEnabled()) {
            scheduleNext(gossipCycle, "gossip", properties.gossipInterval(), peerDiscovery::gossipRound);
        }
        scheduleNext(healthCycle, "health", properties.healthCheckInterval(),
                     () -> healthMonitor.healthCheckRound().then());
    }

    @PreDestroy
    public void stop() {
        running = false;
        dispose(gossipCycle);
        dispose(healthCycle);
        log.info("FEDERATION_STOP networkId={}", properties.networkId());
    }

    public boolean isRunning() {
        return running;
    }

    private Mono<Void> announceSelf() {
        FederatedServer self = localNode.server();
        if (!properties.announceEnabled() || self == null) {
            return Mono.empty();
        }
        return announcer.announce(self);
    }

    // ── loops ─────────────────────────────────────────────────────────────────

    private void scheduleNext(AtomicReference<Disposable> slot, String name, Duration interval,
                              Supplier<Mono<Void>> round) {
        if (!running) {
            return;
        }
        slot.set(Mono.delay(interval).subscribe(tick -> runRound(slot, name, interval, round)));
    }

    /** Runs outside the slot's disposable so {@link #stop()} never cancels a round mid-flight. */
    private void runRound(AtomicReference<Disposable> slot, String name, Duration interval,
                          Supplier<Mono<Void>> round) {
        Mono.defer(round).subscribe(
            v -> { },
            err -> {
                log.error("Federation {} round failed, rescheduling", name, err);
                scheduleNext(slot, name, interval, round);
            },
            () -> scheduleNext(slot, name, interval, round));
    }

    private static void dispose(AtomicReference<Disposable> slot) {
        Disposable pending = slot.getAndSet(null);
        if (pending != null) {
            pending.dispose();
        }
    }
}
