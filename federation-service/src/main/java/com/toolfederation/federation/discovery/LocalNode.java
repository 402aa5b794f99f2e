package com.toolfederation.federation.discovery;

import com.toolfederation.common.model.FederatedServer;
import com.toolfederation.common.model.ServerCapabilities;
import com.toolfederation.common.model.ServerMetadata;
import com.toolfederation.federation.config.FederationProperties;
import com.toolfederation.federation.registry.ServerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * This node's own server descriptor, if it has one.
 *
 * <p>Seeded from {@code federation.self.*} (falling back to
 * {@code federation.announce-endpoint} for the endpoint). Without a configured
 * {@code federation.self.id} an id is generated once at startup and kept for the life of
 * the process, so peers never see this node under more than one id. The composing application may
 * replace it, typically to attach the tools this node serves, before the scheduler
 * announces it.
 */
@Component
public class LocalNode {

    private static final Logger log = LoggerFactory.getLogger(LocalNode.class);

    static final String UNKNOWN_CALLER = "unknown";

    private final AtomicReference<FederatedServer> self = new AtomicReference<>();

    public LocalNode(FederationProperties properties, Clock clock) {
        FederationProperties.Self cfg = properties.self();
        String endpoint = isBlank(cfg.endpoint()) ? properties.announceEndpoint() : cfg.endpoint();
        if (!isBlank(endpoint)) {
            String id = cfg.id();
            if (isBlank(id)) {
                id = ServerRegistry.generateId(clock.millis());
                log.info("No federation.self.id configured, generated one. serverId={} endpoint={}", id, endpoint);
            }
            self.set(new FederatedServer(
                id,
                isBlank(cfg.name()) ? properties.networkId() + "-node" : cfg.name(),
                cfg.description(),
                endpoint,
                "1.0.0",
                cfg.owner(),
                List.of(),
                ServerCapabilities.basic(),
                properties.newServerTrust(),
                0L,
                0L,
                ServerMetadata.defaults()));
        }
    }

    /** @return this node's descriptor, or {@code null} when running as a pure client */
    public FederatedServer server() {
        return self.get();
    }

    public void setServer(FederatedServer server) {
        self.set(server);
    }

    /** Id sent as the gossip sender and the tool-call caller; {@code "unknown"} without one. */
    public String callerId() {
        FederatedServer server = self.get();
        return server == null || isBlank(server.id()) ? UNKNOWN_CALLER : server.id();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
