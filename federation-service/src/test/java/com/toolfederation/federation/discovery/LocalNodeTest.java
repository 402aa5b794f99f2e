package com.toolfederation.federation.discovery;

import com.toolfederation.federation.MutableClock;
import com.toolfederation.federation.config.FederationProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.toolfederation.federation.TestServers.T0;
import static com.toolfederation.federation.TestServers.properties;
import static com.toolfederation.federation.TestServers.server;
import static com.toolfederation.federation.TestServers.withSelf;
import static org.junit.jupiter.api.Assertions.*;

class LocalNodeTest {

    private final MutableClock clock = new MutableClock(T0);

    @Test
    @DisplayName("no endpoint configured → pure client with caller id 'unknown'")
    void pureClient() {
        LocalNode node = new LocalNode(properties(), clock);

        assertNull(node.server());
        assertEquals("unknown", node.callerId());
    }

    @Test
    @DisplayName("endpoint falls back to announce-endpoint")
    void announceEndpointFallback() {
        FederationProperties props = new FederationProperties("net", List.of(), 100, 60_000, 30_000,
            true, true, "http://announced", 20, 0.99, 30, 30_000, 10_000, 300_000, 60_000,
            new FederationProperties.Self("node-7", null, null, null, "owner"));

        LocalNode node = new LocalNode(props, clock);

        assertEquals("http://announced", node.server().endpoint());
        assertEquals("net-node", node.server().name());
        assertEquals("node-7", node.callerId());
    }

    @Test
    @DisplayName("setServer replaces the descriptor, e.g. to attach served tools")
    void replace() {
        LocalNode node = new LocalNode(withSelf(properties(), "self-1", "http://self"), clock);
        assertTrue(node.server().tools().isEmpty());

        node.setServer(server("self-1", "http://self", "echo"));

        assertTrue(node.server().hasTool("echo"));
    }

    @Test
    @DisplayName("endpoint without a configured id → one generated id, stable across reads")
    void generatedId() {
        LocalNode node = new LocalNode(withSelf(properties(), "", "http://self"), clock);

        String id = node.server().id();
        assertTrue(id.startsWith("srv_" + T0 + "_"), id);
        clock.advanceMillis(5_000);
        assertEquals(id, node.server().id());
        assertEquals(id, node.callerId());
    }
}
