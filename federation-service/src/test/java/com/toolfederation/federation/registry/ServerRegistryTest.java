package com.toolfederation.federation.registry;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.toolfederation.common.exception.ServerUnreachableException;
import com.toolfederation.common.exception.ServerValidationException;
import com.toolfederation.common.model.FederatedServer;
import com.toolfederation.common.model.FederatedTool;
import com.toolfederation.common.model.RegistrationResult;
import com.toolfederation.common.model.ToolMatch;
import com.toolfederation.common.model.TrustMetrics;
import com.toolfederation.federation.MutableClock;
import com.toolfederation.federation.client.PeerClient;
import com.toolfederation.federation.config.FederationProperties;
import com.toolfederation.federation.discovery.PeerDirectory;
import com.toolfederation.federation.discovery.ServerAnnouncer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static com.toolfederation.federation.TestServers.T0;
import static com.toolfederation.federation.TestServers.properties;
import static com.toolfederation.federation.TestServers.server;
import static com.toolfederation.federation.TestServers.serverWithTools;
import static com.toolfederation.federation.TestServers.withoutTools;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class ServerRegistryTest {

    private MutableClock clock;
    private PeerClient peerClient;
    private ServerRegistry registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        FederationProperties props = properties(List.of(), false, 100, 300_000, 60_000);
        peerClient = mock(PeerClient.class);
        when(peerClient.ping(anyString())).thenReturn(Mono.just(true));
        ServerAnnouncer announcer = new ServerAnnouncer(new PeerDirectory(props), peerClient, props,
                                                        new ObjectMapper(), clock);
        registry = new ServerRegistry(peerClient, announcer, props, clock);
    }

    private String register(FederatedServer server) {
        return registry.registerServer(server).block().serverId();
    }

    private List<String> ids(List<FederatedServer> servers) {
        return servers.stream().map(FederatedServer::id).toList();
    }

    // ── registration ──────────────────────────────────────────────────────

    @Nested
    @DisplayName("registerServer()")
    class Registration {

        @Test
        @DisplayName("stores the server at newServerTrust with default metrics")
        void registersReachableServer() {
            RegistrationResult result = registry.registerServer(server("a", "http://a", "ping")).block();

            assertNotNull(result);
            assertTrue(result.success());
            assertEquals("a", result.serverId());

            FederatedServer stored = registry.getServer("a");
            assertEquals(30, stored.trustScore());
            assertEquals(T0, stored.registeredAt());
            assertEquals(T0, stored.lastSeenAt());
            assertEquals(TrustMetrics.defaults(), registry.getTrustMetrics("a"));
        }

        @Test
        @DisplayName("generates srv_<timestamp>_<suffix> when no id is given")
        void generatesId() {
            String id = register(server(null, "http://anon", "ping"));

            assertTrue(id.matches("srv_" + T0 + "_[0-9a-z]{6}"), id);
            assertTrue(registry.contains(id));
        }

        @Test
        @DisplayName("empty tool list throws synchronously and stores nothing")
        void rejectsEmptyTools() {
            assertThrows(ServerValidationException.class,
                () -> registry.registerServer(withoutTools("a", "http://a")));
            assertEquals(0, registry.size());
            verifyNoInteractions(peerClient);
        }

        @Test
        @DisplayName("missing endpoint or owner is a validation error")
        void rejectsMissingFields() {
            FederatedServer noEndpoint = server("a", null, "ping");
            FederatedServer base = server("b", "http://b", "ping");
            FederatedServer noOwner = new FederatedServer("b", "b", null, "http://b", "1.0.0", " ",
                base.tools(), base.capabilities(), 0, 0, 0, base.metadata());

            ServerValidationException e1 = assertThrows(ServerValidationException.class,
                () -> registry.registerServer(noEndpoint));
            assertTrue(e1.getMessage().contains("endpoint"));
            assertThrows(ServerValidationException.class, () -> registry.registerServer(noOwner));
            assertEquals(0, registry.size());
        }

        @Test
        @DisplayName("failed health probe fails the Mono and stores nothing")
        void rejectsUnreachableServer() {
            when(peerClient.ping("http://down")).thenReturn(Mono.just(false));

            ServerUnreachableException e = assertThrows(ServerUnreachableException.class,
                () -> registry.registerServer(server("down", "http://down", "ping")).block());

            assertEquals("http://down", e.getEndpoint());
            assertEquals("down", e.getServerId());
            assertFalse(registry.contains("down"));
        }

        @Test
        @DisplayName("re-registering an id replaces the server and resets its metrics")
        void reRegistrationResets() {
            register(server("a", "http://a", "ping"));
            registry.recordError("a");
            clock.advance(Duration.ofMinutes(1));

            register(server("a", "http://a2", "ping", "echo"));

            assertEquals("http://a2", registry.getServer("a").endpoint());
            assertEquals(30, registry.getServer("a").trustScore());
            assertEquals(0, registry.getTrustMetrics("a").totalRequests());
            assertEquals(1, registry.size());
        }
    }

    // ── listing ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("listServers()")
    class Listing {

        @Test
        @DisplayName("returns every registered server, highest trust first")
        void sortedByTrust() {
            register(server("c", "http://c", "ping"));
            register(server("a", "http://a", "ping"));
            register(server("b", "http://b", "ping"));
            registry.recordSuccess("a", 0);   // → 76
            registry.recordError("b");        // → 51, c stays at 30

            List<FederatedServer> listed = registry.listServers(ListOptions.minTrust(0));

            assertEquals(List.of("a", "b", "c"), ids(listed));
            assertEquals(List.of(76, 51, 30), listed.stream().map(FederatedServer::trustScore).toList());
        }

        @Test
        @DisplayName("equal trust → earlier registration first, then id")
        void tieBreak() {
            register(server("first", "http://first", "ping"));
            clock.advanceMillis(10);
            register(server("b-second", "http://b", "ping"));
            register(server("a-second", "http://a", "ping"));

            assertEquals(List.of("first", "a-second", "b-second"), ids(registry.listServers(ListOptions.none())));
        }

        @Test
        @DisplayName("category, hasTools and limit filters apply on every call")
        void perCallFilters() {
            register(serverWithTools("maps", "http://maps", FederatedTool.of("geocode", "", "geo")));
            register(serverWithTools("both", "http://both",
                FederatedTool.of("geocode", "", "geo"), FederatedTool.of("forecast", "", "weather")));
            register(serverWithTools("wx", "http://wx", FederatedTool.of("forecast", "", "weather")));

            assertEquals(List.of("both", "maps"),
                ids(registry.listServers(new ListOptions(null, "geo", null, null))));
            assertEquals(List.of("both"),
                ids(registry.listServers(new ListOptions(null, null, List.of("geocode", "forecast"), null))));
            assertEquals(1, registry.listServers(new ListOptions(null, null, null, 1)).size());
            assertEquals(List.of(), registry.listServers(new ListOptions(31, null, null, null)));
        }

        @Test
        @DisplayName("base listing is cached: new servers appear only after cacheServerListMs")
        void baseListingCached() {
            register(server("a", "http://a", "ping"));
            assertEquals(List.of("a"), ids(registry.listServers(ListOptions.none())));

            register(server("b", "http://b", "ping"));
            assertEquals(List.of("a"), ids(registry.listServers(ListOptions.none())));

            clock.advance(Duration.ofMillis(300_000));
            assertEquals(List.of("a", "b"), ids(registry.listServers(ListOptions.none())));
        }

        @Test
        @DisplayName("cached listing never returns an evicted server")
        void cacheDoesNotResurrect() {
            register(server("a", "http://a", "ping"));
            registry.listServers(ListOptions.none());

            assertEquals(ProbeOutcome.EVICTED, registry.recordProbe("a", false, 100));

            assertEquals(List.of(), registry.listServers(ListOptions.none()));
        }

        @Test
        @DisplayName("configured minTrustScore bounds the base even when the caller asks for less")
        void configuredThresholdBoundsBase() {
            register(server("good", "http://good", "ping"));
            register(server("bad", "http://bad", "ping"));
            for (int i = 0; i < 10; i++) registry.recordError("bad");
            for (int i = 0; i < 5; i++)  registry.recordReport("bad");
            assertEquals(2, registry.getServer("bad").trustScore());

            assertEquals(List.of("good"), ids(registry.listServers(ListOptions.minTrust(0))));
        }
    }

    // ── search ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("searchTools()")
    class Search {

        @BeforeEach
        void registerTools() {
            register(serverWithTools("wx", "http://wx",
                FederatedTool.of("weather_lookup", "Current weather by city", "weather"),
                FederatedTool.of("geocode", "Lookup coordinates", "maps")));
        }

        @Test
        @DisplayName("name 50 + description 30 + category 20 + trust × 0.3")
        void scoring() {
            List<ToolMatch> matches = registry.searchTools("WEATHER", SearchOptions.none());

            assertEquals(2, matches.size());
            assertEquals("weather_lookup", matches.get(0).tool().name());
            assertEquals(109.0, matches.get(0).score(), 1e-9);
            assertEquals("geocode", matches.get(1).tool().name());
            assertEquals(9.0, matches.get(1).score(), 1e-9);
        }

        @Test
        @DisplayName("category filter and limit")
        void filters() {
            assertEquals(List.of("geocode"), registry.searchTools("lookup", new SearchOptions("maps", null, null))
                .stream().map(m -> m.tool().name()).toList());
            assertEquals(1, registry.searchTools("lookup", new SearchOptions(null, null, 1)).size());
        }
    }

    // ── metrics ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("metric updates")
    class Metrics {

        @BeforeEach
        void registerA() {
            register(server("a", "http://a", "ping"));
        }

        @Test
        @DisplayName("N successes and M errors → successRate N/(N+M)×100")
        void successRate() {
            for (int i = 0; i < 7; i++) registry.recordSuccess("a", 10);
            for (int i = 0; i < 3; i++) registry.recordError("a");

            TrustMetrics m = registry.getTrustMetrics("a");
            assertEquals(10, m.totalRequests());
            assertEquals(3, m.totalErrors());
            assertEquals(70.0, m.successRate(), 1e-9);
        }

        @Test
        @DisplayName("response time is a rolling average")
        void rollingAverage() {
            registry.recordSuccess("a", 100);
            registry.recordSuccess("a", 200);
            registry.recordSuccess("a", 600);

            assertEquals(300.0, registry.getTrustMetrics("a").avgResponseTimeMs(), 1e-9);
        }

        @Test
        @DisplayName("success refreshes lastSeenAt, error does not")
        void lastSeenAt() {
            clock.advance(Duration.ofSeconds(5));
            registry.recordError("a");
            assertEquals(T0, registry.getServer("a").lastSeenAt());

            registry.recordSuccess("a", 1);
            assertEquals(T0 + 5_000, registry.getServer("a").lastSeenAt());
        }

        @Test
        @DisplayName("updates for unknown servers are ignored")
        void unknownServer() {
            registry.recordSuccess("ghost", 5);
            registry.recordError("ghost");

            assertFalse(registry.recordReport("ghost"));
            assertFalse(registry.markOwnerVerified("ghost"));
            assertEquals(ProbeOutcome.UNKNOWN, registry.recordProbe("ghost", true, 5));
            assertNull(registry.getTrustMetrics("ghost"));
        }

        @Test
        @DisplayName("verification flags raise trust")
        void verification() {
            assertTrue(registry.markOwnerVerified("a"));
            assertEquals(79, registry.getServer("a").trustScore());
            assertTrue(registry.markAudited("a"));
            assertEquals(83, registry.getServer("a").trustScore());
        }

        @Test
        @DisplayName("concurrent outcome reports are never lost")
        void concurrentUpdates() throws Exception {
            ExecutorService pool = Executors.newFixedThreadPool(8);
            try {
                List<Future<?>> futures = new ArrayList<>();
                for (int t = 0; t < 8; t++) {
                    boolean errors = t % 2 == 0;
                    futures.add(pool.submit(() -> {
                        for (int i = 0; i < 500; i++) {
                            if (errors) registry.recordError("a");
                            else registry.recordSuccess("a", 20);
                        }
                    }));
                }
                for (Future<?> f : futures) f.get();
            } finally {
                pool.shutdownNow();
            }

            TrustMetrics m = registry.getTrustMetrics("a");
            assertEquals(4_000, m.totalRequests());
            assertEquals(2_000, m.totalErrors());
            assertEquals(50.0, m.successRate(), 1e-9);
        }
    }
}
