package com.toolfederation.federation.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.toolfederation.common.model.DiscoveryMessage;
import com.toolfederation.common.model.FederatedServer;
import com.toolfederation.common.model.GossipExchange;
import com.toolfederation.common.model.GossipReply;
import com.toolfederation.common.model.MessageType;
import com.toolfederation.federation.config.FederationProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Wire-level checks of {@link PeerClient} against a stubbed exchange function.
 */
class PeerClientTest {

    private static final FederationProperties PROPS = new FederationProperties("test-network", List.of(), 100,
        60_000, 30_000, true, false, null, 20, 0.99, 30, 150, 100, 300_000, 60_000, null);

    private final List<ClientRequest> requests = new ArrayList<>();

    private PeerClient client(ExchangeFunction exchange) {
        ExchangeFunction recording = request -> {
            requests.add(request);
            return exchange.exchange(request);
        };
        return new PeerClient(WebClient.builder().exchangeFunction(recording).build(), PROPS);
    }

    private static Mono<ClientResponse> json(HttpStatus status, String body) {
        return Mono.just(ClientResponse.create(status)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body(body)
            .build());
    }

    private static Mono<ClientResponse> status(HttpStatus status) {
        return Mono.just(ClientResponse.create(status).build());
    }

    // ── ping ──────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("ping()")
    class Ping {

        @Test
        @DisplayName("GET {endpoint}/health with 2xx → true")
        void alive() {
            assertTrue(client(r -> status(HttpStatus.OK)).ping("http://peer").block());

            assertEquals(HttpMethod.GET, requests.get(0).method());
            assertEquals("http://peer/health", requests.get(0).url().toString());
        }

        @Test
        @DisplayName("non-2xx, transport error and timeout all → false")
        void dead() {
            assertFalse(client(r -> status(HttpStatus.SERVICE_UNAVAILABLE)).ping("http://peer").block());
            assertFalse(client(r -> Mono.error(new IllegalStateException("connection refused")))
                .ping("http://peer").block());
            assertFalse(client(r -> Mono.never()).ping("http://peer").block());
        }
    }

    // ── tool calls ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("invokeTool()")
    class InvokeTool {

        @Test
        @DisplayName("POSTs params to /tools/{tool} with bearer and federation headers")
        void requestShape() {
            JsonNode result = client(r -> json(HttpStatus.OK, "{\"answer\":42}"))
                .invokeTool("http://peer", "echo", Map.of("q", "x"), "secret", "node-1")
                .block();

            assertEquals(42, result.get("answer").asInt());
            ClientRequest request = requests.get(0);
            assertEquals(HttpMethod.POST, request.method());
            assertEquals("http://peer/tools/echo", request.url().toString());
            assertEquals("Bearer secret", request.headers().getFirst(HttpHeaders.AUTHORIZATION));
            assertEquals("test-network", request.headers().getFirst(PeerClient.NETWORK_HEADER));
            assertEquals("node-1", request.headers().getFirst(PeerClient.CALLER_HEADER));
        }

        @Test
        @DisplayName("no api key → no Authorization header")
        void noApiKey() {
            client(r -> json(HttpStatus.OK, "{}")).invokeTool("http://peer", "echo", Map.of(), null, "node-1").block();

            assertNull(requests.get(0).headers().getFirst(HttpHeaders.AUTHORIZATION));
        }

        @Test
        @DisplayName("empty body → JSON null")
        void emptyBody() {
            JsonNode result = client(r -> status(HttpStatus.OK))
                .invokeTool("http://peer", "echo", Map.of(), null, "node-1").block();

            assertTrue(result.isNull());
        }

        @Test
        @DisplayName("non-2xx → RemoteCallException with status and reason")
        void errorStatus() {
            RemoteCallException e = assertThrows(RemoteCallException.class, () ->
                client(r -> status(HttpStatus.INTERNAL_SERVER_ERROR))
                    .invokeTool("http://peer", "echo", Map.of(), null, "node-1").block());

            assertEquals("Remote call failed: 500 Internal Server Error", e.getMessage());
        }

        @Test
        @DisplayName("no answer within requestTimeoutMs → RemoteCallException")
        void timeout() {
            RemoteCallException e = assertThrows(RemoteCallException.class, () ->
                client(r -> Mono.never()).invokeTool("http://peer", "slow", Map.of(), null, "node-1").block());

            assertEquals("Remote call slow timed out after 150ms", e.getMessage());
        }
    }

    // ── discovery ─────────────────────────────────────────────────────────

    @Test
    @DisplayName("fetchInfo() parses the peer's descriptor")
    void fetchInfo() {
        FederatedServer server = client(r -> json(HttpStatus.OK,
            "{\"id\":\"s1\",\"name\":\"one\",\"endpoint\":\"http://peer\",\"owner\":\"o\","
                + "\"tools\":[{\"name\":\"ping\"}],\"trustScore\":42}"))
            .fetchInfo("http://peer").block();

        assertEquals("http://peer/federation/info", requests.get(0).url().toString());
        assertEquals("s1", server.id());
        assertEquals(42, server.trustScore());
        assertTrue(server.hasTool("ping"));
    }

    @Test
    @DisplayName("exchangeGossip() POSTs to /federation/gossip and reads the reply")
    void exchangeGossip() {
        GossipReply reply = client(r -> json(HttpStatus.OK,
            "{\"servers\":[{\"id\":\"s9\",\"name\":\"nine\",\"endpoint\":\"http://s9\",\"trustScore\":60}]}"))
            .exchangeGossip("http://peer", GossipExchange.of("me", List.of())).block();

        assertEquals(HttpMethod.POST, requests.get(0).method());
        assertEquals("http://peer/federation/gossip", requests.get(0).url().toString());
        assertEquals("s9", reply.servers().get(0).id());
    }

    @Test
    @DisplayName("sendMessage() surfaces non-2xx as RemoteCallException")
    void sendMessageFailure() {
        PeerClient peerClient = client(r -> status(HttpStatus.BAD_REQUEST));

        RemoteCallException e = assertThrows(RemoteCallException.class, () ->
            peerClient.sendMessage("http://peer", DiscoveryMessage.of(MessageType.PING, "me", 1L, null)).block());

        assertEquals("http://peer/federation/message", requests.get(0).url().toString());
        assertTrue(e.getMessage().startsWith("Discovery message failed: 400"), e.getMessage());
    }
}
