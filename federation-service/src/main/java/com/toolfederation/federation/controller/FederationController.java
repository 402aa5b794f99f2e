package com.toolfederation.federation.controller;

import com.toolfederation.common.exception.ServerUnreachableException;
import com.toolfederation.common.exception.ServerValidationException;
import com.toolfederation.common.model.DiscoveryMessage;
import com.toolfederation.common.model.FederatedServer;
import com.toolfederation.common.model.GossipExchange;
import com.toolfederation.common.model.GossipReply;
import com.toolfederation.common.model.MessageReceipt;
import com.toolfederation.common.model.NetworkStats;
import com.toolfederation.common.model.RegistrationResult;
import com.toolfederation.common.model.ToolCallRequest;
import com.toolfederation.common.model.ToolCallResponse;
import com.toolfederation.common.model.ToolMatch;
import com.toolfederation.common.model.TrustMetrics;
import com.toolfederation.federation.dto.ErrorResponse;
import com.toolfederation.federation.dto.OwnerVerificationRequest;
import com.toolfederation.federation.dto.ServerReportRequest;
import com.toolfederation.federation.registry.ListOptions;
import com.toolfederation.federation.registry.SearchOptions;
import com.toolfederation.federation.router.AutoCallOptions;
import com.toolfederation.federation.service.FederationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

@RestController
public class FederationController {

    private static final Logger log = LoggerFactory.getLogger(FederationController.class);

    private final FederationService federationService;

    public FederationController(FederationService federationService) {
        this.federationService = federationService;
    }

    @GetMapping("/federation/info")
    public ResponseEntity<?> info() {
        FederatedServer self = federationService.localServer();
        if (self == null) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorResponse.of("Not configured"));
        }
        return ResponseEntity.ok(self);
    }

    @GetMapping("/federation/servers")
    public List<FederatedServer> servers(@RequestParam(required = false) Integer minTrust,
                                         @RequestParam(required = false) String category,
                                         @RequestParam(required = false) List<String> hasTools,
                                         @RequestParam(required = false) Integer limit) {
        return federationService.listServers(new ListOptions(minTrust, category, hasTools, limit));
    }

    @GetMapping("/federation/servers/{serverId}")
    public ResponseEntity<FederatedServer> server(@PathVariable String serverId) {
        FederatedServer server = federationService.getServer(serverId);
        return server == null ? ResponseEntity.notFound().build() : ResponseEntity.ok(server);
    }

    @GetMapping("/federation/servers/{serverId}/trust")
    public ResponseEntity<TrustMetrics> trust(@PathVariable String serverId) {
        TrustMetrics metrics = federationService.getTrustMetrics(serverId);
        return metrics == null ? ResponseEntity.notFound().build() : ResponseEntity.ok(metrics);
    }

    @GetMapping("/federation/tools/search")
    public List<ToolMatch> searchTools(@RequestParam("q") String query,
                                       @RequestParam(required = false) String category,
                                       @RequestParam(required = false) Integer minTrust,
                                       @RequestParam(required = false) Integer limit) {
        return federationService.searchTools(query, new SearchOptions(category, minTrust, limit));
    }

    @PostMapping("/federation/register")
    public Mono<RegistrationResult> register(@RequestBody FederatedServer server) {
        log.info("Registration request received. name={} endpoint={}", server.name(), server.endpoint());
        return federationService.register(server);
    }

    @PostMapping("/federation/gossip")
    public GossipReply gossip(@RequestBody GossipExchange exchange) {
        return federationService.handleGossip(exchange);
    }

    @PostMapping("/federation/message")
    public Mono<MessageReceipt> message(@RequestBody DiscoveryMessage message) {
        return federationService.handleMessage(message);
    }

    @PostMapping("/federation/report")
    public Map<String, Boolean> report(@RequestBody ServerReportRequest report) {
        federationService.reportServer(report.serverId(), report.reason(), report.reporter());
        return Map.of("reported", true);
    }

    @PostMapping("/federation/verify")
    public Map<String, Boolean> verify(@RequestBody OwnerVerificationRequest request) {
        return Map.of("verified", federationService.verifyOwner(request.serverId(), request.signature()));
    }

    @PostMapping("/federation/servers/{serverId}/audit")
    public ResponseEntity<Map<String, Boolean>> audit(@PathVariable String serverId) {
        return federationService.markAudited(serverId)
            ? ResponseEntity.ok(Map.of("audited", true))
            : ResponseEntity.notFound().build();
    }

    /** Routes to {@code serverId} when given, otherwise to the most trusted server offering the tool. */
    @PostMapping("/federation/call")
    public Mono<ToolCallResponse> call(@RequestBody ToolCallRequest request,
                                       @RequestParam(required = false) Integer minTrust) {
        if (request.serverId() == null || request.serverId().isBlank()) {
            return federationService.callToolAuto(request.tool(), request.params(),
                new AutoCallOptions(minTrust, request.userId(), request.apiKey()));
        }
        return federationService.callTool(request);
    }

    @GetMapping("/federation/stats")
    public NetworkStats stats() {
        return federationService.stats();
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    // ── error mapping ─────────────────────────────────────────────────────────

    @ExceptionHandler(ServerValidationException.class)
    public ResponseEntity<ErrorResponse> invalidServer(ServerValidationException e) {
        log.warn("Registration rejected. serverId={} reason={}", e.getServerId(), e.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse(e.getMessage(), e.getServerId()));
    }

    @ExceptionHandler(ServerUnreachableException.class)
    public ResponseEntity<ErrorResponse> unreachableServer(ServerUnreachableException e) {
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(new ErrorResponse(e.getMessage(), e.getServerId()));
    }
}
