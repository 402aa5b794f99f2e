package com.toolfederation.federation.registry;

import com.toolfederation.common.exception.ServerUnreachableException;
import com.toolfederation.common.exception.ServerValidationException;
import com.toolfederation.common.model.FederatedServer;
import com.toolfederation.common.model.FederatedTool;
import com.toolfederation.common.model.RegistrationResult;
import com.toolfederation.common.model.ToolMatch;
import com.toolfederation.common.model.TrustMetrics;
import com.toolfederation.federation.client.PeerClient;
import com.toolfederation.federation.config.FederationProperties;
import com.toolfederation.federation.discovery.ServerAnnouncer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.UnaryOperator;

/**
 * In-memory registry of federated servers and their {@link TrustMetrics}.
 *
 * <p>Each server and its metrics live together in one map entry. Every mutation is a
 * single {@link ConcurrentHashMap#computeIfPresent} on that entry, so concurrent outcome
 * reports for the same server never lose an update to {@code totalRequests} or
 * {@code trustScore}, and eviction removes server and metrics together.
 *
 * <p>Listings go through a {@link ServerListCache} whose base set is filtered by the
 * configured {@code minTrustScore}, not by the caller's {@code minTrust}; per-call
 * filters and the trust ordering are applied on top of that base on every call.
 */
@Component
public class ServerRegistry {

    private static final Logger log = LoggerFactory.getLogger(ServerRegistry.class);

    static final String ID_PREFIX = "srv_";
    private static final char[] ID_ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz".toCharArray();

    static final double MAX_UPTIME        = 100.0;
    static final double UPTIME_RECOVERY   = 1.0;
    static final double UPTIME_PENALTY    = 5.0;

    static final double NAME_MATCH_SCORE        = 50.0;
    static final double DESCRIPTION_MATCH_SCORE = 30.0;
    static final double CATEGORY_MATCH_SCORE    = 20.0;
    static final double TRUST_BOOST             = 0.3;

    /** Highest trust first; older registrations, then lower ids, win ties. */
    static final Comparator<FederatedServer> BY_TRUST_DESC =
        Comparator.comparingInt(FederatedServer::trustScore).reversed()
            .thenComparingLong(FederatedServer::registeredAt)
            .thenComparing(FederatedServer::id);

    private final ConcurrentHashMap<String, ServerEntry> entries = new ConcurrentHashMap<>();
    private final ServerListCache listCache;
    private final PeerClient peerClient;
    private final ServerAnnouncer announcer;
    private final FederationProperties properties;
    private final Clock clock;

    public ServerRegistry(PeerClient peerClient, ServerAnnouncer announcer,
                          FederationProperties properties, Clock clock) {
        this.peerClient = peerClient;
        this.announcer  = announcer;
        this.properties = properties;
        this.clock      = clock;
        this.listCache  = new ServerListCache(properties.cacheServerListMs());
    }

    // ── registration ──────────────────────────────────────────────────────────

    /**
     * Validates, probes and stores a server.
     *
     * <p>Validation failures throw {@link ServerValidationException} immediately. The
     * returned {@link Mono} fails with {@link ServerUnreachableException} when
     * {@code GET {endpoint}/health} does not succeed within {@code connectionTimeoutMs}.
     * In both cases nothing is stored. On success the server starts at
     * {@code newServerTrust} with default metrics and, if enabled, is announced to peers.
     * Registering an id that is already present replaces it and resets its metrics.
     */
    public Mono<RegistrationResult> registerServer(FederatedServer server) {
        validate(server);

        String serverId = isBlank(server.id()) ? generateId(clock.millis()) : server.id();
        FederatedServer candidate = server.withId(serverId)
            .registeredAt(clock.millis(), properties.newServerTrust());

        return peerClient.ping(candidate.endpoint())
            .flatMap(alive -> {
                if (!alive) {
                    log.warn("Registration rejected, server unreachable. serverId={} endpoint={}",
                             serverId, candidate.endpoint());
                    return Mono.error(new ServerUnreachableException(serverId, candidate.endpoint()));
                }
                entries.put(serverId, new ServerEntry(candidate, TrustMetrics.defaults()));
                log.info("SERVER_REGISTERED serverId={} name={} endpoint={} tools={} trust={}",
                         serverId, candidate.name(), candidate.endpoint(),
                         candidate.tools().size(), candidate.trustScore());
                return announcer.announce(candidate)
                    .thenReturn(RegistrationResult.registered(serverId));
            });
    }

    private void validate(FederatedServer server) {
        if (server == null) {
            throw new ServerValidationException(null, "missing server descriptor");
        }
        if (isBlank(server.endpoint())) {
            throw new ServerValidationException(server.id(), "missing endpoint");
        }
        if (isBlank(server.owner())) {
            throw new ServerValidationException(server.id(), "missing owner");
        }
        if (server.tools().isEmpty()) {
            throw new ServerValidationException(server.id(), "at least one tool is required");
        }
    }

    public static String generateId(long timestamp) {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder suffix = new StringBuilder(6);
        for (int i = 0; i < 6; i++) {
            suffix.append(ID_ALPHABET[random.nextInt(ID_ALPHABET.length)]);
        }
        return ID_PREFIX + timestamp + "_" + suffix;
    }

    // ── lookup ────────────────────────────────────────────────────────────────

    /** @return the server, or {@code null} if not registered */
    public FederatedServer getServer(String serverId) {
        ServerEntry entry = serverId == null ? null : entries.get(serverId);
        return entry == null ? null : entry.server();
    }

    /** @return the server's metrics, or {@code null} if not registered */
    public TrustMetrics getTrustMetrics(String serverId) {
        ServerEntry entry = serverId == null ? null : entries.get(serverId);
        return entry == null ? null : entry.metrics();
    }

    public boolean contains(String serverId) {
        return serverId != null && entries.containsKey(serverId);
    }

    /** @return whether some registered server already answers at {@code endpoint} */
    public boolean containsEndpoint(String endpoint) {
        return endpoint != null
            && entries.values().stream().anyMatch(e -> endpoint.equals(e.server().endpoint()));
    }

    /** Every registered server regardless of trust, in no particular order. */
    public List<FederatedServer> allServers() {
        return entries.values().stream().map(ServerEntry::server).toList();
    }

    public int size() {
        return entries.size();
    }

    // ── listing & search ──────────────────────────────────────────────────────

    /**
     * Lists servers, highest trust first.
     *
     * <p>The base set (servers at or above the configured {@code minTrustScore}) is
     * reused for {@code cacheServerListMs}; {@code options} filters apply on each call.
     */
    public List<FederatedServer> listServers(ListOptions options) {
        ListOptions opts = options != null ? options : ListOptions.none();
        List<FederatedServer> result = new ArrayList<>(baseListing());

        if (opts.minTrust() != null) {
            result.removeIf(s -> s.trustScore() < opts.minTrust());
        }
        if (opts.category() != null && !opts.category().isBlank()) {
            result.removeIf(s -> !s.hasToolInCategory(opts.category()));
        }
        if (!opts.hasTools().isEmpty()) {
            result.removeIf(s -> !opts.hasTools().stream().allMatch(s::hasTool));
        }

        result.sort(BY_TRUST_DESC);

        if (opts.limit() != null && opts.limit() > 0 && result.size() > opts.limit()) {
            return List.copyOf(result.subList(0, opts.limit()));
        }
        return result;
    }

    private List<FederatedServer> baseListing() {
        long now = clock.millis();
        List<String> cachedIds = listCache.get(now);
        if (cachedIds != null) {
            return cachedIds.stream()
                .map(entries::get)
                .filter(Objects::nonNull)
                .map(ServerEntry::server)
                .toList();
        }

        List<FederatedServer> base = entries.values().stream()
            .map(ServerEntry::server)
            .filter(s -> s.trustScore() >= properties.minTrustScore())
            .toList();
        listCache.put(base.stream().map(FederatedServer::id).toList(), now);
        log.debug("Server list cache rebuilt. servers={} minTrustScore={}", base.size(), properties.minTrustScore());
        return base;
    }

    /**
     * Ranks every (server, tool) pair against {@code query}.
     *
     * <p>Score = 50 (name contains query) + 30 (description) + 20 (category), all
     * case-insensitive, plus {@code trustScore × 0.3}. Zero scores are dropped; ties keep
     * listing order.
     */
    public List<ToolMatch> searchTools(String query, SearchOptions options) {
        SearchOptions opts = options != null ? options : SearchOptions.none();
        String needle = query == null ? "" : query.toLowerCase(Locale.ROOT);
        List<ToolMatch> matches = new ArrayList<>();

        for (FederatedServer server : listServers(ListOptions.minTrust(opts.minTrust()))) {
            for (FederatedTool tool : server.tools()) {
                if (opts.category() != null && !opts.category().equals(tool.category())) {
                    continue;
                }
                double score = 0.0;
                if (contains(tool.name(), needle))                 score += NAME_MATCH_SCORE;
                if (contains(tool.descriptionOrEmpty(), needle))   score += DESCRIPTION_MATCH_SCORE;
                if (contains(tool.categoryOrEmpty(), needle))      score += CATEGORY_MATCH_SCORE;
                score += server.trustScore() * TRUST_BOOST;

                if (score > 0) {
                    matches.add(new ToolMatch(server, tool, score));
                }
            }
        }

        matches.sort(Comparator.comparingDouble(ToolMatch::score).reversed());
        if (opts.limit() != null && opts.limit() > 0 && matches.size() > opts.limit()) {
            return List.copyOf(matches.subList(0, opts.limit()));
        }
        return matches;
    }

    private static boolean contains(String haystack, String needle) {
        return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle);
    }

    // ── metric updates ────────────────────────────────────────────────────────

    /**
     * A tool call succeeded: bumps the request count, folds {@code responseTimeMs} into
     * the rolling average, recomputes success rate and trust, refreshes lastSeenAt.
     */
    public void recordSuccess(String serverId, long responseTimeMs) {
        long now = clock.millis();
        update(serverId, entry -> {
            TrustMetrics m = entry.metrics();
            long requests = m.totalRequests() + 1;
            double avg = (m.avgResponseTimeMs() * (requests - 1) + responseTimeMs) / requests;
            return entry
                .withMetrics(m.withRequests(requests, m.totalErrors(), avg, successRate(requests, m.totalErrors())))
                .withLastSeenAt(now);
        });
    }

    /** A tool call failed: bumps requests and errors, recomputes success rate and trust. */
    public void recordError(String serverId) {
        update(serverId, entry -> {
            TrustMetrics m = entry.metrics();
            long requests = m.totalRequests() + 1;
            long errors = m.totalErrors() + 1;
            return entry.withMetrics(
                m.withRequests(requests, errors, m.avgResponseTimeMs(), successRate(requests, errors)));
        });
    }

    /** @return {@code false} if the server is not registered */
    public boolean recordReport(String serverId) {
        return update(serverId, entry ->
            entry.withMetrics(entry.metrics().withReportCount(entry.metrics().reportCount() + 1)));
    }

    /** @return {@code false} if the server is not registered */
    public boolean markOwnerVerified(String serverId) {
        return update(serverId, entry -> entry.withMetrics(entry.metrics().withVerifiedOwner(true)));
    }

    /** @return {@code false} if the server is not registered */
    public boolean markAudited(String serverId) {
        return update(serverId, entry -> entry.withMetrics(entry.metrics().withAuditedCode(true)));
    }

    /**
     * Applies one health-probe result.
     *
     * <p>Alive: lastSeenAt = now, uptime + 1 (max 100). Dead: uptime − 5 (min 0); if the
     * recomputed trust is below {@code evictBelowTrust} the entry is removed.
     */
    public ProbeOutcome recordProbe(String serverId, boolean alive, int evictBelowTrust) {
        long now = clock.millis();
        ProbeOutcome[] outcome = {ProbeOutcome.UNKNOWN};
        entries.computeIfPresent(serverId, (id, entry) -> {
            TrustMetrics m = entry.metrics();
            if (alive) {
                outcome[0] = ProbeOutcome.REFRESHED;
                return entry.withMetrics(m.withUptime(Math.min(MAX_UPTIME, m.uptime() + UPTIME_RECOVERY)))
                            .withLastSeenAt(now);
            }
            ServerEntry degraded = entry.withMetrics(m.withUptime(Math.max(0.0, m.uptime() - UPTIME_PENALTY)));
            if (degraded.server().trustScore() < evictBelowTrust) {
                outcome[0] = ProbeOutcome.EVICTED;
                return null;
            }
            outcome[0] = ProbeOutcome.DEGRADED;
            return degraded;
        });
        return outcome[0];
    }

    private boolean update(String serverId, UnaryOperator<ServerEntry> mutation) {
        if (serverId == null) {
            return false;
        }
        return entries.computeIfPresent(serverId, (id, entry) -> mutation.apply(entry)) != null;
    }

    private static double successRate(long requests, long errors) {
        return requests == 0 ? 100.0 : ((double) (requests - errors) / requests) * 100.0;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
