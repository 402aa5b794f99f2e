package com.toolfederation.federation.registry;

import com.toolfederation.common.model.FederatedServer;
import com.toolfederation.common.model.TrustMetrics;
import com.toolfederation.common.trust.TrustCalculator;

/**
 * A registered server and its metrics, stored and replaced as one unit so the two can
 * never diverge or outlive each other.
 */
record ServerEntry(FederatedServer server, TrustMetrics metrics) {

    /** Swaps in new metrics and re-derives the server's trust score from them. */
    ServerEntry withMetrics(TrustMetrics updated) {
        return new ServerEntry(server.withTrustScore(TrustCalculator.calculate(updated)), updated);
    }

    ServerEntry withLastSeenAt(long timestamp) {
        return new ServerEntry(server.withLastSeenAt(timestamp), metrics);
    }
}
