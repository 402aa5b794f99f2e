package com.toolfederation.federation.health;

/** Counts from one {@link HealthMonitor#healthCheckRound()}. */
public record HealthReport(int probed, int refreshed, int degraded, int evicted) {

    public static HealthReport empty() {
        return new HealthReport(0, 0, 0, 0);
    }
}
