package com.toolfederation.federation.registry;

/** What a single health probe did to a registry entry. */
public enum ProbeOutcome {
    /** Probe answered; lastSeenAt refreshed and uptime raised. */
    REFRESHED,
    /** Probe failed; uptime lowered, server kept. */
    DEGRADED,
    /** Probe failed and trust dropped below the eviction threshold; server removed. */
    EVICTED,
    /** Server was no longer registered when the probe result arrived. */
    UNKNOWN
}
