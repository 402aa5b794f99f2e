package com.toolfederation.federation.registry;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Time-boxed snapshot of the base server listing (ids only, in registry order).
 *
 * <p>Expires purely by age; registrations and evictions do not invalidate it. Reading
 * resolves ids against the live registry, so a cached listing never resurrects an
 * evicted server but also does not pick up new ones until it expires.
 */
class ServerListCache {

    private record Snapshot(List<String> serverIds, long cachedAt) {}

    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>();
    private final long ttlMs;

    ServerListCache(long ttlMs) {
        this.ttlMs = ttlMs;
    }

    /** @return cached ids, or {@code null} if absent or at least {@code ttlMs} old */
    List<String> get(long now) {
        Snapshot current = snapshot.get();
        if (current == null || now - current.cachedAt() >= ttlMs) {
            return null;
        }
        return current.serverIds();
    }

    void put(List<String> serverIds, long now) {
        snapshot.set(new Snapshot(List.copyOf(serverIds), now));
    }
}
