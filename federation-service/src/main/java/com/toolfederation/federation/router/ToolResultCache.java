package com.toolfederation.federation.router;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tool results keyed by {@code serverId:tool:JSON(params)}.
 *
 * <p>Entries expire purely by age ({@code cacheToolResultsMs}). An expired entry is
 * dropped on the read that finds it, and every write sweeps out all expired entries so
 * keys that are never read again do not accumulate. Params are serialised with sorted map keys so that
 * logically equal parameter maps share an entry.
 */
class ToolResultCache {

    private final ConcurrentHashMap<String, CachedToolResult> store = new ConcurrentHashMap<>();
    private final ObjectWriter keyWriter;
    private final long ttlMs;

    ToolResultCache(ObjectMapper objectMapper, long ttlMs) {
        this.keyWriter = objectMapper.writer().with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        this.ttlMs     = ttlMs;
    }

    String key(String serverId, String tool, Map<String, Object> params) {
        try {
            return serverId + ":" + tool + ":" + keyWriter.writeValueAsString(params);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Tool params are not serialisable for tool " + tool, e);
        }
    }

    /** @return the live entry, or {@code null} if absent or expired */
    CachedToolResult get(String key, long now) {
        CachedToolResult entry = store.get(key);
        if (entry == null) {
            return null;
        }
        if (now - entry.cachedAt() >= ttlMs) {
            store.remove(key, entry);
            return null;
        }
        return entry;
    }

    void put(String key, JsonNode result, long now) {
        evictExpired(now);
        store.put(key, new CachedToolResult(result, now));
    }

    void evictExpired(long now) {
        store.values().removeIf(entry -> now - entry.cachedAt() >= ttlMs);
    }

    int size() {
        return store.size();
    }
}
