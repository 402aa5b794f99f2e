package com.toolfederation.federation.router;

import com.fasterxml.jackson.databind.JsonNode;

/** A remote tool result and the epoch millis at which it was stored. */
record CachedToolResult(JsonNode result, long cachedAt) {}
