package com.toolfederation.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outcome of a routed tool call. Failures are values, not exceptions: {@code success}
 * is false and {@code error} describes why.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolCallResponse(
    @JsonProperty("success")    boolean success,
    @JsonProperty("result")     JsonNode result,
    @JsonProperty("error")      String error,
    @JsonProperty("serverId")   String serverId,
    @JsonProperty("tool")       String tool,
    @JsonProperty("durationMs") long durationMs,
    @JsonProperty("fromCache")  boolean fromCache,
    @JsonProperty("cost")       Long cost
) {
    public static ToolCallResponse success(String serverId, String tool, JsonNode result,
                                           long durationMs, Long cost) {
        return new ToolCallResponse(true, result, null, serverId, tool, durationMs, false, cost);
    }

    public static ToolCallResponse cached(String serverId, String tool, JsonNode result, long durationMs) {
        return new ToolCallResponse(true, result, null, serverId, tool, durationMs, true, null);
    }

    public static ToolCallResponse failure(String serverId, String tool, String error, long durationMs) {
        return new ToolCallResponse(false, null, error, serverId, tool, durationMs, false, null);
    }
}
