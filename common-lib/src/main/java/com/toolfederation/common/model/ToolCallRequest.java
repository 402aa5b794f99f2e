package com.toolfederation.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record ToolCallRequest(
    @JsonProperty("serverId") String serverId,
    @JsonProperty("tool")     String tool,
    @JsonProperty("params")   Map<String, Object> params,
    @JsonProperty("userId")   String userId,
    @JsonProperty("apiKey")   String apiKey
) {
    public ToolCallRequest {
        params = params != null ? params : Map.of();
    }

    public static ToolCallRequest of(String serverId, String tool, Map<String, Object> params) {
        return new ToolCallRequest(serverId, tool, params, null, null);
    }
}
