package com.toolfederation.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** One ranked hit of a cross-federation tool search. */
public record ToolMatch(
    @JsonProperty("server") FederatedServer server,
    @JsonProperty("tool")   FederatedTool   tool,
    @JsonProperty("score")  double          score
) {}
