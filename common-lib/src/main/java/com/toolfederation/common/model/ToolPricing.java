package com.toolfederation.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Declared cost of a tool call, in micro-units of the settlement token. */
public record ToolPricing(
    @JsonProperty("baseCostMicro") Long baseCostMicro,
    @JsonProperty("perCallCost")   Long perCallCost
) {}
