package com.toolfederation.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ToolRateLimit(
    @JsonProperty("requestsPerMinute") int requestsPerMinute,
    @JsonProperty("requestsPerDay")    int requestsPerDay
) {}
