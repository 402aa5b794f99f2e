package com.toolfederation.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * A named, schema-described capability exposed by a {@link FederatedServer}.
 *
 * <p>{@code pricing} and {@code rateLimit} are optional and only surfaced to callers;
 * nothing in the federation core charges or throttles against them.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FederatedTool(
    @JsonProperty("name")        String name,
    @JsonProperty("description") String description,
    @JsonProperty("inputSchema") Map<String, Object> inputSchema,
    @JsonProperty("category")    String category,
    @JsonProperty("pricing")     ToolPricing pricing,
    @JsonProperty("rateLimit")   ToolRateLimit rateLimit
) {
    public static FederatedTool of(String name, String description, String category) {
        return new FederatedTool(name, description, Map.of("type", "object"), category, null, null);
    }

    public String descriptionOrEmpty() {
        return description == null ? "" : description;
    }

    public String categoryOrEmpty() {
        return category == null ? "" : category;
    }
}
