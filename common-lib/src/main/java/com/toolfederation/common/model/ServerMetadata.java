package com.toolfederation.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Descriptive metadata attached to a {@link FederatedServer}.
 *
 * <ul>
 *   <li>{@code revenueSharePercent} – share of tool revenue owed to the server owner
 *       ([0, 100]); surfaced only, never settled here.</li>
 *   <li>{@code minTrustRequired} – minimum trust score the owner asks callers to require
 *       before routing to this server.</li>
 * </ul>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ServerMetadata(
    @JsonProperty("version")             String version,
    @JsonProperty("region")              String region,
    @JsonProperty("tags")                List<String> tags,
    @JsonProperty("website")             String website,
    @JsonProperty("documentation")       String documentation,
    @JsonProperty("supportContact")      String supportContact,
    @JsonProperty("revenueSharePercent") int revenueSharePercent,
    @JsonProperty("minTrustRequired")    int minTrustRequired
) {
    public static final int DEFAULT_REVENUE_SHARE = 70;

    public ServerMetadata {
        tags = tags != null ? List.copyOf(tags) : List.of();
    }

    public static ServerMetadata defaults() {
        return new ServerMetadata("1.0.0", null, List.of(), null, null, null, DEFAULT_REVENUE_SHARE, 0);
    }
}
