package com.toolfederation.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Protocol features a federated server advertises about itself.
 */
public record ServerCapabilities(
    @JsonProperty("streaming")             boolean streaming,
    @JsonProperty("batching")              boolean batching,
    @JsonProperty("webhooks")              boolean webhooks,
    @JsonProperty("customAuth")            boolean customAuth,
    @JsonProperty("maxConcurrentRequests") int maxConcurrentRequests,
    @JsonProperty("supportedAuthMethods")  List<String> supportedAuthMethods
) {
    public ServerCapabilities {
        supportedAuthMethods = supportedAuthMethods != null ? List.copyOf(supportedAuthMethods) : List.of();
    }

    public static ServerCapabilities basic() {
        return new ServerCapabilities(false, false, false, false, 1, List.of("bearer"));
    }
}
