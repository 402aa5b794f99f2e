package com.toolfederation.federation.registry;

import java.util.List;

/**
 * Per-call filters for {@link ServerRegistry#listServers(ListOptions)}. Every field is
 * optional ({@code null} = no filter).
 */
public record ListOptions(Integer minTrust, String category, List<String> hasTools, Integer limit) {

    public ListOptions {
        hasTools = hasTools != null ? List.copyOf(hasTools) : List.of();
    }

    public static ListOptions none() {
        return new ListOptions(null, null, List.of(), null);
    }

    public static ListOptions minTrust(Integer minTrust) {
        return new ListOptions(minTrust, null, List.of(), null);
    }
}
