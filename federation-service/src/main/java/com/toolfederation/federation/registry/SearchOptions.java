package com.toolfederation.federation.registry;

public record SearchOptions(String category, Integer minTrust, Integer limit) {

    public static SearchOptions none() {
        return new SearchOptions(null, null, null);
    }
}
