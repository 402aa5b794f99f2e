package com.toolfederation.federation.router;

/**
 * Options for {@link ToolRouter#callToolAuto}. {@code minTrust} narrows the candidate
 * servers; {@code userId} and {@code apiKey} are forwarded to every attempt.
 */
public record AutoCallOptions(Integer minTrust, String userId, String apiKey) {

    public static AutoCallOptions none() {
        return new AutoCallOptions(null, null, null);
    }
}
