package com.toolfederation.common.exception;

/**
 * Base type for failures the federation core raises to its callers. Only registration
 * throws; every other operation reports failure through its result value.
 */
public class FederationException extends RuntimeException {
    private final String serverId;

    public FederationException(String serverId, String message) {
        super(message);
        this.serverId = serverId;
    }

    public FederationException(String serverId, String message, Throwable cause) {
        super(message, cause);
        this.serverId = serverId;
    }

    public String getServerId() {
        return serverId;
    }
}
