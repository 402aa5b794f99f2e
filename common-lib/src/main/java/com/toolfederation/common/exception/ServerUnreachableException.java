package com.toolfederation.common.exception;

/** The registration health probe against a server's endpoint did not succeed. */
public class ServerUnreachableException extends FederationException {
    private final String endpoint;

    public ServerUnreachableException(String serverId, String endpoint) {
        super(serverId, "Server is not reachable: " + endpoint);
        this.endpoint = endpoint;
    }

    public String getEndpoint() {
        return endpoint;
    }
}
