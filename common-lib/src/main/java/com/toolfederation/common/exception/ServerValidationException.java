package com.toolfederation.common.exception;

/** A registration request is missing its endpoint, owner or tools. */
public class ServerValidationException extends FederationException {

    public ServerValidationException(String serverId, String message) {
        super(serverId, "Invalid server: " + message);
    }
}
