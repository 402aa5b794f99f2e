package com.toolfederation.federation.client;

/**
 * A call to a peer endpoint failed: non-2xx status, transport error or deadline exceeded.
 * Always handled at the call site; it never reaches a timer loop.
 */
public class RemoteCallException extends RuntimeException {

    public RemoteCallException(String message) {
        super(message);
    }

    public RemoteCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
