package com.dashkit.queryengine.exception;

/**
 * Connector failed to establish or keep a backend session.
 */
public class ConnectionException extends QueryEngineException {
    public ConnectionException(String message) {
        super("CONNECTION_ERROR", message);
    }

    public ConnectionException(String message, Throwable cause) {
        super("CONNECTION_ERROR", message, cause);
    }
}
