package com.dashkit.queryengine.exception;

/**
 * Base of the query engine error taxonomy. The {@link #getCode() code} is what callers see in
 * {@code ErrorResponse.code}; the message is kept intact for diagnostics.
 */
public abstract class QueryEngineException extends RuntimeException {
    private final String code;

    protected QueryEngineException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected QueryEngineException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
