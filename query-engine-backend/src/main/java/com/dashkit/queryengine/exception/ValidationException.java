package com.dashkit.queryengine.exception;

/**
 * Malformed request: missing fields, SQL over the length limit, or SQL rejected by the safety guard.
 */
public class ValidationException extends QueryEngineException {
    public ValidationException(String message) {
        super("VALIDATION_ERROR", message);
    }
}
