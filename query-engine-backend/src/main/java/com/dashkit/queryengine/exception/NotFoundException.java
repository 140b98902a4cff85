package com.dashkit.queryengine.exception;

/**
 * Thrown when a referenced data source is not registered.
 */
public class NotFoundException extends QueryEngineException {
    public NotFoundException(String message) {
        super("NOT_FOUND", message);
    }

    public static NotFoundException dataSource(String dataSourceId) {
        return new NotFoundException("Data source not found: " + dataSourceId);
    }
}
