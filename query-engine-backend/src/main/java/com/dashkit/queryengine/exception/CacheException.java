package com.dashkit.queryengine.exception;

/**
 * Cache read or write failure. Never surfaced to callers: the query service logs it and
 * carries on as if the cache were empty.
 */
public class CacheException extends QueryEngineException {
    public CacheException(String message, Throwable cause) {
        super("CACHE_ERROR", message, cause);
    }
}
