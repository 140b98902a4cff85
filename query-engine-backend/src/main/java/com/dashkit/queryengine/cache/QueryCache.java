package com.dashkit.queryengine.cache;

import com.dashkit.queryengine.model.CacheStats;
import com.dashkit.queryengine.model.QueryResult;

import java.util.Map;
import java.util.Optional;

/**
 * Tenant-scoped store of query results.
 *
 * <p>Implementations report failures as {@link com.dashkit.queryengine.exception.CacheException};
 * callers on the query path treat those as a miss.
 */
public interface QueryCache {

    /**
     * Deterministic key for a query. Equivalent SQL (whitespace and case) maps to the same key;
     * any change of tenant, data source or parameters maps to a different one.
     */
    String generateKey(String tenantId, String dataSourceId, String sql, Map<String, Object> parameters);

    /**
     * @return stored result annotated {@code cached=true}, or empty on miss or expiry
     */
    Optional<QueryResult> get(String key);

    /**
     * @param ttlSeconds lifetime of the entry; values {@code <= 0} use the configured default
     */
    void set(String key, QueryResult result, long ttlSeconds);

    /**
     * Removes every key matching a glob ({@code *}, {@code ?}, {@code [...]}).
     *
     * @return number of entries removed
     */
    long invalidatePattern(String pattern);

    long invalidateTenant(String tenantId);

    long invalidateDataSource(String dataSourceId);

    void clear();

    CacheStats stats();

    boolean healthCheck();
}
