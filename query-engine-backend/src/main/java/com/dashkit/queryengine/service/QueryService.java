package com.dashkit.queryengine.service;

import com.dashkit.queryengine.api.QueryRequest;
import com.dashkit.queryengine.cache.QueryCache;
import com.dashkit.queryengine.config.QueryEngineProperties;
import com.dashkit.queryengine.connector.Connector;
import com.dashkit.queryengine.connector.ConnectorFactory;
import com.dashkit.queryengine.exception.NotFoundException;
import com.dashkit.queryengine.exception.QueryEngineException;
import com.dashkit.queryengine.exception.ValidationException;
import com.dashkit.queryengine.model.CacheStats;
import com.dashkit.queryengine.model.ConnectionConfig;
import com.dashkit.queryengine.model.ConnectorResult;
import com.dashkit.queryengine.model.DataSourceStatus;
import com.dashkit.queryengine.model.HealthStatus;
import com.dashkit.queryengine.model.QueryExecutionContext;
import com.dashkit.queryengine.model.QueryMetadata;
import com.dashkit.queryengine.model.QueryResult;
import com.dashkit.queryengine.model.SchemaInfo;
import com.dashkit.queryengine.model.ValidationResult;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Entry point for dashboard queries: routes requests to registered connectors, applies the
 * SQL guard and the result cache, and owns connector lifecycle.
 */
@Service
public class QueryService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(QueryService.class);

    static final String DEFAULT_TENANT = "default";

    private final DataSourceRegistry registry;
    private final ConnectorFactory connectorFactory;
    private final QueryCache cache;
    private final SqlSafetyGuard sqlSafetyGuard;
    private final QueryEngineProperties properties;
    private final ExecutorService executor;
    private final ReentrantLock adminLock = new ReentrantLock();

    public QueryService(DataSourceRegistry registry,
                        ConnectorFactory connectorFactory,
                        QueryCache cache,
                        SqlSafetyGuard sqlSafetyGuard,
                        QueryEngineProperties properties,
                        @Qualifier("connectorExecutor") ExecutorService executor) {
        this.registry = registry;
        this.connectorFactory = connectorFactory;
        this.cache = cache;
        this.sqlSafetyGuard = sqlSafetyGuard;
        this.properties = properties;
        this.executor = executor;
    }

    /**
     * Creates, connects and registers a connector. A connector already registered under the
     * same id is closed and replaced, and its cached results are dropped.
     *
     * @param dataSourceId id to register under
     * @param config data source definition; its status is updated in place
     * @return redacted copy of the registered definition
     * @throws com.dashkit.queryengine.exception.ConnectionException if the backend cannot be reached
     */
    public ConnectionConfig registerDataSource(String dataSourceId, ConnectionConfig config) {
        if (dataSourceId == null || dataSourceId.isBlank()) {
            throw new ValidationException("Data source ID is required");
        }
        if (config == null || config.getType() == null) {
            throw new ValidationException("Data source type is required");
        }
        config.setId(dataSourceId);

        adminLock.lock();
        try {
            Connector connector = connectorFactory.create(config);
            try {
                connector.connect();
            } catch (QueryEngineException e) {
                config.setStatus(DataSourceStatus.ERROR);
                config.setLastTestedAt(OffsetDateTime.now());
                connector.close();
                log.error("Failed to register data source: data_source_id={}, type={}, error={}",
                        dataSourceId, config.getType(), e.getMessage());
                throw e;
            }
            config.setStatus(DataSourceStatus.ACTIVE);
            config.setLastTestedAt(OffsetDateTime.now());

            Optional<Connector> previous = registry.put(dataSourceId, connector);
            if (previous.isPresent() && previous.get() != connector) {
                log.warn("Replacing registered data source: data_source_id={}", dataSourceId);
                previous.get().close();
                invalidateDataSourceQuietly(dataSourceId);
            }
            log.info("Registered data source: data_source_id={}, type={}, tenant_id={}",
                    dataSourceId, config.getType(), config.getTenantId());
            return config.redacted();
        } finally {
            adminLock.unlock();
        }
    }

    /**
     * Closes and unregisters a connector and drops its cached results.
     *
     * @return false when no source was registered under the id
     */
    public boolean removeDataSource(String dataSourceId) {
        adminLock.lock();
        try {
            Optional<Connector> removed = registry.remove(dataSourceId);
            if (removed.isEmpty()) {
                return false;
            }
            Connector connector = removed.get();
            connector.close();
            connector.getConfig().setStatus(DataSourceStatus.INACTIVE);
            invalidateDataSourceQuietly(dataSourceId);
            log.info("Removed data source: data_source_id={}", dataSourceId);
            return true;
        } finally {
            adminLock.unlock();
        }
    }

    public QueryResult executeQuery(QueryRequest request) {
        long start = System.currentTimeMillis();
        String dataSourceId = request != null ? request.getDataSourceId() : null;

        try {
            if (dataSourceId == null || dataSourceId.isBlank()) {
                throw new ValidationException("Data source ID is required");
            }
            if (request.getSql() == null || request.getSql().isBlank()) {
                throw new ValidationException("SQL is required");
            }
            Connector connector = requireConnector(dataSourceId);
            String tenantId = resolveTenant(connector, request.getTenantId());
            sqlSafetyGuard.check(request.getSql());

            Map<String, Object> parameters = request.getParameters() != null ? request.getParameters() : Map.of();
            boolean useCache = !Boolean.FALSE.equals(request.getUseCache());
            String cacheKey = null;
            if (useCache) {
                cacheKey = cacheKeyQuietly(tenantId, dataSourceId, request.getSql(), parameters);
                Optional<QueryResult> cached = cacheKey != null ? cacheGetQuietly(cacheKey) : Optional.empty();
                if (cached.isPresent()) {
                    QueryResult hit = cached.get().withCacheHit(System.currentTimeMillis() - start);
                    log.info("Query served: data_source_id={}, tenant_id={}, execution_time_ms={}, row_count={}, cached=true",
                            dataSourceId, tenantId, hit.getMetadata().getExecutionTime(), hit.getMetadata().getRowCount());
                    return hit;
                }
            }

            QueryExecutionContext context = QueryExecutionContext.builder()
                    .tenantId(tenantId)
                    .dataSourceId(dataSourceId)
                    .parameters(parameters)
                    .maxRows(effectiveMaxRows(request.getMaxRows()))
                    .timeoutMs(request.getTimeout() != null && request.getTimeout() > 0
                            ? request.getTimeout()
                            : properties.getQueryTimeout().toMillis())
                    .build();
            ConnectorResult raw = connector.executeQuery(request.getSql(), context);

            QueryResult result = QueryResult.of(raw.getColumns(), raw.getRows(), QueryMetadata.builder()
                    .executionTime(raw.getMetrics().getExecutionTime())
                    .rowCount(raw.getRows().size())
                    .dataScanned(raw.getMetrics().getDataScanned())
                    .cached(false)
                    .truncated(raw.getMetrics().isTruncated())
                    .build());

            if (useCache && cacheKey != null) {
                long ttl = request.getCacheTtl() != null && request.getCacheTtl() > 0
                        ? request.getCacheTtl()
                        : properties.getCacheDefaultTtl().getSeconds();
                cacheSetQuietly(cacheKey, result, ttl);
            }

            log.info("Query served: data_source_id={}, tenant_id={}, execution_time_ms={}, row_count={}, truncated={}, cached=false",
                    dataSourceId, tenantId, System.currentTimeMillis() - start,
                    result.getMetadata().getRowCount(), result.getMetadata().isTruncated());
            return result;
        } catch (QueryEngineException e) {
            log.error("Query failed: data_source_id={}, execution_time_ms={}, code={}, error={}",
                    dataSourceId, System.currentTimeMillis() - start, e.getCode(), e.getMessage());
            throw e;
        }
    }

    public SchemaInfo getSchema(String dataSourceId) {
        long start = System.currentTimeMillis();
        Connector connector = requireConnector(dataSourceId);
        SchemaInfo schema = connector.getSchema();
        log.info("Schema loaded: data_source_id={}, execution_time_ms={}, databases={}",
                dataSourceId, System.currentTimeMillis() - start, schema.getDatabases().size());
        return schema;
    }

    /**
     * Checks SQL against the guard and the backend planner without running it.
     * Never throws for a bad query or an unknown source; the reason is in the result.
     */
    public ValidationResult validateQuery(String dataSourceId, String sql) {
        try {
            sqlSafetyGuard.check(sql);
            Optional<Connector> connector = registry.get(dataSourceId);
            if (connector.isEmpty()) {
                return ValidationResult.invalid(NotFoundException.dataSource(dataSourceId).getMessage());
            }
            return connector.get().validateQuery(sql);
        } catch (QueryEngineException e) {
            return ValidationResult.invalid(e.getMessage());
        }
    }

    /**
     * Checks every registered source in parallel. A check that fails or exceeds
     * {@code health-check-timeout} marks only its own source unhealthy.
     *
     * @return health per data source id, ordered by id
     */
    public Map<String, HealthStatus> getHealthStatus() {
        Map<String, Connector> connectors = registry.snapshot();
        Map<String, CompletableFuture<HealthStatus>> checks = new LinkedHashMap<>();
        connectors.forEach((id, connector) ->
                checks.put(id, CompletableFuture.supplyAsync(connector::getHealth, executor)));

        long deadline = System.nanoTime() + properties.getHealthCheckTimeout().toNanos();
        Map<String, HealthStatus> result = new LinkedHashMap<>();
        for (Map.Entry<String, CompletableFuture<HealthStatus>> check : checks.entrySet()) {
            String id = check.getKey();
            HealthStatus status = awaitHealth(id, check.getValue(), deadline);
            ConnectionConfig config = connectors.get(id).getConfig();
            config.setStatus(status.isHealthy() ? DataSourceStatus.ACTIVE : DataSourceStatus.ERROR);
            config.setLastTestedAt(status.getLastChecked());
            result.put(id, status);
        }
        return result;
    }

    private HealthStatus awaitHealth(String dataSourceId, CompletableFuture<HealthStatus> check, long deadline) {
        try {
            long remaining = Math.max(deadline - System.nanoTime(), 0);
            return check.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            check.cancel(true);
            log.warn("Health check timed out: data_source_id={}", dataSourceId);
            return unhealthy("Health check timed out after " + properties.getHealthCheckTimeout().toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Health check failed: data_source_id={}, error={}", dataSourceId, cause.getMessage());
            return unhealthy(cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return unhealthy("Health check interrupted");
        }
    }

    private static HealthStatus unhealthy(String error) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("error", error);
        return HealthStatus.unhealthy(details);
    }

    public boolean isCacheHealthy() {
        try {
            return cache.healthCheck();
        } catch (RuntimeException e) {
            log.error("Cache health check failed", e);
            return false;
        }
    }

    public CacheStats getCacheStats() {
        try {
            return cache.stats();
        } catch (RuntimeException e) {
            log.error("Failed to read cache stats", e);
            return CacheStats.builder().build();
        }
    }

    /**
     * Drops cached results of one data source for every tenant.
     *
     * @return number of entries removed; 0 when the cache is unavailable
     */
    public long clearCache(String dataSourceId) {
        long removed = invalidateDataSourceQuietly(dataSourceId);
        log.info("Cache cleared: data_source_id={}, removed={}", dataSourceId, removed);
        return removed;
    }

    /**
     * Drops cached results of one tenant across every data source.
     *
     * @return number of entries removed; 0 when the cache is unavailable
     */
    public long clearTenantCache(String tenantId) {
        long removed;
        try {
            removed = cache.invalidateTenant(tenantId);
        } catch (RuntimeException e) {
            log.warn("Cache invalidation failed: tenant_id={}, error={}", tenantId, e.getMessage());
            removed = 0;
        }
        log.info("Cache cleared: tenant_id={}, removed={}", tenantId, removed);
        return removed;
    }

    public List<ConnectionConfig> listDataSources() {
        return registry.snapshot().values().stream()
                .map(connector -> connector.getConfig().redacted())
                .sorted(Comparator.comparing(ConnectionConfig::getId))
                .collect(Collectors.toList());
    }

    public Optional<Connector> getConnector(String dataSourceId) {
        return registry.get(dataSourceId);
    }

    @PreDestroy
    @Override
    public void close() {
        adminLock.lock();
        try {
            for (String id : registry.snapshot().keySet()) {
                registry.remove(id).ifPresent(Connector::close);
            }
            log.info("Query service closed all connectors");
        } finally {
            adminLock.unlock();
        }
    }

    private Connector requireConnector(String dataSourceId) {
        return registry.get(dataSourceId).orElseThrow(() -> NotFoundException.dataSource(dataSourceId));
    }

    /**
     * A source bound to a tenant is invisible to other tenants; unbound sources are shared and
     * cached under the requesting tenant.
     */
    private String resolveTenant(Connector connector, String requestTenant) {
        String owner = connector.getConfig().getTenantId();
        boolean hasRequestTenant = requestTenant != null && !requestTenant.isBlank();
        if (owner != null && !owner.isBlank()) {
            if (hasRequestTenant && !owner.equals(requestTenant)) {
                throw NotFoundException.dataSource(connector.getConfig().getId());
            }
            return owner;
        }
        return hasRequestTenant ? requestTenant : DEFAULT_TENANT;
    }

    private int effectiveMaxRows(Integer requested) {
        int limit = properties.getMaxResultRows();
        if (requested == null || requested <= 0) {
            return limit;
        }
        return limit > 0 ? Math.min(requested, limit) : requested;
    }

    private String cacheKeyQuietly(String tenantId, String dataSourceId, String sql, Map<String, Object> parameters) {
        try {
            return cache.generateKey(tenantId, dataSourceId, sql, parameters);
        } catch (RuntimeException e) {
            log.warn("Cache key generation failed, skipping cache: data_source_id={}, error={}", dataSourceId, e.getMessage());
            return null;
        }
    }

    private Optional<QueryResult> cacheGetQuietly(String key) {
        try {
            return cache.get(key);
        } catch (RuntimeException e) {
            log.warn("Cache read failed, treating as miss: key={}, error={}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private void cacheSetQuietly(String key, QueryResult result, long ttlSeconds) {
        try {
            cache.set(key, result, ttlSeconds);
        } catch (RuntimeException e) {
            log.warn("Cache write failed, result not cached: key={}, error={}", key, e.getMessage());
        }
    }

    private long invalidateDataSourceQuietly(String dataSourceId) {
        try {
            return cache.invalidateDataSource(dataSourceId);
        } catch (RuntimeException e) {
            log.warn("Cache invalidation failed: data_source_id={}, error={}", dataSourceId, e.getMessage());
            return 0;
        }
    }
}
