package com.dashkit.queryengine.service;

import com.dashkit.queryengine.api.QueryRequest;
import com.dashkit.queryengine.cache.CaffeineQueryCache;
import com.dashkit.queryengine.config.QueryEngineProperties;
import com.dashkit.queryengine.connector.Connector;
import com.dashkit.queryengine.connector.ConnectorFactory;
import com.dashkit.queryengine.exception.ConnectionException;
import com.dashkit.queryengine.exception.QueryExecutionException;
import com.dashkit.queryengine.model.ColumnType;
import com.dashkit.queryengine.model.ConnectionConfig;
import com.dashkit.queryengine.model.DataSourceType;
import com.dashkit.queryengine.model.DuckDbSettings;
import com.dashkit.queryengine.model.HealthStatus;
import com.dashkit.queryengine.model.QueryExecutionContext;
import com.dashkit.queryengine.model.QueryResult;
import com.dashkit.queryengine.model.TableLoad;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Ticker;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the full query path against an in-memory DuckDB database fed from a CSV file.
 */
public class QueryServiceDuckDbIntegrationTest {

    @TempDir
    Path tempDir;

    private ExecutorService executor;
    private CaffeineQueryCache cache;
    private QueryService service;

    @BeforeEach
    public void setup() throws Exception {
        Path csv = tempDir.resolve("orders.csv");
        Files.writeString(csv, "region,amount\nnorth,10\nsouth,20\nnorth,5\n");

        executor = Executors.newCachedThreadPool();
        QueryEngineProperties properties = new QueryEngineProperties();
        cache = new CaffeineQueryCache(properties, new ObjectMapper(), Ticker.systemTicker());
        service = new QueryService(new DataSourceRegistry(), new ConnectorFactory(properties, executor), cache,
                new SqlSafetyGuard(properties), properties, executor);

        DuckDbSettings settings = DuckDbSettings.builder()
                .loads(List.of(TableLoad.builder().table("orders").format(TableLoad.Format.CSV).path(csv.toString()).build()))
                .build();
        service.registerDataSource("sales", ConnectionConfig.builder()
                .type(DataSourceType.DUCKDB)
                .name("Sales")
                .config(settings)
                .build());
    }

    @AfterEach
    public void teardown() {
        service.close();
        executor.shutdownNow();
    }

    private static QueryRequest request(String sql) {
        return QueryRequest.builder().dataSourceId("sales").sql(sql).build();
    }

    @Test
    public void testSecondCallIsServedFromCache() {
        QueryResult first = service.executeQuery(request("SELECT COUNT(*) AS n FROM orders"));
        QueryResult second = service.executeQuery(request("SELECT COUNT(*) AS n FROM orders"));

        assertFalse(first.getMetadata().isCached());
        assertTrue(second.getMetadata().isCached());
        assertEquals(1, first.getRows().size());
        assertEquals(3L, ((Number) first.getRows().get(0).get("n")).longValue());
        assertEquals(first.getRows(), second.getRows());
        assertEquals(ColumnType.INTEGER, second.getColumns().get(0).getType());
        assertEquals(1, cache.stats().getHits());
    }

    @Test
    public void testParametersAreBoundAndPartOfCacheKey() {
        QueryRequest north = request("SELECT SUM(amount) AS total FROM orders WHERE region = $region");
        north.setParameters(Map.of("region", "north"));
        QueryRequest south = request("SELECT SUM(amount) AS total FROM orders WHERE region = $region");
        south.setParameters(Map.of("region", "south"));

        QueryResult northResult = service.executeQuery(north);
        QueryResult southResult = service.executeQuery(south);

        assertFalse(southResult.getMetadata().isCached());
        assertEquals(15L, ((Number) northResult.getRows().get(0).get("total")).longValue());
        assertEquals(20L, ((Number) southResult.getRows().get(0).get("total")).longValue());
    }

    @Test
    public void testTenantsDoNotShareEntries() {
        QueryRequest acme = request("SELECT region FROM orders ORDER BY amount");
        acme.setTenantId("acme");
        QueryRequest globex = request("SELECT region FROM orders ORDER BY amount");
        globex.setTenantId("globex");

        service.executeQuery(acme);
        assertFalse(service.executeQuery(globex).getMetadata().isCached());
        assertTrue(service.executeQuery(acme).getMetadata().isCached());

        assertEquals(1, service.clearTenantCache("acme"));
        assertFalse(service.executeQuery(acme).getMetadata().isCached());
    }

    @Test
    public void testMaxRowsTruncates() {
        QueryRequest request = request("SELECT * FROM orders");
        request.setMaxRows(2);
        request.setUseCache(false);

        QueryResult result = service.executeQuery(request);

        assertEquals(2, result.getRows().size());
        assertTrue(result.getMetadata().isTruncated());
        assertEquals(List.of("region", "amount"), List.of(result.getColumns().get(0).getName(), result.getColumns().get(1).getName()));
    }

    @Test
    public void testBackendErrorIsReported() {
        QueryExecutionException ex = assertThrows(QueryExecutionException.class,
                () -> service.executeQuery(request("SELECT * FROM missing_table")));

        assertTrue(ex.getMessage().startsWith("DuckDB query failed: "));
        assertEquals(0, cache.stats().getEntries());
    }

    @Test
    public void testClearCacheAndRemoval() {
        service.executeQuery(request("SELECT 1 AS one"));
        service.executeQuery(request("SELECT 2 AS two"));

        assertEquals(2, service.clearCache("sales"));
        service.executeQuery(request("SELECT 1 AS one"));

        assertTrue(service.removeDataSource("sales"));
        assertEquals(0, cache.stats().getEntries());
        assertTrue(service.listDataSources().isEmpty());
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testListCellsCannotAlterCachedResult() {
        QueryResult first = service.executeQuery(request("SELECT [1, 2, 3] AS xs"));
        List<Object> cell = (List<Object>) first.getRows().get(0).get("xs");
        assertThrows(UnsupportedOperationException.class, cell::clear);

        QueryResult second = service.executeQuery(request("SELECT [1, 2, 3] AS xs"));
        assertTrue(second.getMetadata().isCached());
        assertEquals(List.of(1, 2, 3), second.getRows().get(0).get("xs"));
    }

    @Test
    public void testRemovedSourceDoesNotReopen() {
        Connector connector = service.getConnector("sales").orElseThrow();

        assertTrue(service.removeDataSource("sales"));

        assertThrows(ConnectionException.class,
                () -> connector.executeQuery("SELECT 42 AS x", QueryExecutionContext.empty()));
        assertFalse(connector.testConnection());
        assertFalse(connector.isConnected());
    }

    @Test
    public void testSchemaAndHealth() {
        assertEquals("orders", service.getSchema("sales").getDatabases().get(0).getTables().get(0).getName());

        Map<String, HealthStatus> health = service.getHealthStatus();
        assertTrue(health.get("sales").isHealthy());
        assertTrue(service.isCacheHealthy());
        assertTrue(service.validateQuery("sales", "SELECT amount FROM orders").isValid());
        assertFalse(service.validateQuery("sales", "SELECT nope FROM orders").isValid());
    }
}
