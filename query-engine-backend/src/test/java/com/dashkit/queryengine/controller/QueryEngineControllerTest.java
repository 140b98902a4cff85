package com.dashkit.queryengine.controller;

import com.dashkit.queryengine.api.QueryRequest;
import com.dashkit.queryengine.api.RegisterDataSourceRequest;
import com.dashkit.queryengine.exception.ConnectionException;
import com.dashkit.queryengine.exception.NotFoundException;
import com.dashkit.queryengine.exception.QueryExecutionException;
import com.dashkit.queryengine.exception.ValidationException;
import com.dashkit.queryengine.model.CacheStats;
import com.dashkit.queryengine.model.ColumnMetadata;
import com.dashkit.queryengine.model.ColumnType;
import com.dashkit.queryengine.model.ConnectionConfig;
import com.dashkit.queryengine.model.DataSourceStatus;
import com.dashkit.queryengine.model.DataSourceType;
import com.dashkit.queryengine.model.HealthStatus;
import com.dashkit.queryengine.model.QueryMetadata;
import com.dashkit.queryengine.model.QueryResult;
import com.dashkit.queryengine.model.ValidationResult;
import com.dashkit.queryengine.service.DataSourceSettingsBinder;
import com.dashkit.queryengine.service.QueryService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(QueryEngineController.class)
public class QueryEngineControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private QueryService queryService;

    @MockBean
    private DataSourceSettingsBinder settingsBinder;

    private static QueryResult sampleResult() {
        return QueryResult.of(
                List.of(ColumnMetadata.builder().name("n").type(ColumnType.INTEGER).nullable(false).build()),
                List.of(Map.of("n", 3)),
                QueryMetadata.builder().executionTime(7).rowCount(1).build());
    }

    @Test
    public void testExecuteQuery() throws Exception {
        when(queryService.executeQuery(any())).thenReturn(sampleResult());

        mockMvc.perform(post("/v1/query/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Tenant-ID", "acme")
                        .header("X-Request-Id", "trace-123")
                        .content("{\"dataSourceId\":\"sales\",\"sql\":\"SELECT COUNT(*) AS n FROM orders\"}"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Request-Id", "trace-123"))
                .andExpect(jsonPath("$.rows[0].n").value(3))
                .andExpect(jsonPath("$.columns[0].type").value("integer"))
                .andExpect(jsonPath("$.metadata.cached").value(false))
                .andExpect(jsonPath("$.metadata.rowCount").value(1));

        ArgumentCaptor<QueryRequest> captor = ArgumentCaptor.forClass(QueryRequest.class);
        verify(queryService).executeQuery(captor.capture());
        assertEquals("acme", captor.getValue().getTenantId());
        assertEquals("sales", captor.getValue().getDataSourceId());
    }

    @Test
    public void testBodyTenantWinsOverHeader() throws Exception {
        when(queryService.executeQuery(any())).thenReturn(sampleResult());

        mockMvc.perform(post("/v1/query/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("X-Tenant-ID", "acme")
                        .content("{\"tenantId\":\"globex\",\"dataSourceId\":\"sales\",\"sql\":\"SELECT 1\"}"))
                .andExpect(status().isOk())
                .andExpect(header().exists("X-Request-Id"));

        ArgumentCaptor<QueryRequest> captor = ArgumentCaptor.forClass(QueryRequest.class);
        verify(queryService).executeQuery(captor.capture());
        assertEquals("globex", captor.getValue().getTenantId());
    }

    @Test
    public void testMissingSqlIsRejected() throws Exception {
        mockMvc.perform(post("/v1/query/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dataSourceId\":\"sales\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));

        verifyNoInteractions(queryService);
    }

    @Test
    public void testMalformedBody() throws Exception {
        mockMvc.perform(post("/v1/query/execute")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    public void testErrorStatusMapping() throws Exception {
        String body = "{\"dataSourceId\":\"sales\",\"sql\":\"SELECT 1\"}";

        when(queryService.executeQuery(any())).thenThrow(new ValidationException("Potentially unsafe SQL detected"));
        mockMvc.perform(post("/v1/query/execute").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Potentially unsafe SQL detected"));

        reset(queryService);
        when(queryService.executeQuery(any())).thenThrow(NotFoundException.dataSource("sales"));
        mockMvc.perform(post("/v1/query/execute").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));

        reset(queryService);
        when(queryService.executeQuery(any())).thenThrow(QueryExecutionException.timeout(1000, null));
        mockMvc.perform(post("/v1/query/execute").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.code").value(QueryExecutionException.TIMEOUT_CODE));

        reset(queryService);
        when(queryService.executeQuery(any())).thenThrow(new QueryExecutionException("DuckDB query failed: no table"));
        mockMvc.perform(post("/v1/query/execute").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isUnprocessableEntity());

        reset(queryService);
        when(queryService.executeQuery(any())).thenThrow(new ConnectionException("unreachable"));
        mockMvc.perform(post("/v1/query/execute").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isBadGateway());
    }

    @Test
    public void testValidateQuery() throws Exception {
        when(queryService.validateQuery("sales", "SELECT nope")).thenReturn(ValidationResult.invalid("no column nope"));

        mockMvc.perform(post("/v1/query/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"dataSourceId\":\"sales\",\"sql\":\"SELECT nope\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.isValid").value(false))
                .andExpect(jsonPath("$.error").value("no column nope"));
    }

    @Test
    public void testRegisterDataSource() throws Exception {
        ConnectionConfig bound = ConnectionConfig.builder()
                .id("sales").type(DataSourceType.DUCKDB).name("Sales").build();
        ConnectionConfig registered = bound.toBuilder().status(DataSourceStatus.ACTIVE).build();
        when(settingsBinder.bind(any(RegisterDataSourceRequest.class))).thenReturn(bound);
        when(queryService.registerDataSource(eq("sales"), eq(bound))).thenReturn(registered);

        mockMvc.perform(post("/v1/datasources")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"sales\",\"type\":\"Duck\",\"name\":\"Sales\",\"config\":{\"databasePath\":\":memory:\"}}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("sales"))
                .andExpect(jsonPath("$.type").value("duckdb"))
                .andExpect(jsonPath("$.status").value("active"));

        ArgumentCaptor<RegisterDataSourceRequest> captor = ArgumentCaptor.forClass(RegisterDataSourceRequest.class);
        verify(settingsBinder).bind(captor.capture());
        assertEquals(DataSourceType.DUCKDB, captor.getValue().getType());
        assertEquals(":memory:", captor.getValue().getConfig().get("databasePath"));
    }

    @Test
    public void testUnknownTypeIsRejected() throws Exception {
        mockMvc.perform(post("/v1/datasources")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"id\":\"x\",\"type\":\"oracle\",\"name\":\"X\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(queryService);
    }

    @Test
    public void testRemoveDataSource() throws Exception {
        when(queryService.removeDataSource("sales")).thenReturn(true);

        mockMvc.perform(delete("/v1/datasources/sales")).andExpect(status().isNoContent());
        mockMvc.perform(delete("/v1/datasources/other")).andExpect(status().isNotFound());
    }

    @Test
    public void testHealthIsDegradedWhenOneSourceFails() throws Exception {
        when(queryService.getHealthStatus()).thenReturn(Map.of(
                "sales", HealthStatus.healthy(Map.of("connected", true)),
                "warehouse", HealthStatus.unhealthy(Map.of("error", "timed out"))));
        when(queryService.isCacheHealthy()).thenReturn(true);

        mockMvc.perform(get("/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("degraded"))
                .andExpect(jsonPath("$.cacheHealthy").value(true))
                .andExpect(jsonPath("$.dataSources.sales.status").value("healthy"))
                .andExpect(jsonPath("$.dataSources.warehouse.details.error").value("timed out"));
    }

    @Test
    public void testCacheEndpoints() throws Exception {
        when(queryService.getCacheStats()).thenReturn(CacheStats.builder().hits(4).misses(1).entries(2).build());
        when(queryService.clearCache("sales")).thenReturn(2L);

        mockMvc.perform(get("/v1/cache/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.hits").value(4))
                .andExpect(jsonPath("$.entries").value(2));

        mockMvc.perform(delete("/v1/cache/sales"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.dataSourceId").value("sales"))
                .andExpect(jsonPath("$.removed").value(2));
    }

    @Test
    public void testCorsPreflightAllowsTenantHeader() throws Exception {
        mockMvc.perform(options("/v1/query/execute")
                        .header("Origin", "https://dashboards.example.com")
                        .header("Access-Control-Request-Method", "POST")
                        .header("Access-Control-Request-Headers", "Content-Type, X-Tenant-ID"))
                .andExpect(status().isOk())
                .andExpect(header().string("Access-Control-Allow-Origin", "https://dashboards.example.com"))
                .andExpect(header().string("Access-Control-Allow-Credentials", "true"));

        verifyNoInteractions(queryService);
    }

    @Test
    public void testResponsesCarryRateLimitHeaders() throws Exception {
        when(queryService.isCacheHealthy()).thenReturn(true);
        when(queryService.getHealthStatus()).thenReturn(Map.of());

        mockMvc.perform(get("/v1/health"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-RateLimit-Limit", "1000"))
                .andExpect(header().exists("X-RateLimit-Remaining"));
    }
}
