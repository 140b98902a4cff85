package com.dashkit.queryengine.controller;

import com.dashkit.queryengine.api.QueryRequest;
import com.dashkit.queryengine.api.RegisterDataSourceRequest;
import com.dashkit.queryengine.api.ServiceHealthResponse;
import com.dashkit.queryengine.api.ValidateQueryRequest;
import com.dashkit.queryengine.exception.NotFoundException;
import com.dashkit.queryengine.model.CacheStats;
import com.dashkit.queryengine.model.ConnectionConfig;
import com.dashkit.queryengine.model.HealthStatus;
import com.dashkit.queryengine.model.QueryResult;
import com.dashkit.queryengine.model.SchemaInfo;
import com.dashkit.queryengine.model.ValidationResult;
import com.dashkit.queryengine.service.DataSourceSettingsBinder;
import com.dashkit.queryengine.service.QueryService;
import com.dashkit.queryengine.web.TraceIdFilter;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/v1")
public class QueryEngineController {

    private static final Logger log = LoggerFactory.getLogger(QueryEngineController.class);

    private final QueryService queryService;
    private final DataSourceSettingsBinder settingsBinder;

    public QueryEngineController(
            QueryService queryService,
            DataSourceSettingsBinder settingsBinder
    ) {
        this.queryService = queryService;
        this.settingsBinder = settingsBinder;
    }

    @PostMapping("/query/execute")
    public ResponseEntity<QueryResult> executeQuery(
            @RequestHeader(value = TraceIdFilter.TENANT_ID_HEADER, required = false) String tenantId,
            @Valid @RequestBody QueryRequest request) {
        if ((request.getTenantId() == null || request.getTenantId().isBlank()) && tenantId != null) {
            request.setTenantId(tenantId);
        }
        return ResponseEntity.ok(queryService.executeQuery(request));
    }

    @PostMapping("/query/validate")
    public ResponseEntity<ValidationResult> validateQuery(@Valid @RequestBody ValidateQueryRequest request) {
        return ResponseEntity.ok(queryService.validateQuery(request.getDataSourceId(), request.getSql()));
    }

    @GetMapping("/datasources")
    public ResponseEntity<List<ConnectionConfig>> listDataSources() {
        return ResponseEntity.ok(queryService.listDataSources());
    }

    @PostMapping("/datasources")
    public ResponseEntity<ConnectionConfig> registerDataSource(@Valid @RequestBody RegisterDataSourceRequest request) {
        ConnectionConfig config = settingsBinder.bind(request);
        ConnectionConfig registered = queryService.registerDataSource(request.getId(), config);
        log.info("Data source registered via API: data_source_id={}, type={}", registered.getId(), registered.getType());
        return ResponseEntity.status(HttpStatus.CREATED).body(registered);
    }

    @DeleteMapping("/datasources/{id}")
    public ResponseEntity<Void> removeDataSource(@PathVariable("id") String id) {
        if (!queryService.removeDataSource(id)) {
            throw NotFoundException.dataSource(id);
        }
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/datasources/{id}/schema")
    public ResponseEntity<SchemaInfo> getSchema(@PathVariable("id") String id) {
        return ResponseEntity.ok(queryService.getSchema(id));
    }

    @GetMapping("/health")
    public ResponseEntity<ServiceHealthResponse> health() {
        Map<String, HealthStatus> dataSources = queryService.getHealthStatus();
        boolean cacheHealthy = queryService.isCacheHealthy();
        boolean allHealthy = cacheHealthy && dataSources.values().stream().allMatch(HealthStatus::isHealthy);
        ServiceHealthResponse response = ServiceHealthResponse.builder()
                .status(allHealthy ? "healthy" : "degraded")
                .cacheHealthy(cacheHealthy)
                .dataSources(dataSources)
                .timestamp(OffsetDateTime.now())
                .build();
        return ResponseEntity.ok(response);
    }

    @GetMapping("/cache/stats")
    public ResponseEntity<CacheStats> cacheStats() {
        return ResponseEntity.ok(queryService.getCacheStats());
    }

    @DeleteMapping("/cache/{dataSourceId}")
    public ResponseEntity<Map<String, Object>> clearCache(@PathVariable("dataSourceId") String dataSourceId) {
        long removed = queryService.clearCache(dataSourceId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("dataSourceId", dataSourceId);
        body.put("removed", removed);
        return ResponseEntity.ok(body);
    }
}
