package com.dashkit.queryengine.api;

import com.dashkit.queryengine.model.HealthStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ServiceHealthResponse {
    /**
     * {@code healthy} when the cache and every data source are healthy, {@code degraded} otherwise.
     */
    private String status;
    private boolean cacheHealthy;
    private Map<String, HealthStatus> dataSources;
    private OffsetDateTime timestamp;
}
