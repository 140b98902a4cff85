package com.dashkit.queryengine.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryRequest {
    /**
     * Filled from the {@code X-Tenant-ID} header when absent from the body.
     */
    private String tenantId;

    @NotBlank(message = "Data source ID is required")
    private String dataSourceId;

    @NotBlank(message = "SQL is required")
    private String sql;

    private Map<String, Object> parameters;

    /**
     * Only an explicit {@code false} bypasses the cache.
     */
    private Boolean useCache;

    @Positive(message = "cacheTtl must be positive")
    private Integer cacheTtl;

    @Positive(message = "maxRows must be positive")
    private Integer maxRows;

    /**
     * Backend timeout in milliseconds.
     */
    @Positive(message = "timeout must be positive")
    private Integer timeout;
}
