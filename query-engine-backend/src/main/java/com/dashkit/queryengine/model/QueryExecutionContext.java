package com.dashkit.queryengine.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Per-call execution knobs handed from the query service to a connector.
 */
@Value
@Builder
public class QueryExecutionContext {
    String tenantId;
    String dataSourceId;
    @Builder.Default
    Map<String, Object> parameters = Map.of();
    /**
     * Maximum rows to return; {@code 0} means unbounded.
     */
    int maxRows;
    /**
     * Upper bound for the backend call in milliseconds; {@code 0} means unbounded.
     */
    long timeoutMs;

    public static QueryExecutionContext empty() {
        return QueryExecutionContext.builder().build();
    }
}
