package com.dashkit.queryengine.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class QueryMetrics {
    long executionTime;
    int rowsReturned;
    long dataScanned;
    boolean cacheHit;
    boolean truncated;
}
