package com.dashkit.queryengine.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class QueryMetadata {
    long executionTime;
    int rowCount;
    long dataScanned;
    boolean cached;
    boolean truncated;
}
