package com.dashkit.queryengine.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Raw outcome of a connector call, before the query service wraps it into a {@link QueryResult}.
 */
@Value
@Builder
public class ConnectorResult {
    List<Map<String, Object>> rows;
    List<ColumnMetadata> columns;
    QueryMetrics metrics;
}
