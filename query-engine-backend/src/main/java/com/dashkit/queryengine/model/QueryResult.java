package com.dashkit.queryengine.model;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Execution outcome returned to callers.
 *
 * <p>Instances are immutable: columns, rows, each row map and any list or map nested in a
 * cell are read-only views over private copies, so a result handed to the cache cannot be changed by the caller that
 * produced it, and a cache hit never mutates the stored entry.
 */
@Value
public class QueryResult {
    List<ColumnMetadata> columns;
    List<Map<String, Object>> rows;
    QueryMetadata metadata;

    private QueryResult(List<ColumnMetadata> columns, List<Map<String, Object>> rows, QueryMetadata metadata) {
        this.columns = columns;
        this.rows = rows;
        this.metadata = metadata;
    }

    public static QueryResult of(List<ColumnMetadata> columns, List<Map<String, Object>> rows, QueryMetadata metadata) {
        List<ColumnMetadata> columnsCopy = columns != null ? List.copyOf(columns) : List.of();
        List<Map<String, Object>> rowsCopy = new ArrayList<>(rows != null ? rows.size() : 0);
        if (rows != null) {
            for (Map<String, Object> row : rows) {
                // row values may be null, so Map.copyOf is not an option
                rowsCopy.add(freezeMap(row));
            }
        }
        return new QueryResult(columnsCopy, Collections.unmodifiableList(rowsCopy), metadata);
    }

    private static Map<String, Object> freezeMap(Map<?, ?> map) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), freeze(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Object freeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            return freezeMap(map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object element : list) {
                copy.add(freeze(element));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    /**
     * Copy of this result annotated as served from cache.
     *
     * @param elapsedMs time spent on the cache round trip
     * @return annotated copy sharing the same immutable columns and rows
     */
    public QueryResult withCacheHit(long elapsedMs) {
        QueryMetadata annotated = metadata.toBuilder()
                .cached(true)
                .executionTime(elapsedMs)
                .build();
        return new QueryResult(columns, rows, annotated);
    }
}
