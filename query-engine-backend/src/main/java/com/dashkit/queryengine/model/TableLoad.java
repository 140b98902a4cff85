package com.dashkit.queryengine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * External file materialized into a DuckDB table when the connector connects.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TableLoad {
    private String table;
    private Format format;
    private String path;

    // csv only
    @Builder.Default
    private String delimiter = ",";
    @Builder.Default
    private boolean header = true;
    @Builder.Default
    private int skipRows = 0;
    /**
     * Explicit column name to DuckDB type mapping; disables type sniffing when present.
     */
    @Builder.Default
    private Map<String, String> columns = new LinkedHashMap<>();

    public enum Format {
        CSV,
        JSON,
        PARQUET;

        @JsonValue
        public String getValue() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Format fromValue(String value) {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }
}
