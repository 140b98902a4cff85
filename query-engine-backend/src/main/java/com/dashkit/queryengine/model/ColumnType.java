package com.dashkit.queryengine.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Normalized column type vocabulary shared by every connector. Chart rendering downstream
 * keys off these tags, so connectors must map native types into this set and nothing else.
 */
public enum ColumnType {
    INTEGER,
    FLOAT,
    DECIMAL,
    STRING,
    BOOLEAN,
    DATE,
    TIME,
    TIMESTAMP,
    JSON,
    BINARY,
    ARRAY,
    OBJECT;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
