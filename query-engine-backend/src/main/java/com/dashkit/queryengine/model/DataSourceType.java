package com.dashkit.queryengine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Map;

/**
 * Backend families a data source can be registered as.
 *
 * <p>Incoming type names are normalized (trimmed, lowercased, alias-mapped) before lookup,
 * so {@code "Postgres"}, {@code "pg"} and {@code "postgresql"} all resolve to {@link #POSTGRESQL}.
 */
public enum DataSourceType {
    DATABRICKS("databricks", "Databricks", DatabricksSettings.class),
    DUCKDB("duckdb", "DuckDB", DuckDbSettings.class),
    BIGQUERY("bigquery", "BigQuery", GenericJdbcSettings.class),
    SNOWFLAKE("snowflake", "Snowflake", GenericJdbcSettings.class),
    POSTGRESQL("postgresql", "PostgreSQL", GenericJdbcSettings.class),
    MYSQL("mysql", "MySQL", GenericJdbcSettings.class);

    private static final Map<String, String> ALIASES = Map.ofEntries(
            Map.entry("postgres", "postgresql"),
            Map.entry("pg", "postgresql"),
            Map.entry("duck", "duckdb"),
            Map.entry("mariadb", "mysql"),
            Map.entry("bq", "bigquery")
    );

    private final String value;
    private final String displayName;
    private final Class<? extends DataSourceSettings> settingsType;

    DataSourceType(String value, String displayName, Class<? extends DataSourceSettings> settingsType) {
        this.value = value;
        this.displayName = displayName;
        this.settingsType = settingsType;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getDisplayName() {
        return displayName;
    }

    public Class<? extends DataSourceSettings> getSettingsType() {
        return settingsType;
    }

    /**
     * Resolve a type name.
     *
     * @param type incoming type name or alias
     * @return data source type
     * @throws IllegalArgumentException if the name is blank or unknown
     */
    @JsonCreator
    public static DataSourceType fromValue(String type) {
        String normalized = normalize(type);
        for (DataSourceType candidate : values()) {
            if (candidate.value.equals(normalized)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unsupported data source type: " + type);
    }

    static String normalize(String type) {
        if (type == null) {
            return "";
        }
        String v = type.trim().toLowerCase(Locale.ROOT);
        return ALIASES.getOrDefault(v, v);
    }

    @Override
    public String toString() {
        return value;
    }
}
