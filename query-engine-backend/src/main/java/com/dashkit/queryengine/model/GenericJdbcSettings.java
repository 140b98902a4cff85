package com.dashkit.queryengine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Settings shape accepted for backends without a connector yet (BigQuery, Snowflake,
 * PostgreSQL, MySQL). Stored so registrations round-trip, never used to connect.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class GenericJdbcSettings implements DataSourceSettings {
    private String hostname;
    private Integer port;
    private String database;
    private String username;
    private String password;
    private String account;
    private String warehouse;
    private String projectId;
    private String keyFile;

    @Override
    public GenericJdbcSettings redacted() {
        return toBuilder().password(password != null ? "****" : null).build();
    }
}
