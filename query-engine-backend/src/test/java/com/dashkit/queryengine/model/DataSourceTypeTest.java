package com.dashkit.queryengine.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DataSourceTypeTest {

    @Test
    public void testCanonicalNamesAndAliases() {
        assertEquals(DataSourceType.POSTGRESQL, DataSourceType.fromValue("postgresql"));
        assertEquals(DataSourceType.POSTGRESQL, DataSourceType.fromValue(" Postgres "));
        assertEquals(DataSourceType.POSTGRESQL, DataSourceType.fromValue("pg"));
        assertEquals(DataSourceType.DUCKDB, DataSourceType.fromValue("DuckDB"));
        assertEquals(DataSourceType.DUCKDB, DataSourceType.fromValue("duck"));
        assertEquals(DataSourceType.MYSQL, DataSourceType.fromValue("mariadb"));
        assertEquals(DataSourceType.DATABRICKS, DataSourceType.fromValue("databricks"));
    }

    @Test
    public void testUnknownTypeRejected() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> DataSourceType.fromValue("oracle"));
        assertEquals("Unsupported data source type: oracle", ex.getMessage());
        assertThrows(IllegalArgumentException.class, () -> DataSourceType.fromValue(null));
    }

    @Test
    public void testJsonUsesLowercaseValue() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        assertEquals("\"bigquery\"", mapper.writeValueAsString(DataSourceType.BIGQUERY));
        assertEquals(DataSourceType.SNOWFLAKE, mapper.readValue("\"Snowflake\"", DataSourceType.class));
    }

    @Test
    public void testSettingsTypePerBackend() {
        assertEquals(DuckDbSettings.class, DataSourceType.DUCKDB.getSettingsType());
        assertEquals(DatabricksSettings.class, DataSourceType.DATABRICKS.getSettingsType());
        assertEquals(GenericJdbcSettings.class, DataSourceType.MYSQL.getSettingsType());
    }
}
