package com.dashkit.queryengine.connector;

import com.dashkit.queryengine.config.QueryEngineProperties;
import com.dashkit.queryengine.exception.ConnectionException;
import com.dashkit.queryengine.model.ColumnMetadata;
import com.dashkit.queryengine.model.ColumnType;
import com.dashkit.queryengine.model.ConnectionConfig;
import com.dashkit.queryengine.model.DatabaseInfo;
import com.dashkit.queryengine.model.DatabricksSettings;
import com.dashkit.queryengine.model.SchemaInfo;
import com.dashkit.queryengine.model.TableInfo;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;

/**
 * Databricks SQL warehouse connector over the Databricks JDBC driver, pooled with HikariCP.
 */
public class DatabricksConnector extends AbstractJdbcConnector {

    private static final Logger log = LoggerFactory.getLogger(DatabricksConnector.class);

    static final String DRIVER_CLASS = "com.databricks.client.jdbc.Driver";

    static final ColumnTypeMapping TYPE_MAPPING = ColumnTypeMapping.builder()
            .map(ColumnType.ARRAY, "ARRAY")
            .map(ColumnType.OBJECT, "STRUCT", "MAP")
            .map(ColumnType.DECIMAL, "DECIMAL")
            .map(ColumnType.FLOAT, "DOUBLE", "FLOAT")
            .map(ColumnType.STRING, "INTERVAL")
            .map(ColumnType.INTEGER, "INT")
            .map(ColumnType.STRING, "STRING", "VARCHAR", "CHAR")
            .map(ColumnType.BOOLEAN, "BOOLEAN")
            .map(ColumnType.TIMESTAMP, "TIMESTAMP")
            .map(ColumnType.DATE, "DATE")
            .map(ColumnType.BINARY, "BINARY")
            .build();

    private final DatabricksSettings settings;
    private final QueryEngineProperties properties;
    private volatile HikariDataSource dataSource;

    public DatabricksConnector(ConnectionConfig config, QueryEngineProperties properties, ExecutorService executor) {
        super(config, TYPE_MAPPING, executor);
        this.settings = (DatabricksSettings) config.getConfig();
        this.properties = properties;
    }

    @Override
    protected void doConnect() throws SQLException {
        requireSetting(settings.getServerHostname(), "serverHostname");
        requireSetting(settings.getHttpPath(), "httpPath");
        requireSetting(settings.getAccessToken(), "accessToken");

        HikariDataSource ds = new HikariDataSource(buildHikariConfig());
        try {
            try (Connection conn = ds.getConnection()) {
                if (!conn.isValid(5)) {
                    throw new SQLException("Connection is not valid");
                }
            }
        } catch (SQLException | RuntimeException e) {
            ds.close();
            throw e;
        }
        dataSource = ds;
    }

    HikariConfig buildHikariConfig() {
        HikariConfig hikari = new HikariConfig();
        hikari.setExceptionOverrideClassName(HikariSqlExceptionOverride.class.getName());
        hikari.setDriverClassName(DRIVER_CLASS);
        hikari.setJdbcUrl(jdbcUrl(settings));
        // personal access token auth: UID is the literal "token"
        hikari.addDataSourceProperty("UID", "token");
        hikari.addDataSourceProperty("PWD", settings.getAccessToken());
        hikari.setConnectionTimeout(properties.getConnectionTimeout().toMillis());
        hikari.setMaximumPoolSize(settings.getMaxPoolSize() != null && settings.getMaxPoolSize() > 0
                ? settings.getMaxPoolSize()
                : properties.getMaxConnectionsPerSource());
        hikari.setMinimumIdle(1);
        hikari.setPoolName("Pool-" + getType().getValue() + "-" + config.getId());
        return hikari;
    }

    static String jdbcUrl(DatabricksSettings settings) {
        StringBuilder url = new StringBuilder("jdbc:databricks://")
                .append(settings.getServerHostname()).append(':').append(settings.getPort())
                .append("/default;transportMode=http;ssl=1;AuthMech=3")
                .append(";httpPath=").append(settings.getHttpPath());
        if (settings.getCatalog() != null && !settings.getCatalog().isBlank()) {
            url.append(";ConnCatalog=").append(settings.getCatalog());
        }
        if (settings.getSchema() != null && !settings.getSchema().isBlank()) {
            url.append(";ConnSchema=").append(settings.getSchema());
        }
        return url.toString();
    }

    private void requireSetting(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new ConnectionException("Databricks " + name + " is required for data source '" + config.getId() + "'");
        }
    }

    @Override
    protected Connection borrowConnection() throws SQLException {
        HikariDataSource ds = dataSource;
        if (ds == null || ds.isClosed()) {
            throw new SQLException("Databricks connection pool is closed");
        }
        return ds.getConnection();
    }

    @Override
    protected void doClose() {
        HikariDataSource ds = dataSource;
        dataSource = null;
        if (ds != null) {
            ds.close();
        }
    }

    @Override
    protected SchemaInfo readSchema(Connection connection) throws SQLException {
        DatabaseMetaData md = connection.getMetaData();
        String catalog = settings.getCatalog() != null && !settings.getCatalog().isBlank()
                ? settings.getCatalog()
                : connection.getCatalog();
        String schemaPattern = settings.getSchema() != null && !settings.getSchema().isBlank()
                ? settings.getSchema()
                : null;

        List<String> schemas = new ArrayList<>();
        try (ResultSet rs = md.getSchemas(catalog, schemaPattern)) {
            while (rs.next()) {
                String schema = rs.getString("TABLE_SCHEM");
                if (schema != null && !"information_schema".equalsIgnoreCase(schema)) {
                    schemas.add(schema);
                }
            }
        }

        List<DatabaseInfo> databases = new ArrayList<>();
        for (String schema : schemas) {
            List<String> tableNames = new ArrayList<>();
            try (ResultSet rs = md.getTables(catalog, schema, "%", new String[]{"TABLE", "VIEW"})) {
                while (rs.next()) {
                    tableNames.add(rs.getString("TABLE_NAME"));
                }
            }

            List<TableInfo> tables = new ArrayList<>();
            for (String table : tableNames) {
                List<ColumnMetadata> columns = new ArrayList<>();
                try (ResultSet rs = md.getColumns(catalog, schema, table, "%")) {
                    while (rs.next()) {
                        String typeName = rs.getString("TYPE_NAME");
                        String remarks = rs.getString("REMARKS");
                        columns.add(ColumnMetadata.builder()
                                .name(rs.getString("COLUMN_NAME"))
                                .type(getTypeMapping().map(typeName))
                                .nullable(!"NO".equalsIgnoreCase(rs.getString("IS_NULLABLE")))
                                .description(remarks != null && !remarks.isBlank() ? remarks : typeName + " column")
                                .build());
                    }
                }
                tables.add(new TableInfo(table, columns));
            }
            databases.add(new DatabaseInfo(schema, tables));
        }
        return new SchemaInfo(databases);
    }

    @Override
    protected Map<String, Object> healthDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        HikariDataSource ds = dataSource;
        details.put("serverHostname", settings.getServerHostname());
        details.put("clientConnected", ds != null && !ds.isClosed());
        if (ds != null && !ds.isClosed()) {
            HikariPoolMXBean pool = ds.getHikariPoolMXBean();
            if (pool != null) {
                details.put("activeConnections", pool.getActiveConnections());
                details.put("idleConnections", pool.getIdleConnections());
                details.put("totalConnections", pool.getTotalConnections());
            }
        }
        return details;
    }
}
