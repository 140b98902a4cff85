package com.dashkit.queryengine.connector;

import com.dashkit.queryengine.exception.ConnectionException;
import com.dashkit.queryengine.exception.QueryExecutionException;
import com.dashkit.queryengine.exception.ValidationException;
import com.dashkit.queryengine.model.ColumnMetadata;
import com.dashkit.queryengine.model.ColumnType;
import com.dashkit.queryengine.model.ConnectionConfig;
import com.dashkit.queryengine.model.DatabaseInfo;
import com.dashkit.queryengine.model.DuckDbSettings;
import com.dashkit.queryengine.model.SchemaInfo;
import com.dashkit.queryengine.model.TableInfo;
import com.dashkit.queryengine.model.TableLoad;
import lombok.Builder;
import lombok.Value;
import org.duckdb.DuckDBConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ExecutorService;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Embedded DuckDB connector.
 *
 * <p>One root connection owns the database; every operation works on a
 * {@link DuckDBConnection#duplicate() duplicate} of it, so an in-memory database is shared by
 * all callers while statements still run concurrently.
 */
public class DuckDbConnector extends AbstractJdbcConnector {

    private static final Logger log = LoggerFactory.getLogger(DuckDbConnector.class);

    static final ColumnTypeMapping TYPE_MAPPING = ColumnTypeMapping.builder()
            .map(ColumnType.ARRAY, "[]", "LIST")
            .map(ColumnType.OBJECT, "STRUCT", "MAP", "UNION")
            .map(ColumnType.STRING, "INTERVAL")
            .map(ColumnType.TIMESTAMP, "TIMESTAMP")
            .map(ColumnType.DECIMAL, "DECIMAL", "NUMERIC")
            .map(ColumnType.FLOAT, "DOUBLE", "REAL", "FLOAT")
            .map(ColumnType.INTEGER, "INT")
            .map(ColumnType.BOOLEAN, "BOOL")
            .map(ColumnType.DATE, "DATE")
            .map(ColumnType.TIME, "TIME")
            .map(ColumnType.JSON, "JSON")
            .map(ColumnType.BINARY, "BLOB", "BYTEA")
            .build();

    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern COLUMN_TYPE = Pattern.compile("[A-Za-z][A-Za-z0-9_(), \\[\\]]*");

    private final DuckDbSettings settings;
    private volatile Connection root;

    public DuckDbConnector(ConnectionConfig config, ExecutorService executor) {
        super(config, TYPE_MAPPING, executor);
        this.settings = config.getConfig() instanceof DuckDbSettings duck ? duck : new DuckDbSettings();
    }

    /**
     * CSV reader options; {@code columns} pins column types and turns off sniffing.
     */
    @Value
    @Builder
    public static class CsvOptions {
        @Builder.Default
        String delimiter = ",";
        @Builder.Default
        boolean header = true;
        int skipRows;
        @Builder.Default
        Map<String, String> columns = Map.of();

        static CsvOptions defaults() {
            return CsvOptions.builder().build();
        }
    }

    @Override
    protected void doConnect() throws SQLException {
        Properties props = new Properties();
        if (settings.isReadOnly() && !settings.isInMemory()) {
            props.setProperty("duckdb.read_only", "true");
        }
        String url = settings.isInMemory() ? "jdbc:duckdb:" : "jdbc:duckdb:" + settings.getDatabasePath();
        root = DriverManager.getConnection(url, props);

        try (Statement stmt = root.createStatement()) {
            for (String extension : settings.getExtensions()) {
                String name = requireIdentifier(extension, "extension");
                stmt.execute("INSTALL " + name);
                stmt.execute("LOAD " + name);
            }
            for (Map.Entry<String, Object> setting : settings.getSettings().entrySet()) {
                String key = requireIdentifier(setting.getKey(), "setting");
                stmt.execute("SET " + key + " = " + literal(setting.getValue()));
            }
        }

        for (TableLoad load : settings.getLoads()) {
            applyLoad(load);
        }
        log.info("DuckDB database opened: id={}, path={}, readOnly={}, loads={}",
                config.getId(), settings.isInMemory() ? DuckDbSettings.IN_MEMORY : settings.getDatabasePath(),
                settings.isReadOnly(), settings.getLoads().size());
    }

    @Override
    protected Connection borrowConnection() throws SQLException {
        Connection current = root;
        if (current == null) {
            throw new SQLException("DuckDB connection is closed");
        }
        return current.unwrap(DuckDBConnection.class).duplicate();
    }

    @Override
    protected void doClose() throws SQLException {
        Connection current = root;
        root = null;
        if (current != null) {
            current.close();
        }
    }

    @Override
    protected SchemaInfo readSchema(Connection connection) throws SQLException {
        String sql = "SELECT table_schema, table_name, column_name, data_type, is_nullable "
                + "FROM information_schema.columns "
                + "WHERE table_schema NOT IN (?, ?) "
                + "ORDER BY table_schema, table_name, ordinal_position";

        Map<String, Map<String, List<ColumnMetadata>>> bySchema = new LinkedHashMap<>();
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            ps.setString(1, "information_schema");
            ps.setString(2, "pg_catalog");
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String dataType = rs.getString("data_type");
                    bySchema.computeIfAbsent(rs.getString("table_schema"), k -> new LinkedHashMap<>())
                            .computeIfAbsent(rs.getString("table_name"), k -> new ArrayList<>())
                            .add(ColumnMetadata.builder()
                                    .name(rs.getString("column_name"))
                                    .type(getTypeMapping().map(dataType))
                                    .nullable("YES".equalsIgnoreCase(rs.getString("is_nullable")))
                                    .description(dataType + " column")
                                    .build());
                }
            }
        }

        List<DatabaseInfo> databases = bySchema.entrySet().stream()
                .map(schema -> new DatabaseInfo(schema.getKey(), schema.getValue().entrySet().stream()
                        .map(table -> new TableInfo(table.getKey(), List.copyOf(table.getValue())))
                        .collect(Collectors.toList())))
                .collect(Collectors.toList());
        return new SchemaInfo(databases);
    }

    @Override
    protected Map<String, Object> healthDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("databasePath", settings.isInMemory() ? DuckDbSettings.IN_MEMORY : settings.getDatabasePath());
        details.put("readOnly", settings.isReadOnly());
        details.put("extensions", List.copyOf(settings.getExtensions()));
        return details;
    }

    /**
     * Materializes a configured file into a table.
     *
     * @param load table, format and path
     */
    public void applyLoad(TableLoad load) {
        if (load.getFormat() == null) {
            throw new ValidationException("Load for table '" + load.getTable() + "' has no format");
        }
        switch (load.getFormat()) {
            case CSV:
                loadCsv(load.getTable(), load.getPath(), CsvOptions.builder()
                        .delimiter(load.getDelimiter())
                        .header(load.isHeader())
                        .skipRows(load.getSkipRows())
                        .columns(load.getColumns() != null ? load.getColumns() : Map.of())
                        .build());
                break;
            case JSON:
                loadJson(load.getTable(), load.getPath());
                break;
            case PARQUET:
                loadParquet(load.getTable(), load.getPath());
                break;
            default:
                throw new ValidationException("Unsupported load format: " + load.getFormat());
        }
    }

    public void loadCsv(String tableName, String csvPath) {
        loadCsv(tableName, csvPath, CsvOptions.defaults());
    }

    public void loadCsv(String tableName, String csvPath, CsvOptions options) {
        StringBuilder args = new StringBuilder(quote(requirePath(csvPath)))
                .append(", delim=").append(quote(options.getDelimiter() != null ? options.getDelimiter() : ","))
                .append(", header=").append(options.isHeader())
                .append(", skip=").append(Math.max(options.getSkipRows(), 0));
        String reader = "read_csv_auto";
        if (!options.getColumns().isEmpty()) {
            reader = "read_csv";
            args.append(", columns={");
            boolean first = true;
            for (Map.Entry<String, String> column : options.getColumns().entrySet()) {
                if (!COLUMN_TYPE.matcher(column.getValue()).matches()) {
                    throw new ValidationException("Invalid column type for '" + column.getKey() + "': " + column.getValue());
                }
                if (!first) {
                    args.append(", ");
                }
                args.append(quote(column.getKey())).append(": ").append(quote(column.getValue()));
                first = false;
            }
            args.append('}');
        }
        createTableAs(tableName, reader + "(" + args + ")", csvPath);
    }

    public void loadJson(String tableName, String jsonPath) {
        createTableAs(tableName, "read_json_auto(" + quote(requirePath(jsonPath)) + ")", jsonPath);
    }

    public void loadParquet(String tableName, String parquetPath) {
        createTableAs(tableName, "read_parquet(" + quote(requirePath(parquetPath)) + ")", parquetPath);
    }

    private void createTableAs(String tableName, String source, String path) {
        String table = quoteTableName(tableName);
        String sql = "CREATE OR REPLACE TABLE " + table + " AS SELECT * FROM " + source;
        try (Connection conn = borrowConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
            log.info("Loaded table: data_source_id={}, table={}, path={}", config.getId(), tableName, path);
        } catch (SQLException e) {
            throw new QueryExecutionException("Failed to load '" + path + "' into table " + tableName + ": " + e.getMessage(), e);
        }
    }

    private static String quoteTableName(String tableName) {
        if (tableName == null || !TABLE_NAME.matcher(tableName).matches()) {
            throw new ValidationException("Invalid table name: " + tableName);
        }
        return "\"" + tableName.replace(".", "\".\"") + "\"";
    }

    private static String requireIdentifier(String value, String kind) {
        if (value == null || !IDENTIFIER.matcher(value).matches()) {
            throw new ConnectionException("Invalid DuckDB " + kind + " name: " + value);
        }
        return value;
    }

    private static String requirePath(String path) {
        if (path == null || path.isBlank()) {
            throw new ValidationException("File path is required");
        }
        return path;
    }

    private static String quote(String value) {
        return "'" + value.replace("'", "''") + "'";
    }

    private static String literal(Object value) {
        if (value instanceof Number || value instanceof Boolean) {
            return String.valueOf(value);
        }
        return quote(String.valueOf(value));
    }
}
