package com.dashkit.queryengine.connector;

import com.dashkit.queryengine.exception.ConnectionException;
import com.dashkit.queryengine.exception.QueryEngineException;
import com.dashkit.queryengine.exception.QueryExecutionException;
import com.dashkit.queryengine.model.ColumnMetadata;
import com.dashkit.queryengine.model.ColumnType;
import com.dashkit.queryengine.model.ConnectionConfig;
import com.dashkit.queryengine.model.ConnectorResult;
import com.dashkit.queryengine.model.DataSourceType;
import com.dashkit.queryengine.model.HealthStatus;
import com.dashkit.queryengine.model.QueryExecutionContext;
import com.dashkit.queryengine.model.QueryMetrics;
import com.dashkit.queryengine.model.SchemaInfo;
import com.dashkit.queryengine.model.ValidationResult;
import com.dashkit.queryengine.util.JdbcValues;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Shared plumbing for connectors that speak JDBC.
 *
 * <p>Subclasses supply the session lifecycle ({@link #doConnect()}, {@link #borrowConnection()},
 * {@link #doClose()}) plus schema enumeration; this class owns statement execution, result
 * materialization, timeouts and health reporting.
 *
 * <p>Queries run on the shared connector executor so the caller can stop waiting when the
 * timeout elapses. On timeout the running statement is cancelled and the borrowed connection is
 * closed by the worker once the driver gives control back.
 */
@Slf4j
public abstract class AbstractJdbcConnector implements Connector {

    private static final String TEST_SQL = "SELECT 1";

    protected final ConnectionConfig config;
    private final ColumnTypeMapping typeMapping;
    private final ExecutorService executor;
    private final Object lifecycleLock = new Object();
    private volatile boolean connected;
    private volatile boolean closed;

    protected AbstractJdbcConnector(ConnectionConfig config, ColumnTypeMapping typeMapping, ExecutorService executor) {
        this.config = config;
        this.typeMapping = typeMapping;
        this.executor = executor;
    }

    protected abstract void doConnect() throws SQLException;

    /**
     * @return a connection the caller closes when done
     */
    protected abstract Connection borrowConnection() throws SQLException;

    protected abstract void doClose() throws Exception;

    protected abstract SchemaInfo readSchema(Connection connection) throws SQLException;

    /**
     * Backend-specific fields for {@link HealthStatus#getDetails()}.
     */
    protected Map<String, Object> healthDetails() {
        return new LinkedHashMap<>();
    }

    protected String explainPrefix() {
        return "EXPLAIN ";
    }

    @Override
    public DataSourceType getType() {
        return config.getType();
    }

    @Override
    public ConnectionConfig getConfig() {
        return config;
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    protected ColumnTypeMapping getTypeMapping() {
        return typeMapping;
    }

    @Override
    public void connect() {
        synchronized (lifecycleLock) {
            if (closed) {
                throw new ConnectionException(getType().getDisplayName() + " data source '"
                        + config.getId() + "' is closed");
            }
            if (connected) {
                return;
            }
            try {
                doConnect();
                connected = true;
                log.info("Connected data source: id={}, type={}", config.getId(), getType());
            } catch (SQLException | RuntimeException e) {
                releaseAfterFailedConnect();
                if (e instanceof ConnectionException ce) {
                    throw ce;
                }
                throw new ConnectionException("Failed to connect to " + getType().getDisplayName()
                        + " data source '" + config.getId() + "': " + e.getMessage(), e);
            }
        }
    }

    private void releaseAfterFailedConnect() {
        try {
            doClose();
        } catch (Exception closeError) {
            log.warn("Cleanup after failed connect raised: id={}, error={}", config.getId(), closeError.getMessage());
        }
    }

    protected void ensureConnected() {
        if (!connected) {
            connect();
        }
    }

    @Override
    public boolean testConnection() {
        try {
            ensureConnected();
            try (Connection conn = borrowConnection();
                 Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery(TEST_SQL)) {
                return rs.next();
            }
        } catch (Exception e) {
            log.warn("Connection test failed: id={}, type={}, error={}", config.getId(), getType(), e.getMessage());
            return false;
        }
    }

    @Override
    public ConnectorResult executeQuery(String sql, QueryExecutionContext context) {
        QueryExecutionContext ctx = context != null ? context : QueryExecutionContext.empty();
        long start = System.currentTimeMillis();
        ensureConnected();

        String statement = SqlStatements.requireSingleStatement(sql);
        SqlStatements.BoundSql bound = SqlStatements.bindNamedParameters(statement, ctx.getParameters());
        log.debug("Executing query: data_source_id={}, parameters={}", config.getId(), bound.getValues().size());

        AtomicReference<Statement> running = new AtomicReference<>();
        Future<ConnectorResult> future = executor.submit(() -> runQuery(bound, ctx.getMaxRows(), running, start));
        try {
            return ctx.getTimeoutMs() > 0
                    ? future.get(ctx.getTimeoutMs(), TimeUnit.MILLISECONDS)
                    : future.get();
        } catch (TimeoutException e) {
            cancel(running.get());
            future.cancel(true);
            log.warn("Query timed out: data_source_id={}, timeout_ms={}", config.getId(), ctx.getTimeoutMs());
            throw QueryExecutionException.timeout(ctx.getTimeoutMs(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel(running.get());
            future.cancel(true);
            throw new QueryExecutionException("Query interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof QueryEngineException qe) {
                throw qe;
            }
            throw new QueryExecutionException(getType().getDisplayName() + " query failed: " + cause.getMessage(), cause);
        }
    }

    private ConnectorResult runQuery(SqlStatements.BoundSql bound, int maxRows,
                                     AtomicReference<Statement> running, long start) throws SQLException {
        try (Connection conn = borrowConnection()) {
            if (bound.hasParameters()) {
                try (PreparedStatement ps = conn.prepareStatement(bound.getSql())) {
                    running.set(ps);
                    List<Object> values = bound.getValues();
                    for (int i = 0; i < values.size(); i++) {
                        ps.setObject(i + 1, values.get(i));
                    }
                    boolean hasResultSet = ps.execute();
                    return collect(ps, hasResultSet, maxRows, start);
                }
            }
            // For parameter-less queries, prefer Statement over PreparedStatement
            try (Statement stmt = conn.createStatement()) {
                running.set(stmt);
                boolean hasResultSet = stmt.execute(bound.getSql());
                return collect(stmt, hasResultSet, maxRows, start);
            }
        }
    }

    private ConnectorResult collect(Statement stmt, boolean hasResultSet, int maxRows, long start) throws SQLException {
        if (!hasResultSet) {
            int updateCount = stmt.getUpdateCount();
            return ConnectorResult.builder()
                    .rows(List.of())
                    .columns(List.of())
                    .metrics(QueryMetrics.builder()
                            .executionTime(System.currentTimeMillis() - start)
                            .rowsReturned(0)
                            .dataScanned(Math.max(updateCount, 0))
                            .build())
                    .build();
        }
        try (ResultSet rs = stmt.getResultSet()) {
            return readResult(rs, maxRows, start);
        }
    }

    /**
     * Materializes a result set into rows keyed by column label.
     */
    protected ConnectorResult readResult(ResultSet rs, int maxRows, long start) throws SQLException {
        ResultSetMetaData md = rs.getMetaData();
        int columnCount = md.getColumnCount();

        String[] labels = new String[columnCount];
        for (int i = 1; i <= columnCount; i++) {
            String label = md.getColumnLabel(i);
            labels[i - 1] = label != null && !label.isBlank() ? label : md.getColumnName(i);
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        Object[] firstRow = null;
        boolean truncated = false;
        while (rs.next()) {
            if (maxRows > 0 && rows.size() >= maxRows) {
                truncated = true;
                break;
            }
            Map<String, Object> row = new LinkedHashMap<>();
            Object[] raw = firstRow == null ? new Object[columnCount] : null;
            for (int i = 1; i <= columnCount; i++) {
                Object value = rs.getObject(i);
                if (raw != null) {
                    raw[i - 1] = value;
                }
                row.put(labels[i - 1], JdbcValues.toJsonSafe(value));
            }
            if (raw != null) {
                firstRow = raw;
            }
            rows.add(row);
        }

        List<ColumnMetadata> columns = new ArrayList<>(columnCount);
        for (int i = 1; i <= columnCount; i++) {
            columns.add(ColumnMetadata.builder()
                    .name(labels[i - 1])
                    .type(columnType(md.getColumnTypeName(i), firstRow != null ? firstRow[i - 1] : null))
                    .nullable(md.isNullable(i) != ResultSetMetaData.columnNoNulls)
                    .build());
        }

        return ConnectorResult.builder()
                .rows(rows)
                .columns(columns)
                .metrics(QueryMetrics.builder()
                        .executionTime(System.currentTimeMillis() - start)
                        .rowsReturned(rows.size())
                        .dataScanned(0)
                        .truncated(truncated)
                        .build())
                .build();
    }

    private ColumnType columnType(String nativeType, Object sample) {
        if (nativeType == null || nativeType.isBlank()) {
            return ColumnTypeInference.infer(sample);
        }
        return typeMapping.map(nativeType);
    }

    private void cancel(Statement statement) {
        if (statement == null) {
            return;
        }
        try {
            statement.cancel();
        } catch (SQLException e) {
            log.warn("Failed to cancel statement: data_source_id={}, error={}", config.getId(), e.getMessage());
        }
    }

    @Override
    public SchemaInfo getSchema() {
        ensureConnected();
        try (Connection conn = borrowConnection()) {
            return readSchema(conn);
        } catch (SQLException e) {
            throw new QueryExecutionException("Failed to get schema: " + e.getMessage(), e);
        }
    }

    @Override
    public ValidationResult validateQuery(String sql) {
        String statement;
        try {
            ensureConnected();
            statement = SqlStatements.requireSingleStatement(sql);
        } catch (QueryEngineException e) {
            return ValidationResult.invalid(e.getMessage());
        }
        try (Connection conn = borrowConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(explainPrefix() + statement);
            return ValidationResult.ok();
        } catch (SQLException e) {
            return ValidationResult.invalid(e.getMessage());
        }
    }

    @Override
    public HealthStatus getHealth() {
        Map<String, Object> details = new LinkedHashMap<>();
        try {
            boolean ok = testConnection();
            details.putAll(healthDetails());
            details.put("connected", connected);
            return HealthStatus.of(ok, details);
        } catch (RuntimeException e) {
            details.put("connected", false);
            details.put("error", e.getMessage());
            return HealthStatus.unhealthy(details);
        }
    }

    @Override
    public void close() {
        synchronized (lifecycleLock) {
            closed = true;
            try {
                doClose();
                if (connected) {
                    log.info("Closed data source: id={}, type={}", config.getId(), getType());
                }
            } catch (Exception e) {
                log.error("Error closing data source: id={}", config.getId(), e);
            } finally {
                connected = false;
            }
        }
    }
}
