package com.dashkit.queryengine.connector;

import com.dashkit.queryengine.model.ConnectionConfig;
import com.dashkit.queryengine.model.ConnectorResult;
import com.dashkit.queryengine.model.DataSourceType;
import com.dashkit.queryengine.model.HealthStatus;
import com.dashkit.queryengine.model.QueryExecutionContext;
import com.dashkit.queryengine.model.SchemaInfo;
import com.dashkit.queryengine.model.ValidationResult;

/**
 * Uniform contract over one analytical backend.
 *
 * <p>Implementations must be safe for concurrent {@link #executeQuery} calls once connected.
 * {@link #connect()} is idempotent and {@link #close()} never throws. A closed connector stays
 * closed: every later operation fails instead of opening a new session.
 */
public interface Connector extends AutoCloseable {

    DataSourceType getType();

    ConnectionConfig getConfig();

    /**
     * Establishes the backend session or pool. Calling it on a connected connector is a no-op.
     *
     * @throws com.dashkit.queryengine.exception.ConnectionException if the backend is unreachable,
     *         the settings are unusable or the connector was closed
     */
    void connect();

    boolean isConnected();

    /**
     * Cheap round trip ({@code SELECT 1}). Connects first when needed.
     *
     * @return false on any failure; never throws
     */
    boolean testConnection();

    /**
     * Runs a single read statement.
     *
     * @param sql statement, optionally holding {@code $name} placeholders
     * @param context parameters, row limit and timeout
     * @return rows, column metadata and metrics
     * @throws com.dashkit.queryengine.exception.QueryExecutionException if the backend rejects
     *         the query or the timeout elapses
     */
    ConnectorResult executeQuery(String sql, QueryExecutionContext context);

    SchemaInfo getSchema();

    /**
     * Asks the backend to plan the statement without running it.
     *
     * @param sql statement to check
     * @return invalid result carrying the backend message instead of throwing
     */
    ValidationResult validateQuery(String sql);

    HealthStatus getHealth();

    @Override
    void close();
}
