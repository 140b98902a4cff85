package com.dashkit.queryengine.connector;

import com.dashkit.queryengine.exception.ConnectionException;
import com.dashkit.queryengine.model.ConnectionConfig;
import com.dashkit.queryengine.model.ConnectorResult;
import com.dashkit.queryengine.model.DataSourceType;
import com.dashkit.queryengine.model.HealthStatus;
import com.dashkit.queryengine.model.QueryExecutionContext;
import com.dashkit.queryengine.model.SchemaInfo;
import com.dashkit.queryengine.model.ValidationResult;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Placeholder for recognized backends that have no driver integration yet.
 * Every operation that would reach the backend fails with a {@link ConnectionException}.
 */
public class UnimplementedConnector implements Connector {

    private final ConnectionConfig config;

    public UnimplementedConnector(ConnectionConfig config) {
        this.config = config;
    }

    @Override
    public DataSourceType getType() {
        return config.getType();
    }

    @Override
    public ConnectionConfig getConfig() {
        return config;
    }

    private ConnectionException notImplemented() {
        return new ConnectionException(getType().getDisplayName() + " connector not yet implemented");
    }

    @Override
    public void connect() {
        throw notImplemented();
    }

    @Override
    public boolean isConnected() {
        return false;
    }

    @Override
    public boolean testConnection() {
        return false;
    }

    @Override
    public ConnectorResult executeQuery(String sql, QueryExecutionContext context) {
        throw notImplemented();
    }

    @Override
    public SchemaInfo getSchema() {
        throw notImplemented();
    }

    @Override
    public ValidationResult validateQuery(String sql) {
        return ValidationResult.invalid(notImplemented().getMessage());
    }

    @Override
    public HealthStatus getHealth() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("connected", false);
        details.put("error", notImplemented().getMessage());
        return HealthStatus.unhealthy(details);
    }

    @Override
    public void close() {
        // nothing to release
    }
}
