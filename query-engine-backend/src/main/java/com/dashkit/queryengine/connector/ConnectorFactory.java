package com.dashkit.queryengine.connector;

import com.dashkit.queryengine.config.QueryEngineProperties;
import com.dashkit.queryengine.exception.ValidationException;
import com.dashkit.queryengine.model.ConnectionConfig;
import com.dashkit.queryengine.model.DatabricksSettings;
import com.dashkit.queryengine.model.DuckDbSettings;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;

/**
 * Builds an unconnected {@link Connector} for a data source definition.
 */
@Component
public class ConnectorFactory {

    private final QueryEngineProperties properties;
    private final ExecutorService executor;

    public ConnectorFactory(QueryEngineProperties properties,
                            @Qualifier("connectorExecutor") ExecutorService executor) {
        this.properties = properties;
        this.executor = executor;
    }

    public Connector create(ConnectionConfig config) {
        if (config == null || config.getType() == null) {
            throw new ValidationException("Data source type is required");
        }
        if (config.getConfig() != null && !config.getType().getSettingsType().isInstance(config.getConfig())) {
            throw new ValidationException("Config for " + config.getType().getDisplayName()
                    + " data source must be " + config.getType().getSettingsType().getSimpleName());
        }

        switch (config.getType()) {
            case DUCKDB:
                if (config.getConfig() == null) {
                    config.setConfig(new DuckDbSettings());
                }
                return new DuckDbConnector(config, executor);
            case DATABRICKS:
                if (!(config.getConfig() instanceof DatabricksSettings)) {
                    throw new ValidationException("Databricks data source requires a config block");
                }
                return new DatabricksConnector(config, properties, executor);
            case BIGQUERY:
            case SNOWFLAKE:
            case POSTGRESQL:
            case MYSQL:
                return new UnimplementedConnector(config);
            default:
                throw new ValidationException("Unsupported data source type: " + config.getType());
        }
    }
}
