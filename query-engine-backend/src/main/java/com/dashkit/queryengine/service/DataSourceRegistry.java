package com.dashkit.queryengine.service;

import com.dashkit.queryengine.connector.Connector;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live connectors keyed by data source id. Lookups are lock-free; callers serialize
 * registration and removal themselves.
 */
@Component
public class DataSourceRegistry {

    private final Map<String, Connector> connectors = new ConcurrentHashMap<>();

    public Optional<Connector> get(String dataSourceId) {
        if (dataSourceId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(connectors.get(dataSourceId));
    }

    /**
     * @return connector previously registered under the id, if any
     */
    public Optional<Connector> put(String dataSourceId, Connector connector) {
        return Optional.ofNullable(connectors.put(dataSourceId, connector));
    }

    public Optional<Connector> remove(String dataSourceId) {
        return Optional.ofNullable(connectors.remove(dataSourceId));
    }

    /**
     * Point-in-time copy ordered by id.
     */
    public Map<String, Connector> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(new TreeMap<>(connectors)));
    }

    public int size() {
        return connectors.size();
    }
}
