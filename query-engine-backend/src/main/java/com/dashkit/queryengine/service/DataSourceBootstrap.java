package com.dashkit.queryengine.service;

import com.dashkit.queryengine.api.RegisterDataSourceRequest;
import com.dashkit.queryengine.config.QueryEngineProperties;
import com.dashkit.queryengine.model.ConnectionConfig;
import com.dashkit.queryengine.model.DataSourcesFile;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Registers the data sources listed in {@code query-engine.data-sources-file} at startup.
 * A broken entry is logged and skipped so one bad backend cannot keep the service down.
 */
@Component
public class DataSourceBootstrap {

    private static final Logger log = LoggerFactory.getLogger(DataSourceBootstrap.class);

    private final QueryService queryService;
    private final DataSourceSettingsBinder settingsBinder;
    private final QueryEngineProperties properties;
    private final ObjectMapper objectMapper;

    public DataSourceBootstrap(QueryService queryService,
                               DataSourceSettingsBinder settingsBinder,
                               QueryEngineProperties properties,
                               ObjectMapper objectMapper) {
        this.queryService = queryService;
        this.settingsBinder = settingsBinder;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        String file = properties.getDataSourcesFile();
        if (file == null || file.isBlank()) {
            return;
        }
        Path path = Paths.get(file);
        if (!Files.exists(path)) {
            log.warn("Data sources file not found: {}", path.toAbsolutePath());
            return;
        }

        DataSourcesFile definitions;
        try {
            definitions = load(path);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to read data sources file: {}", path, e);
            return;
        }

        int registered = 0;
        for (Map<String, Object> entry : definitions.getDataSources()) {
            if (register(entry)) {
                registered++;
            }
        }
        log.info("Registered {} of {} data sources from {}", registered, definitions.getDataSources().size(), path);
    }

    DataSourcesFile load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            DataSourcesFile loaded = new Yaml().loadAs(in, DataSourcesFile.class);
            if (loaded == null || loaded.getDataSources() == null) {
                return new DataSourcesFile();
            }
            return loaded;
        }
    }

    private boolean register(Map<String, Object> entry) {
        Object id = entry != null ? entry.get("id") : null;
        try {
            RegisterDataSourceRequest request = objectMapper.convertValue(entry, RegisterDataSourceRequest.class);
            ConnectionConfig config = settingsBinder.bind(request);
            queryService.registerDataSource(request.getId(), config);
            return true;
        } catch (RuntimeException e) {
            log.error("Skipping data source from file: data_source_id={}, error={}", id, e.getMessage());
            return false;
        }
    }
}
