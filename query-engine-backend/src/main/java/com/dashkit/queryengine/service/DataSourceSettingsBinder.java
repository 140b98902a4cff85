package com.dashkit.queryengine.service;

import com.dashkit.queryengine.api.RegisterDataSourceRequest;
import com.dashkit.queryengine.exception.ValidationException;
import com.dashkit.queryengine.model.ConnectionConfig;
import com.dashkit.queryengine.model.DataSourceSettings;
import com.dashkit.queryengine.model.DataSourceStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Turns a loosely typed data source definition into a {@link ConnectionConfig} whose settings
 * object matches the declared type.
 */
@Component
public class DataSourceSettingsBinder {

    private final ObjectMapper objectMapper;

    public DataSourceSettingsBinder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ConnectionConfig bind(RegisterDataSourceRequest request) {
        if (request.getType() == null) {
            throw new ValidationException("Data source type is required");
        }
        Map<String, Object> raw = request.getConfig() != null ? request.getConfig() : Map.of();
        DataSourceSettings settings;
        try {
            settings = objectMapper.convertValue(raw, request.getType().getSettingsType());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid config for " + request.getType().getDisplayName()
                    + " data source '" + request.getId() + "': " + e.getMessage());
        }
        return ConnectionConfig.builder()
                .id(request.getId())
                .tenantId(request.getTenantId())
                .type(request.getType())
                .name(request.getName() != null ? request.getName() : request.getId())
                .description(request.getDescription())
                .config(settings)
                .status(DataSourceStatus.INACTIVE)
                .build();
    }
}
