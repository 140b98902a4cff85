package com.dashkit.queryengine.api;

import com.dashkit.queryengine.model.DataSourceType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Data source definition as received over HTTP or read from the startup YAML file.
 * {@link #config} is bound to the settings class of {@link #type}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisterDataSourceRequest {
    @NotBlank(message = "Data source ID is required")
    private String id;

    private String tenantId;

    @NotNull(message = "Data source type is required")
    private DataSourceType type;

    @NotBlank(message = "Data source name is required")
    private String name;

    private String description;

    @Builder.Default
    private Map<String, Object> config = new LinkedHashMap<>();
}
