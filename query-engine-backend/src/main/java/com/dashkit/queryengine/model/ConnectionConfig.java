package com.dashkit.queryengine.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * Identity and shape of a registered data source.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionConfig {
    private String id;
    private String tenantId;

    @NotNull(message = "Data source type is required")
    private DataSourceType type;

    @NotBlank(message = "Data source name is required")
    private String name;

    private String description;

    /**
     * Variant matching {@link #type}; see {@link DataSourceType#getSettingsType()}.
     */
    private DataSourceSettings config;

    @Builder.Default
    private DataSourceStatus status = DataSourceStatus.INACTIVE;

    private OffsetDateTime lastTestedAt;

    /**
     * Copy with backend secrets masked.
     *
     * @return redacted copy
     */
    public ConnectionConfig redacted() {
        return toBuilder().config(config != null ? config.redacted() : null).build();
    }
}
