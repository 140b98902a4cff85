package com.dashkit.queryengine.model;

/**
 * Backend-specific connection settings.
 *
 * <p>Each {@link DataSourceType} has exactly one implementation; the owning
 * {@link ConnectionConfig} selects the variant through its {@code type} property.
 */
public interface DataSourceSettings {

    /**
     * Copy of these settings safe to expose over the API or in logs.
     *
     * @return settings with secrets masked
     */
    DataSourceSettings redacted();
}
