package com.dashkit.queryengine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DatabricksSettings implements DataSourceSettings {
    private String serverHostname;
    private String httpPath;
    private String accessToken;
    private String catalog;
    private String schema;
    @Builder.Default
    private int port = 443;
    /**
     * Overrides {@code query-engine.max-connections-per-source} for this source.
     */
    private Integer maxPoolSize;

    @Override
    public DatabricksSettings redacted() {
        return toBuilder().accessToken(accessToken != null ? "****" : null).build();
    }
}
