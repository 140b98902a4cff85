package com.dashkit.queryengine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DuckDbSettings implements DataSourceSettings {
    public static final String IN_MEMORY = ":memory:";

    @Builder.Default
    private String databasePath = IN_MEMORY;
    @Builder.Default
    private boolean readOnly = false;
    @Builder.Default
    private List<String> extensions = new ArrayList<>();
    @Builder.Default
    private Map<String, Object> settings = new LinkedHashMap<>();
    @Builder.Default
    private List<TableLoad> loads = new ArrayList<>();

    public boolean isInMemory() {
        return databasePath == null || databasePath.isBlank() || IN_MEMORY.equals(databasePath);
    }

    @Override
    public DuckDbSettings redacted() {
        return this;
    }
}
