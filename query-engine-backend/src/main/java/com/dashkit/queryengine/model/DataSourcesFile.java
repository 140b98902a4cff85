package com.dashkit.queryengine.model;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Root of the startup data sources YAML file. Entries stay untyped until bound per type.
 */
@Data
public class DataSourcesFile {
    private List<Map<String, Object>> dataSources = new ArrayList<>();
}
