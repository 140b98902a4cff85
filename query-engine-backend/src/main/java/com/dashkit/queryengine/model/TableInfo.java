package com.dashkit.queryengine.model;

import lombok.Value;

import java.util.List;

@Value
public class TableInfo {
    String name;
    List<ColumnMetadata> columns;
}
