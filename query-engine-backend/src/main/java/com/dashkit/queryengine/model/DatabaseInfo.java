package com.dashkit.queryengine.model;

import lombok.Value;

import java.util.List;

@Value
public class DatabaseInfo {
    String name;
    List<TableInfo> tables;
}
