package com.dashkit.queryengine.model;

import lombok.Value;

import java.util.List;
import java.util.Optional;

/**
 * Databases (schemas) to tables to columns, as enumerated by a connector.
 */
@Value
public class SchemaInfo {
    List<DatabaseInfo> databases;

    public Optional<TableInfo> findTable(String database, String table) {
        return databases.stream()
                .filter(db -> db.getName().equalsIgnoreCase(database))
                .flatMap(db -> db.getTables().stream())
                .filter(t -> t.getName().equalsIgnoreCase(table))
                .findFirst();
    }
}
