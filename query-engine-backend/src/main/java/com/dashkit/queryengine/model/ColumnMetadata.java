package com.dashkit.queryengine.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ColumnMetadata {
    String name;
    ColumnType type;
    boolean nullable;
    String description;
}
