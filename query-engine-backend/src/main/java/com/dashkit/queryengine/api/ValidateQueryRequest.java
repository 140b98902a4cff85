package com.dashkit.queryengine.api;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ValidateQueryRequest {
    @NotBlank(message = "Data source ID is required")
    private String dataSourceId;

    @NotBlank(message = "SQL is required")
    private String sql;
}
