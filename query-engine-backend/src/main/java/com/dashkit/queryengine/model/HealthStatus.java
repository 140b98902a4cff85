package com.dashkit.queryengine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Value;

import java.time.OffsetDateTime;
import java.util.Locale;
import java.util.Map;

@Value
public class HealthStatus {
    State status;
    Map<String, Object> details;
    OffsetDateTime lastChecked;

    public enum State {
        HEALTHY,
        UNHEALTHY;

        @JsonValue
        public String getValue() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public static HealthStatus healthy(Map<String, Object> details) {
        return new HealthStatus(State.HEALTHY, details, OffsetDateTime.now());
    }

    public static HealthStatus unhealthy(Map<String, Object> details) {
        return new HealthStatus(State.UNHEALTHY, details, OffsetDateTime.now());
    }

    public static HealthStatus of(boolean healthy, Map<String, Object> details) {
        return healthy ? healthy(details) : unhealthy(details);
    }

    @JsonIgnore
    public boolean isHealthy() {
        return status == State.HEALTHY;
    }
}
