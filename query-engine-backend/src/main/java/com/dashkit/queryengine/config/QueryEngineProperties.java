package com.dashkit.queryengine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.util.unit.DataSize;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Tunables under the {@code query-engine} prefix.
 *
 * <p>Durations accept Spring's duration syntax ({@code 30s}, {@code 500ms}); bare numbers are
 * read in the unit noted on each field.
 */
@Data
@ConfigurationProperties(prefix = "query-engine")
public class QueryEngineProperties {

    /**
     * TTL for cached results when a request does not set one. Bare numbers are seconds.
     */
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration cacheDefaultTtl = Duration.ofHours(1);

    /**
     * Upper bound on the serialized size of all cached results.
     */
    private DataSize cacheMaxMemory = DataSize.ofMegabytes(512);

    /**
     * Default backend timeout per query. Bare numbers are milliseconds.
     */
    private Duration queryTimeout = Duration.ofSeconds(30);

    private int maxQueryLength = 50_000;

    private int maxResultRows = 10_000;

    private int maxConnectionsPerSource = 10;

    /**
     * Pool checkout / connect timeout for pooled connectors. Bare numbers are milliseconds.
     */
    private Duration connectionTimeout = Duration.ofSeconds(10);

    /**
     * Per-source bound for health checks. Bare numbers are milliseconds.
     */
    private Duration healthCheckTimeout = Duration.ofSeconds(10);

    /**
     * YAML file of data sources registered at startup. Missing file means none.
     */
    private String dataSourcesFile = "data-sources.yml";

    /**
     * Allowed browser origins, comma separated; {@code *} allows any origin.
     */
    private String corsOrigin = "*";

    /**
     * Requests allowed per client address within {@link #rateLimitWindow}; 0 disables the limit.
     */
    private int rateLimitMaxRequests = 1000;

    /**
     * Fixed window for {@link #rateLimitMaxRequests}. Bare numbers are milliseconds.
     */
    private Duration rateLimitWindow = Duration.ofMinutes(15);
}
