package com.dashkit.queryengine.config;

import com.dashkit.queryengine.cache.CaffeineQueryCache;
import com.dashkit.queryengine.cache.QueryCache;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Ticker;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class QueryEngineConfiguration {

    /**
     * Runs backend calls for all connectors so callers can stop waiting on timeout, and runs
     * health checks in parallel.
     */
    @Bean(name = "connectorExecutor", destroyMethod = "shutdownNow")
    public ExecutorService connectorExecutor() {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = runnable -> {
            Thread t = new Thread(runnable, "query-engine-connector-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        return Executors.newCachedThreadPool(factory);
    }

    @Bean
    public QueryCache queryCache(QueryEngineProperties properties, ObjectMapper objectMapper) {
        return new CaffeineQueryCache(properties, objectMapper, Ticker.systemTicker());
    }
}
