package com.dashkit.queryengine.cache;

import com.dashkit.queryengine.config.QueryEngineProperties;
import com.dashkit.queryengine.exception.CacheException;
import com.dashkit.queryengine.model.CacheStats;
import com.dashkit.queryengine.model.QueryResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.PatternSyntaxException;

/**
 * In-process {@link QueryCache} backed by Caffeine.
 *
 * <p>Entries carry their own TTL and are weighed by their serialized JSON size, so
 * {@code query-engine.cache-max-memory} bounds the cache the way a memory cap bounds a cache
 * server. Expired entries are never returned, even before Caffeine's maintenance evicts them.
 */
public class CaffeineQueryCache implements QueryCache {

    private static final Logger log = LoggerFactory.getLogger(CaffeineQueryCache.class);

    private final Cache<String, Entry> cache;
    private final CacheKeyGenerator keyGenerator;
    private final ObjectMapper objectMapper;
    private final long defaultTtlSeconds;

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong sets = new AtomicLong();

    public CaffeineQueryCache(QueryEngineProperties properties, ObjectMapper objectMapper, Ticker ticker) {
        this.objectMapper = objectMapper;
        this.keyGenerator = new CacheKeyGenerator(objectMapper);
        this.defaultTtlSeconds = Math.max(properties.getCacheDefaultTtl().getSeconds(), 1);
        this.cache = Caffeine.newBuilder()
                .maximumWeight(Math.max(properties.getCacheMaxMemory().toBytes(), 1))
                .weigher((String key, Entry entry) -> entry.weight)
                .expireAfter(new PerEntryTtl())
                .ticker(ticker)
                .build();
        log.info("Query cache initialized: maxMemory={}, defaultTtl={}s",
                properties.getCacheMaxMemory(), defaultTtlSeconds);
    }

    private static final class Entry {
        private final QueryResult result;
        private final long ttlNanos;
        private final int weight;

        private Entry(QueryResult result, long ttlNanos, int weight) {
            this.result = result;
            this.ttlNanos = ttlNanos;
            this.weight = weight;
        }
    }

    private static final class PerEntryTtl implements Expiry<String, Entry> {
        @Override
        public long expireAfterCreate(String key, Entry entry, long currentTime) {
            return entry.ttlNanos;
        }

        @Override
        public long expireAfterUpdate(String key, Entry entry, long currentTime, long currentDuration) {
            return entry.ttlNanos;
        }

        @Override
        public long expireAfterRead(String key, Entry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }

    @Override
    public String generateKey(String tenantId, String dataSourceId, String sql, Map<String, Object> parameters) {
        return keyGenerator.generate(tenantId, dataSourceId, sql, parameters);
    }

    @Override
    public Optional<QueryResult> get(String key) {
        Entry entry;
        try {
            entry = cache.getIfPresent(key);
        } catch (RuntimeException e) {
            throw new CacheException("Cache read failed for key " + key, e);
        }
        if (entry == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        hits.incrementAndGet();
        QueryResult stored = entry.result;
        return Optional.of(stored.withCacheHit(stored.getMetadata().getExecutionTime()));
    }

    @Override
    public void set(String key, QueryResult result, long ttlSeconds) {
        long ttl = ttlSeconds > 0 ? ttlSeconds : defaultTtlSeconds;
        try {
            int weight = objectMapper.writeValueAsBytes(result).length;
            cache.put(key, new Entry(result, TimeUnit.SECONDS.toNanos(ttl), weight));
            sets.incrementAndGet();
            log.debug("Cached result: key={}, ttl_seconds={}, bytes={}", key, ttl, weight);
        } catch (JsonProcessingException | RuntimeException e) {
            throw new CacheException("Cache write failed for key " + key, e);
        }
    }

    @Override
    public long invalidatePattern(String pattern) {
        GlobPattern glob;
        try {
            glob = GlobPattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            throw new CacheException("Invalid invalidation pattern: " + pattern, e);
        }
        List<String> matching = new ArrayList<>();
        for (String key : cache.asMap().keySet()) {
            if (glob.matches(key)) {
                matching.add(key);
            }
        }
        long removed = 0;
        for (String key : matching) {
            if (cache.asMap().remove(key) != null) {
                removed++;
            }
        }
        log.info("Invalidated cache entries: pattern={}, removed={}", pattern, removed);
        return removed;
    }

    @Override
    public long invalidateTenant(String tenantId) {
        return invalidatePattern(keyGenerator.tenantPattern(tenantId));
    }

    @Override
    public long invalidateDataSource(String dataSourceId) {
        return invalidatePattern(keyGenerator.dataSourcePattern(dataSourceId));
    }

    @Override
    public void clear() {
        cache.invalidateAll();
        log.info("Query cache cleared");
    }

    @Override
    public CacheStats stats() {
        cache.cleanUp();
        long memoryUsed = cache.policy().eviction()
                .map(eviction -> eviction.weightedSize().orElse(0L))
                .orElse(0L);
        return CacheStats.builder()
                .hits(hits.get())
                .misses(misses.get())
                .sets(sets.get())
                .entries(cache.estimatedSize())
                .memoryUsed(memoryUsed)
                .build();
    }

    @Override
    public boolean healthCheck() {
        try {
            cache.cleanUp();
            return true;
        } catch (RuntimeException e) {
            log.error("Cache health check failed", e);
            return false;
        }
    }
}
