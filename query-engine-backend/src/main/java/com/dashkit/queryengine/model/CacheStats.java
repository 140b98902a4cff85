package com.dashkit.queryengine.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CacheStats {
    long hits;
    long misses;
    long sets;
    long entries;
    /**
     * Approximate bytes held by cached results (serialized size).
     */
    long memoryUsed;

    public String getMemoryUsedHuman() {
        return Math.round(memoryUsed / 1024.0 / 1024.0) + "MB";
    }
}
