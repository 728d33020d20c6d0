package com.varia.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Lookup counters of the response cache since startup.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CacheStatistics {

    /**
     * Name of the active store (memory, redis).
     */
    private String store;

    /**
     * Lookups answered with a fresh response.
     */
    private long freshHits;

    /**
     * Lookups answered with a stale-but-servable response.
     */
    private long staleHits;

    /**
     * Lookups with no usable response.
     */
    private long misses;

    /**
     * Candidates that disappeared between listing and fetching.
     */
    private long evictedDuringLookup;

    /**
     * Responses handed to the store.
     */
    private long stores;

    /**
     * Cache hit rate (0.0-1.0), stale hits included.
     */
    private double hitRate;

    /**
     * Whether the store supports invalidation by alternate key.
     */
    private boolean alternateKeysSupported;
}
