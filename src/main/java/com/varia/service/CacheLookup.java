package com.varia.service;

import com.varia.model.Freshness;
import com.varia.model.StoredResponse;
import com.varia.service.selection.ResolvedResponse;
import lombok.Builder;
import lombok.Value;

import java.util.Optional;

/**
 * Result of a cache lookup.
 */
@Value
@Builder
public class CacheLookup<R> {

    LookupStatus status;

    /**
     * Store reference of the response served, {@code null} on a miss.
     */
    R ref;

    /**
     * {@code null} on a miss.
     */
    StoredResponse response;

    long latencyMs;

    public static <R> CacheLookup<R> miss(long latencyMs) {
        return CacheLookup.<R>builder().status(LookupStatus.MISS).latencyMs(latencyMs).build();
    }

    public static <R> CacheLookup<R> hit(ResolvedResponse<R> resolved, long latencyMs) {
        return CacheLookup.<R>builder()
                .status(resolved.getFreshness() == Freshness.FRESH ? LookupStatus.FRESH_HIT : LookupStatus.STALE_HIT)
                .ref(resolved.getRef())
                .response(resolved.getResponse())
                .latencyMs(latencyMs)
                .build();
    }

    public Optional<StoredResponse> response() {
        return Optional.ofNullable(response);
    }

    public boolean isHit() {
        return status != LookupStatus.MISS;
    }

    /**
     * A stale hit should be revalidated with the origin in the background.
     */
    public boolean needsRevalidation() {
        return status == LookupStatus.STALE_HIT;
    }

    public enum LookupStatus {
        FRESH_HIT,
        STALE_HIT,
        MISS
    }
}
