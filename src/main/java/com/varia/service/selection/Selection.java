package com.varia.service.selection;

import lombok.Builder;
import lombok.Value;

import java.util.Optional;

/**
 * Outcome of one candidate resolution, hit or miss, with the counts behind it.
 */
@Value
@Builder
public class Selection<R> {

    /**
     * {@code null} when no usable response was found.
     */
    ResolvedResponse<R> resolved;

    /**
     * Candidates the store listed for the request key.
     */
    int listed;

    /**
     * Candidates left after vary, range and freshness filtering.
     */
    int eligible;

    /**
     * Eligible candidates that were gone when their body was fetched.
     */
    int evicted;

    public static <R> Selection<R> none(int listed, int eligible, int evicted) {
        return Selection.<R>builder().listed(listed).eligible(eligible).evicted(evicted).build();
    }

    public Optional<ResolvedResponse<R>> response() {
        return Optional.ofNullable(resolved);
    }

    public boolean isHit() {
        return resolved != null;
    }
}
