package com.varia.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.OptionalLong;

/**
 * Successful outcome of a store invalidation. Failures are raised as exceptions.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class InvalidationResult {

    private static final InvalidationResult UNCOUNTED = new InvalidationResult(null);

    Long invalidatedCount;

    public static InvalidationResult counted(long invalidatedCount) {
        if (invalidatedCount < 0) {
            throw new IllegalArgumentException("Negative invalidation count: " + invalidatedCount);
        }
        return new InvalidationResult(invalidatedCount);
    }

    /**
     * For stores that cannot tell how many responses were affected.
     */
    public static InvalidationResult uncounted() {
        return UNCOUNTED;
    }

    public OptionalLong count() {
        return invalidatedCount == null ? OptionalLong.empty() : OptionalLong.of(invalidatedCount);
    }
}
