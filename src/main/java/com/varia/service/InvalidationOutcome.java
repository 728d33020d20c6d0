package com.varia.service;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.OptionalLong;

/**
 * Uniform result of an invalidation request, whatever the store.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class InvalidationOutcome {

    Status status;

    /**
     * Responses invalidated, {@code null} if the store cannot tell or the call did not succeed.
     */
    Long invalidatedCount;

    /**
     * Why the call failed or is unsupported, {@code null} on success.
     */
    String reason;

    public static InvalidationOutcome invalidated(OptionalLong count) {
        return new InvalidationOutcome(Status.INVALIDATED,
                count.isPresent() ? count.getAsLong() : null, null);
    }

    public static InvalidationOutcome unsupported(String reason) {
        return new InvalidationOutcome(Status.UNSUPPORTED, null, reason);
    }

    public static InvalidationOutcome failed(String reason) {
        return new InvalidationOutcome(Status.FAILED, null, reason);
    }

    public OptionalLong count() {
        return invalidatedCount == null ? OptionalLong.empty() : OptionalLong.of(invalidatedCount);
    }

    public boolean isInvalidated() {
        return status == Status.INVALIDATED;
    }

    public enum Status {
        /**
         * The store accepted the invalidation.
         */
        INVALIDATED,

        /**
         * The store lacks the capability; nothing was attempted.
         */
        UNSUPPORTED,

        /**
         * The store failed.
         */
        FAILED
    }
}
