package com.varia.store;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Options passed through to a store on every call.
 *
 * Only stores look inside; the selector and the facade hand them over untouched.
 */
@Value
@Builder
public class StoreOptions {

    public static final StoreOptions NONE = StoreOptions.builder().build();

    /**
     * Upper bound for one store call, {@code null} for the store's default. The Redis store
     * fails the call with a {@link ResponseStoreException} once it elapses; the in-memory
     * store does no blocking I/O and ignores it.
     */
    Duration timeout;

    /**
     * Settings for custom stores. The built-in stores define none.
     */
    @Singular
    Map<String, Object> attributes;

    public Optional<Duration> timeout() {
        return Optional.ofNullable(timeout);
    }

    public Optional<Object> attribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }
}
