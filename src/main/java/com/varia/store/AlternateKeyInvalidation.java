package com.varia.store;

import com.varia.model.AlternateKey;
import com.varia.model.InvalidationResult;

import java.util.Collection;

/**
 * Optional store capability: invalidating every response tagged with one of a set of
 * alternate keys. Stores expose it through {@link ResponseStore#alternateKeyInvalidation()}.
 */
public interface AlternateKeyInvalidation {

    /**
     * Make every response tagged with at least one of {@code keys} unselectable.
     *
     * @throws ResponseStoreException if the store fails
     */
    InvalidationResult invalidateByAlternateKey(Collection<AlternateKey> keys, StoreOptions options);
}
