package com.varia.service;

import com.varia.model.AlternateKey;
import com.varia.model.InvalidationResult;
import com.varia.model.UrlDigest;
import com.varia.store.AlternateKeyInvalidation;
import com.varia.store.ResponseStore;
import com.varia.store.ResponseStoreException;
import com.varia.store.StoreOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Optional;

/**
 * Runs invalidations against a store and reports them as {@link InvalidationOutcome}s.
 *
 * Alternate key support is checked before calling the store, so a store without it
 * reports {@link InvalidationOutcome.Status#UNSUPPORTED} rather than a failure. Store
 * failures are reported as {@link InvalidationOutcome.Status#FAILED} and are not retried.
 */
@Slf4j
@Service
public class InvalidationCoordinator {

    public InvalidationOutcome invalidateUrl(ResponseStore<?> store, UrlDigest urlDigest, StoreOptions options) {
        try {
            InvalidationResult result = store.invalidateUrl(urlDigest, options);
            log.info("Invalidated url digest {} in {} store: count={}", urlDigest, store.name(),
                    result.count().isPresent() ? result.count().getAsLong() : "unknown");
            return InvalidationOutcome.invalidated(result.count());
        } catch (ResponseStoreException e) {
            log.error("Failed to invalidate url digest {} in {} store", urlDigest, store.name(), e);
            return InvalidationOutcome.failed(e.getMessage());
        }
    }

    public InvalidationOutcome invalidateByAlternateKeys(ResponseStore<?> store, Collection<AlternateKey> keys,
                                                         StoreOptions options) {
        Optional<AlternateKeyInvalidation> capability = store.alternateKeyInvalidation();
        if (capability.isEmpty()) {
            log.warn("Store {} does not support invalidation by alternate key, keys={}", store.name(), keys);
            return InvalidationOutcome.unsupported(
                    "Store '" + store.name() + "' does not support invalidation by alternate key");
        }

        try {
            InvalidationResult result = capability.get().invalidateByAlternateKey(keys, options);
            log.info("Invalidated alternate keys {} in {} store: count={}", keys, store.name(),
                    result.count().isPresent() ? result.count().getAsLong() : "unknown");
            return InvalidationOutcome.invalidated(result.count());
        } catch (ResponseStoreException e) {
            log.error("Failed to invalidate alternate keys {} in {} store", keys, store.name(), e);
            return InvalidationOutcome.failed(e.getMessage());
        }
    }
}
