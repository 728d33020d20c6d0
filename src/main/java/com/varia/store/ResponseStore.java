package com.varia.store;

import com.varia.model.Candidate;
import com.varia.model.InvalidationResult;
import com.varia.model.OriginResponse;
import com.varia.model.RequestKey;
import com.varia.model.ResponseMetadata;
import com.varia.model.StoredResponse;
import com.varia.model.UrlDigest;
import com.varia.model.VaryHeaders;

import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for cached HTTP responses.
 *
 * For one request key (method, URL, body and bucket) there may be several responses that
 * differ by {@code vary} headers or by content range. Each of them is a candidate: the store
 * lists them all, the selector picks the one matching the request, and only then the store
 * loads its body. Stores may evict at any time; references handed out earlier can stop
 * resolving and that is not an error.
 *
 * Implementations must be safe for concurrent readers and writers and must return every
 * {@link ResponseMetadata} exactly as it was stored.
 *
 * @param <R> opaque response reference type, never interpreted outside the store
 */
public interface ResponseStore<R> {

    /**
     * Short store name used in logs and errors.
     */
    String name();

    /**
     * Every response stored under {@code key}, stale and expired ones included.
     *
     * @return the candidates, empty for an unknown key
     */
    List<Candidate<R>> listCandidates(RequestKey key, StoreOptions options);

    /**
     * Load a response from a reference returned by {@link #listCandidates}.
     *
     * @return the response, or empty if it was evicted or invalidated meanwhile
     */
    Optional<StoredResponse> getResponse(R ref, StoreOptions options);

    /**
     * Store a response as an additional candidate for {@code key}. Other candidates under
     * the same key are kept. The response is indexed under {@code urlDigest} and under each
     * of the metadata's alternate keys.
     *
     * @throws ResponseStoreException if the store fails
     */
    void put(RequestKey key, UrlDigest urlDigest, VaryHeaders varyHeaders, OriginResponse response,
             ResponseMetadata metadata, StoreOptions options);

    /**
     * Hint that a response was served, e.g. to refresh its LRU position. May be dropped.
     *
     * @throws ResponseStoreException if the store fails
     */
    void notifyUsed(R ref, StoreOptions options);

    /**
     * Make every response stored for a URL unselectable from the moment this method returns.
     *
     * @throws ResponseStoreException if the store fails
     */
    InvalidationResult invalidateUrl(UrlDigest urlDigest, StoreOptions options);

    /**
     * Capability query for invalidation by alternate key.
     *
     * @return the capability, or empty if this store does not index alternate keys
     */
    default Optional<AlternateKeyInvalidation> alternateKeyInvalidation() {
        return Optional.empty();
    }
}
