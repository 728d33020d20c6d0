package com.varia.service;

import com.varia.config.VariaProperties;
import com.varia.model.AlternateKey;
import com.varia.model.CacheRequest;
import com.varia.model.OriginResponse;
import com.varia.model.RequestKey;
import com.varia.model.ResponseMetadata;
import com.varia.model.UrlDigest;
import com.varia.model.VaryHeaders;
import com.varia.model.dto.CacheStatistics;
import com.varia.service.canonicalization.RequestKeyGenerator;
import com.varia.service.selection.CandidateSelector;
import com.varia.service.selection.ResolvedResponse;
import com.varia.service.selection.Selection;
import com.varia.store.ResponseStore;
import com.varia.store.StoreOptions;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.LongAdder;

/**
 * Entry point for proxies and clients: look up, store and invalidate responses.
 *
 * Flow of a lookup:
 * 1. Derive the request key from method, URL, body and bucket
 * 2. Let the {@link CandidateSelector} pick the matching variant
 * 3. Tell the store the response was used, asynchronously
 *
 * Store failures propagate to the caller; they are never turned into misses.
 *
 * @param <R> reference type of the underlying store
 */
@Slf4j
public class HttpResponseCache<R> {

    private final ResponseStore<R> store;
    private final CandidateSelector selector;
    private final InvalidationCoordinator invalidationCoordinator;
    private final MetadataValidator metadataValidator;
    private final RequestKeyGenerator keyGenerator;
    private final VariaProperties properties;
    private final Executor notifyExecutor;

    private final LongAdder freshHits = new LongAdder();
    private final LongAdder staleHits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder evictedDuringLookup = new LongAdder();
    private final LongAdder stores = new LongAdder();

    public HttpResponseCache(
            ResponseStore<R> store,
            CandidateSelector selector,
            InvalidationCoordinator invalidationCoordinator,
            MetadataValidator metadataValidator,
            RequestKeyGenerator keyGenerator,
            VariaProperties properties,
            Executor notifyExecutor) {
        this.store = store;
        this.selector = selector;
        this.invalidationCoordinator = invalidationCoordinator;
        this.metadataValidator = metadataValidator;
        this.keyGenerator = keyGenerator;
        this.properties = properties;
        this.notifyExecutor = notifyExecutor;
    }

    public CacheLookup<R> lookup(CacheRequest request) {
        return lookup(request, StoreOptions.NONE);
    }

    /**
     * Find the stored response answering {@code request}.
     *
     * @return a fresh hit, a stale hit to revalidate, or a miss
     */
    public CacheLookup<R> lookup(CacheRequest request, StoreOptions options) {
        long startTime = System.nanoTime();
        RequestKey key = keyGenerator.requestKey(request);

        Selection<R> selection = selector.resolve(
                store, key, request.varyValues(), request.range().orElse(null), options);
        evictedDuringLookup.add(selection.getEvicted());
        long latencyMs = (System.nanoTime() - startTime) / 1_000_000;

        if (!selection.isHit()) {
            misses.increment();
            log.debug("Cache MISS in {}ms: {} {} ({} candidates, {} eligible, {} evicted)",
                    latencyMs, request.getMethod(), request.getUrl(),
                    selection.getListed(), selection.getEligible(), selection.getEvicted());
            return CacheLookup.miss(latencyMs);
        }

        ResolvedResponse<R> resolved = selection.getResolved();
        CacheLookup<R> lookup = CacheLookup.hit(resolved, latencyMs);
        if (lookup.needsRevalidation()) {
            staleHits.increment();
        } else {
            freshHits.increment();
        }
        log.debug("Cache HIT ({}) in {}ms: {} {}", resolved.getFreshness(), latencyMs,
                request.getMethod(), request.getUrl());

        if (properties.getNotify().isEnabled()) {
            notifyUsed(resolved.getRef(), options);
        }
        return lookup;
    }

    public boolean store(CacheRequest request, OriginResponse response, ResponseMetadata metadata) {
        return store(request, response, metadata, StoreOptions.NONE);
    }

    /**
     * Store a response received for {@code request}.
     *
     * The request's values of the headers named by the response's {@code vary} header are
     * recorded for later matching.
     *
     * @return {@code false} if the response varies on {@code *} and was not stored
     * @throws InvalidMetadataException if the metadata timestamps are out of order
     * @throws com.varia.store.ResponseStoreException if the store fails
     */
    public boolean store(CacheRequest request, OriginResponse response, ResponseMetadata metadata,
                         StoreOptions options) {
        metadataValidator.validate(metadata);

        if (response.variesOnEverything()) {
            log.debug("Not storing response for {} {}: vary *", request.getMethod(), request.getUrl());
            return false;
        }

        VaryHeaders varyHeaders = VaryHeaders.fromRequest(response.varyHeaderNames(), request.getHeaders());
        store.put(keyGenerator.requestKey(request), keyGenerator.urlDigest(request.getUrl()),
                varyHeaders, response, metadata, options);
        stores.increment();
        return true;
    }

    /**
     * Tell the store a response was served. Runs asynchronously; a failure completes the
     * returned future exceptionally and is logged, it never affects a lookup.
     */
    public CompletableFuture<Void> notifyUsed(R ref, StoreOptions options) {
        return CompletableFuture.runAsync(() -> store.notifyUsed(ref, options), notifyExecutor)
                .whenComplete((ignored, e) -> {
                    if (e != null) {
                        log.warn("Failed to notify {} store that response {} was used", store.name(), ref, e);
                    }
                });
    }

    public InvalidationOutcome invalidateUrl(String url) {
        return invalidateUrl(keyGenerator.urlDigest(url), StoreOptions.NONE);
    }

    public InvalidationOutcome invalidateUrl(UrlDigest urlDigest, StoreOptions options) {
        return invalidationCoordinator.invalidateUrl(store, urlDigest, options);
    }

    public InvalidationOutcome invalidateByAlternateKeys(Collection<AlternateKey> keys) {
        return invalidateByAlternateKeys(keys, StoreOptions.NONE);
    }

    public InvalidationOutcome invalidateByAlternateKeys(Collection<AlternateKey> keys, StoreOptions options) {
        return invalidationCoordinator.invalidateByAlternateKeys(store, keys, options);
    }

    public CacheStatistics getStatistics() {
        long fresh = freshHits.sum();
        long stale = staleHits.sum();
        long missed = misses.sum();
        long lookups = fresh + stale + missed;

        return CacheStatistics.builder()
                .store(store.name())
                .freshHits(fresh)
                .staleHits(stale)
                .misses(missed)
                .evictedDuringLookup(evictedDuringLookup.sum())
                .stores(stores.sum())
                .hitRate(lookups == 0 ? 0.0 : (double) (fresh + stale) / lookups)
                .alternateKeysSupported(store.alternateKeyInvalidation().isPresent())
                .build();
    }

    public ResponseStore<R> getStore() {
        return store;
    }
}
