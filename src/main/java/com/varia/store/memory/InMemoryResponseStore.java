package com.varia.store.memory;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.varia.model.AlternateKey;
import com.varia.model.Candidate;
import com.varia.model.HttpHeader;
import com.varia.model.InvalidationResult;
import com.varia.model.OriginResponse;
import com.varia.model.RequestKey;
import com.varia.model.ResponseBody;
import com.varia.model.ResponseMetadata;
import com.varia.model.StoredResponse;
import com.varia.model.UrlDigest;
import com.varia.model.VaryHeaders;
import com.varia.store.AlternateKeyInvalidation;
import com.varia.store.ResponseStore;
import com.varia.store.StoreOptions;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-process store backed by a size bounded Caffeine cache.
 *
 * Responses live in a single Caffeine map keyed by a random {@link UUID}; each entry holds
 * headers, body and metadata together, so removing it is one atomic step and a reader sees
 * either the whole response or nothing. Request key, URL and alternate key indexes point at
 * those UUIDs and are cleaned up by the removal listener, whatever the removal cause.
 * Listing skips index members whose entry is already gone.
 */
@Slf4j
public class InMemoryResponseStore implements ResponseStore<UUID>, AlternateKeyInvalidation {

    private static final String NAME = "memory";

    private final Cache<UUID, Entry> entries;
    private final ConcurrentMap<RequestKey, Set<UUID>> byRequestKey = new ConcurrentHashMap<>();
    private final ConcurrentMap<UrlDigest, Set<UUID>> byUrl = new ConcurrentHashMap<>();
    private final ConcurrentMap<AlternateKey, Set<UUID>> byAlternateKey = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryResponseStore(long maximumSize, Clock clock, Executor executor) {
        this.clock = clock;
        this.entries = Caffeine.newBuilder()
                .maximumSize(maximumSize)
                .executor(executor)
                .removalListener((UUID ref, Entry entry, RemovalCause cause) -> {
                    if (ref != null && entry != null) {
                        unindex(ref, entry);
                        log.debug("Removed response {} from memory store, cause={}", ref, cause);
                    }
                })
                .recordStats()
                .build();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Candidate<UUID>> listCandidates(RequestKey key, StoreOptions options) {
        Set<UUID> refs = byRequestKey.get(key);
        if (refs == null) {
            return List.of();
        }

        List<Candidate<UUID>> candidates = new ArrayList<>(refs.size());
        for (UUID ref : List.copyOf(refs)) {
            // Listing must not count as a use for the eviction policy
            Entry entry = entries.policy().getIfPresentQuietly(ref);
            if (entry != null) {
                candidates.add(entry.toCandidate(ref));
            }
        }
        return candidates;
    }

    @Override
    public Optional<StoredResponse> getResponse(UUID ref, StoreOptions options) {
        Entry entry = entries.getIfPresent(ref);
        if (entry == null) {
            log.debug("Response {} no longer in memory store", ref);
            return Optional.empty();
        }
        return Optional.of(entry.toStoredResponse());
    }

    @Override
    public void put(RequestKey key, UrlDigest urlDigest, VaryHeaders varyHeaders, OriginResponse response,
                    ResponseMetadata metadata, StoreOptions options) {
        UUID ref = UUID.randomUUID();
        // Copied: the caller keeps its array
        Entry entry = new Entry(key, urlDigest, varyHeaders, response.getStatus(), response.getHeaders(),
                response.getBody().clone(), metadata, new AtomicReference<>(clock.instant()));

        entries.put(ref, entry);
        addTo(byRequestKey, key, ref);
        addTo(byUrl, urlDigest, ref);
        for (AlternateKey alternateKey : metadata.getAlternateKeys()) {
            addTo(byAlternateKey, alternateKey, ref);
        }

        log.debug("Stored response {} under key={}, vary={}", ref, key, varyHeaders);
    }

    @Override
    public void notifyUsed(UUID ref, StoreOptions options) {
        // A regular read refreshes the entry for the eviction policy
        Entry entry = entries.getIfPresent(ref);
        if (entry != null) {
            entry.getLastUsed().set(clock.instant());
        }
    }

    @Override
    public InvalidationResult invalidateUrl(UrlDigest urlDigest, StoreOptions options) {
        Set<UUID> refs = byUrl.remove(urlDigest);
        long removed = refs == null ? 0 : removeAll(refs);
        log.debug("Invalidated {} responses for url digest {}", removed, urlDigest);
        return InvalidationResult.counted(removed);
    }

    @Override
    public InvalidationResult invalidateByAlternateKey(Collection<AlternateKey> keys, StoreOptions options) {
        Set<UUID> refs = new HashSet<>();
        for (AlternateKey key : keys) {
            Set<UUID> tagged = byAlternateKey.remove(key);
            if (tagged != null) {
                refs.addAll(tagged);
            }
        }
        long removed = removeAll(refs);
        log.debug("Invalidated {} responses for alternate keys {}", removed, keys);
        return InvalidationResult.counted(removed);
    }

    @Override
    public Optional<AlternateKeyInvalidation> alternateKeyInvalidation() {
        return Optional.of(this);
    }

    /**
     * Approximate number of stored responses.
     */
    public long estimatedSize() {
        return entries.estimatedSize();
    }

    /**
     * When a response was stored or last reported as used.
     */
    public Optional<Instant> lastUsed(UUID ref) {
        return Optional.ofNullable(entries.policy().getIfPresentQuietly(ref))
                .map(entry -> entry.getLastUsed().get());
    }

    private long removeAll(Collection<UUID> refs) {
        long removed = 0;
        for (UUID ref : refs) {
            if (entries.asMap().remove(ref) != null) {
                removed++;
            }
        }
        return removed;
    }

    private void unindex(UUID ref, Entry entry) {
        removeFrom(byRequestKey, entry.getRequestKey(), ref);
        removeFrom(byUrl, entry.getUrlDigest(), ref);
        for (AlternateKey alternateKey : entry.getMetadata().getAlternateKeys()) {
            removeFrom(byAlternateKey, alternateKey, ref);
        }
    }

    private static <K> void addTo(ConcurrentMap<K, Set<UUID>> index, K key, UUID ref) {
        index.compute(key, (k, refs) -> {
            Set<UUID> updated = refs == null ? ConcurrentHashMap.newKeySet() : refs;
            updated.add(ref);
            return updated;
        });
    }

    private static <K> void removeFrom(ConcurrentMap<K, Set<UUID>> index, K key, UUID ref) {
        index.computeIfPresent(key, (k, refs) -> {
            refs.remove(ref);
            return refs.isEmpty() ? null : refs;
        });
    }

    @Value
    private static class Entry {
        RequestKey requestKey;
        UrlDigest urlDigest;
        VaryHeaders varyHeaders;
        int status;
        List<HttpHeader> headers;
        byte[] body;
        ResponseMetadata metadata;
        AtomicReference<Instant> lastUsed;

        Candidate<UUID> toCandidate(UUID ref) {
            return Candidate.<UUID>builder()
                    .ref(ref)
                    .status(status)
                    .headers(headers)
                    .varyHeaders(varyHeaders)
                    .metadata(metadata)
                    .build();
        }

        StoredResponse toStoredResponse() {
            return StoredResponse.builder()
                    .status(status)
                    .headers(headers)
                    .body(ResponseBody.ofBytes(body))
                    .metadata(metadata)
                    .build();
        }
    }
}
