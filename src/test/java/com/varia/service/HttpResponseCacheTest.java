package com.varia.service;

import com.varia.config.VariaProperties;
import com.varia.model.AlternateKey;
import com.varia.model.CacheRequest;
import com.varia.model.ContentRange;
import com.varia.model.HttpHeader;
import com.varia.model.OriginResponse;
import com.varia.model.ResponseMetadata;
import com.varia.model.StoredResponse;
import com.varia.model.dto.CacheStatistics;
import com.varia.service.canonicalization.RequestKeyGenerator;
import com.varia.service.selection.CandidateSelector;
import com.varia.store.ResponseStore;
import com.varia.store.ResponseStoreException;
import com.varia.store.StoreOptions;
import com.varia.store.memory.InMemoryResponseStore;
import com.varia.support.FakeResponseStore;
import com.varia.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for HttpResponseCache, backed by the in-memory store.
 */
class HttpResponseCacheTest {

    private static final String URL = "https://example.com/products/42";

    private MutableClock clock;
    private VariaProperties properties;
    private InMemoryResponseStore store;
    private HttpResponseCache<UUID> cache;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpochSecond(1_000);
        properties = new VariaProperties();
        store = new InMemoryResponseStore(1_000, clock, Runnable::run);
        cache = newCache(store);
    }

    @Test
    void testMissWhenEmpty() {
        CacheLookup<UUID> lookup = cache.lookup(request(Map.of()));

        assertFalse(lookup.isHit());
        assertEquals(CacheLookup.LookupStatus.MISS, lookup.getStatus());
        assertTrue(lookup.response().isEmpty());
    }

    @Test
    void testStoreThenLookup() throws Exception {
        assertTrue(cache.store(request(Map.of()), origin("hello"), metadata()));

        CacheLookup<UUID> lookup = cache.lookup(request(Map.of()));

        assertEquals(CacheLookup.LookupStatus.FRESH_HIT, lookup.getStatus());
        assertNotNull(lookup.getRef());
        assertEquals("hello", body(lookup.getResponse()));
        assertEquals(200, lookup.getResponse().getStatus());
    }

    @Test
    void testVaryVariantsAreSelectedByRequestHeaders() throws Exception {
        OriginResponse gzip = origin("gzip body", HttpHeader.of("Vary", "Accept-Encoding"));
        OriginResponse identity = origin("plain body", HttpHeader.of("Vary", "Accept-Encoding"));
        cache.store(request(Map.of("Accept-Encoding", List.of("gzip"))), gzip, metadata());
        cache.store(request(Map.of()), identity, metadata());

        assertEquals("gzip body",
                body(cache.lookup(request(Map.of("accept-encoding", List.of("gzip")))).getResponse()));
        assertEquals("plain body", body(cache.lookup(request(Map.of())).getResponse()));
        assertFalse(cache.lookup(request(Map.of("accept-encoding", List.of("br")))).isHit());
    }

    @Test
    void testNewerVariantWins() throws Exception {
        cache.store(request(Map.of()), origin("old"), metadata());
        clock.advance(Duration.ofSeconds(10));
        cache.store(request(Map.of()), origin("new"), metadata());

        assertEquals("new", body(cache.lookup(request(Map.of())).getResponse()));
    }

    @Test
    void testStaleHitNeedsRevalidation() {
        cache.store(request(Map.of()), origin("hello"), metadata());
        clock.setEpochSecond(1_150);

        CacheLookup<UUID> lookup = cache.lookup(request(Map.of()));

        assertEquals(CacheLookup.LookupStatus.STALE_HIT, lookup.getStatus());
        assertTrue(lookup.needsRevalidation());
    }

    @Test
    void testExpiredIsMiss() {
        cache.store(request(Map.of()), origin("hello"), metadata());
        clock.setEpochSecond(1_200);

        assertFalse(cache.lookup(request(Map.of())).isHit());
    }

    @Test
    void testRangeRequestServedFromPartial() throws Exception {
        ResponseMetadata partial = metadata().toBuilder()
                .parsedHeader(ContentRange.HEADER, new ContentRange(0, 999, 2000L))
                .build();
        cache.store(request(Map.of()), origin("first half"), partial);

        CacheLookup<UUID> covered = cache.lookup(request(Map.of("Range", List.of("bytes=0-499"))));
        CacheLookup<UUID> uncovered = cache.lookup(request(Map.of("Range", List.of("bytes=500-1999"))));

        assertEquals("first half", body(covered.getResponse()));
        assertFalse(uncovered.isHit());
    }

    @Test
    void testVaryStarIsNotStored() {
        boolean stored = cache.store(request(Map.of()), origin("x", HttpHeader.of("Vary", "*")), metadata());

        assertFalse(stored);
        assertEquals(0, store.estimatedSize());
        assertFalse(cache.lookup(request(Map.of())).isHit());
    }

    @Test
    void testInvalidMetadataIsRejected() {
        ResponseMetadata reversed = ResponseMetadata.builder()
                .created(Instant.ofEpochSecond(1_000))
                .expires(Instant.ofEpochSecond(900))
                .grace(Instant.ofEpochSecond(1_200))
                .build();

        assertThrows(InvalidMetadataException.class, () -> cache.store(request(Map.of()), origin("x"), reversed));
        assertEquals(0, store.estimatedSize());
    }

    @Test
    void testUrlInvalidationIsVisibleImmediately() {
        cache.store(request(Map.of()), origin("a"), metadata());
        cache.store(request(Map.of()), origin("b"), metadata());

        InvalidationOutcome outcome = cache.invalidateUrl(URL);

        assertTrue(outcome.isInvalidated());
        assertEquals(2L, outcome.count().getAsLong());
        assertFalse(cache.lookup(request(Map.of())).isHit());
    }

    @Test
    void testAlternateKeyInvalidation() {
        ResponseMetadata tagged = metadata().toBuilder().alternateKey(AlternateKey.of("product-42")).build();
        cache.store(request(Map.of()), origin("a"), tagged);

        InvalidationOutcome outcome = cache.invalidateByAlternateKeys(List.of(AlternateKey.of("product-42")));

        assertEquals(1L, outcome.count().getAsLong());
        assertFalse(cache.lookup(request(Map.of())).isHit());
    }

    @Test
    void testAlternateKeyInvalidationUnsupported() {
        HttpResponseCache<String> fakeCache = newCache(new FakeResponseStore());

        InvalidationOutcome outcome = fakeCache.invalidateByAlternateKeys(List.of(AlternateKey.of("product-42")));

        assertEquals(InvalidationOutcome.Status.UNSUPPORTED, outcome.getStatus());
    }

    @Test
    void testHitNotifiesStore() {
        cache.store(request(Map.of()), origin("a"), metadata());
        clock.advance(Duration.ofSeconds(30));

        CacheLookup<UUID> lookup = cache.lookup(request(Map.of()));

        assertEquals(Instant.ofEpochSecond(1_030), store.lastUsed(lookup.getRef()).orElseThrow());
    }

    @Test
    void testNotifyDisabled() {
        properties.getNotify().setEnabled(false);
        FakeResponseStore fake = new FakeResponseStore();
        HttpResponseCache<String> fakeCache = newCache(fake);
        fakeCache.store(request(Map.of()), origin("a"), metadata());

        assertTrue(fakeCache.lookup(request(Map.of())).isHit());
        assertTrue(fake.used().isEmpty());
    }

    @Test
    void testNotifyFailureCompletesExceptionally() {
        FakeResponseStore fake = new FakeResponseStore().failWith(FakeResponseStore.unavailable());
        HttpResponseCache<String> fakeCache = newCache(fake);

        CompletableFuture<Void> future = fakeCache.notifyUsed("ref-1", StoreOptions.NONE);

        assertTrue(future.isCompletedExceptionally());
        CompletionException e = assertThrows(CompletionException.class, future::join);
        assertInstanceOf(ResponseStoreException.class, e.getCause());
    }

    @Test
    void testStoreFailureIsNotAMiss() {
        FakeResponseStore fake = new FakeResponseStore().failWith(FakeResponseStore.unavailable());
        HttpResponseCache<String> fakeCache = newCache(fake);

        assertThrows(ResponseStoreException.class, () -> fakeCache.lookup(request(Map.of())));
        assertThrows(ResponseStoreException.class,
                () -> fakeCache.store(request(Map.of()), origin("a"), metadata()));
        assertEquals(0, fakeCache.getStatistics().getMisses());
    }

    @Test
    void testStatistics() {
        cache.lookup(request(Map.of()));
        cache.store(request(Map.of()), origin("a"), metadata());
        cache.lookup(request(Map.of()));
        clock.setEpochSecond(1_150);
        cache.lookup(request(Map.of()));

        CacheStatistics stats = cache.getStatistics();

        assertEquals("memory", stats.getStore());
        assertEquals(1, stats.getFreshHits());
        assertEquals(1, stats.getStaleHits());
        assertEquals(1, stats.getMisses());
        assertEquals(1, stats.getStores());
        assertEquals(2.0 / 3, stats.getHitRate(), 0.0001);
        assertTrue(stats.isAlternateKeysSupported());
    }

    private <R> HttpResponseCache<R> newCache(ResponseStore<R> responseStore) {
        return new HttpResponseCache<>(
                responseStore,
                new CandidateSelector(new FreshnessEvaluator(clock), properties),
                new InvalidationCoordinator(),
                new MetadataValidator(),
                new RequestKeyGenerator(properties),
                properties,
                Runnable::run);
    }

    private static CacheRequest request(Map<String, List<String>> headers) {
        return CacheRequest.builder().url(URL).headers(headers).build();
    }

    private static OriginResponse origin(String body, HttpHeader... headers) {
        return OriginResponse.builder()
                .status(200)
                .headers(List.of(headers))
                .body(body.getBytes(StandardCharsets.UTF_8))
                .build();
    }

    private ResponseMetadata metadata() {
        Instant now = clock.instant();
        return ResponseMetadata.builder()
                .created(now)
                .expires(now.plusSeconds(100))
                .grace(now.plusSeconds(180))
                .build();
    }

    private static String body(StoredResponse response) throws Exception {
        try (InputStream in = response.getBody().openStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
