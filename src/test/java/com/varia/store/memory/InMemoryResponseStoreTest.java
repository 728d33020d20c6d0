package com.varia.store.memory;

import com.varia.model.AlternateKey;
import com.varia.model.Candidate;
import com.varia.model.ContentRange;
import com.varia.model.HttpHeader;
import com.varia.model.OriginResponse;
import com.varia.model.RequestKey;
import com.varia.model.ResponseBody;
import com.varia.model.ResponseMetadata;
import com.varia.model.StoredResponse;
import com.varia.model.TtlSource;
import com.varia.model.UrlDigest;
import com.varia.model.VaryHeaders;
import com.varia.store.StoreOptions;
import com.varia.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for InMemoryResponseStore.
 */
class InMemoryResponseStoreTest {

    private static final RequestKey KEY = RequestKey.of("key-1");
    private static final UrlDigest URL = UrlDigest.of("url-1");

    private MutableClock clock;
    private InMemoryResponseStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpochSecond(1_000);
        store = new InMemoryResponseStore(100, clock, Runnable::run);
    }

    @Test
    void testEmptyStoreListsNothing() {
        assertTrue(store.listCandidates(KEY, StoreOptions.NONE).isEmpty());
        assertTrue(store.getResponse(UUID.randomUUID(), StoreOptions.NONE).isEmpty());
    }

    @Test
    void testSeveralVariantsUnderOneKey() {
        VaryHeaders gzip = VaryHeaders.builder().header("accept-encoding", "gzip").build();
        VaryHeaders br = VaryHeaders.builder().header("accept-encoding", "br").build();
        store.put(KEY, URL, gzip, response("gzip"), metadata(), StoreOptions.NONE);
        store.put(KEY, URL, br, response("br"), metadata(), StoreOptions.NONE);

        List<Candidate<UUID>> candidates = store.listCandidates(KEY, StoreOptions.NONE);

        assertEquals(2, candidates.size());
        assertTrue(candidates.stream().anyMatch(candidate -> candidate.getVaryHeaders().equals(gzip)));
        assertTrue(candidates.stream().anyMatch(candidate -> candidate.getVaryHeaders().equals(br)));
        assertTrue(store.listCandidates(RequestKey.of("other"), StoreOptions.NONE).isEmpty());
    }

    @Test
    void testIdenticalPutsAreKeptSeparately() {
        store.put(KEY, URL, VaryHeaders.empty(), response("a"), metadata(), StoreOptions.NONE);
        store.put(KEY, URL, VaryHeaders.empty(), response("a"), metadata(), StoreOptions.NONE);

        assertEquals(2, store.listCandidates(KEY, StoreOptions.NONE).size());
    }

    @Test
    void testResponseRoundTrip() throws Exception {
        ResponseMetadata metadata = metadata().toBuilder()
                .ttlSetBy(TtlSource.HEURISTICS)
                .parsedHeader(ContentRange.HEADER, new ContentRange(0, 9, 100L))
                .parsedHeader("age", 12L)
                .alternateKey(AlternateKey.of("tag"))
                .build();
        OriginResponse origin = OriginResponse.builder()
                .status(206)
                .header(HttpHeader.of("Content-Type", "text/plain"))
                .header(HttpHeader.of("Set-Cookie", "a=1"))
                .header(HttpHeader.of("Set-Cookie", "b=2"))
                .body("0123456789".getBytes(StandardCharsets.UTF_8))
                .build();
        store.put(KEY, URL, VaryHeaders.empty(), origin, metadata, StoreOptions.NONE);

        Candidate<UUID> candidate = store.listCandidates(KEY, StoreOptions.NONE).get(0);
        StoredResponse response = store.getResponse(candidate.getRef(), StoreOptions.NONE).orElseThrow();

        assertEquals(metadata, candidate.getMetadata());
        assertEquals(metadata, response.getMetadata());
        assertEquals(206, response.getStatus());
        assertEquals(origin.getHeaders(), response.getHeaders());
        assertArrayEquals(origin.getBody(), ((ResponseBody.Bytes) response.getBody()).getContent());
    }

    @Test
    void testStoredBodyIsIsolatedFromCallersAndReaders() throws Exception {
        byte[] body = "original".getBytes(StandardCharsets.UTF_8);
        store.put(KEY, URL, VaryHeaders.empty(), OriginResponse.builder().status(200).body(body).build(),
                metadata(), StoreOptions.NONE);
        UUID ref = store.listCandidates(KEY, StoreOptions.NONE).get(0).getRef();

        body[0] = 'X';
        byte[] read = ((ResponseBody.Bytes) store.getResponse(ref, StoreOptions.NONE).orElseThrow().getBody())
                .getContent();
        read[1] = 'X';

        StoredResponse again = store.getResponse(ref, StoreOptions.NONE).orElseThrow();
        assertArrayEquals("original".getBytes(StandardCharsets.UTF_8),
                ((ResponseBody.Bytes) again.getBody()).getContent());
        assertArrayEquals("original".getBytes(StandardCharsets.UTF_8), again.getBody().openStream().readAllBytes());
    }

    @Test
    void testUrlInvalidationRemovesEveryVariant() {
        store.put(KEY, URL, VaryHeaders.empty(), response("a"), metadata(), StoreOptions.NONE);
        store.put(RequestKey.of("key-2"), URL, VaryHeaders.empty(), response("b"), metadata(), StoreOptions.NONE);
        store.put(RequestKey.of("key-3"), UrlDigest.of("url-2"), VaryHeaders.empty(), response("c"), metadata(),
                StoreOptions.NONE);
        UUID ref = store.listCandidates(KEY, StoreOptions.NONE).get(0).getRef();

        assertEquals(2L, store.invalidateUrl(URL, StoreOptions.NONE).count().getAsLong());

        assertTrue(store.listCandidates(KEY, StoreOptions.NONE).isEmpty());
        assertTrue(store.getResponse(ref, StoreOptions.NONE).isEmpty());
        assertEquals(1, store.listCandidates(RequestKey.of("key-3"), StoreOptions.NONE).size());
        assertEquals(0L, store.invalidateUrl(URL, StoreOptions.NONE).count().getAsLong());
    }

    @Test
    void testAlternateKeyInvalidation() {
        ResponseMetadata red = metadata().toBuilder().alternateKey(AlternateKey.of("red")).build();
        ResponseMetadata both = metadata().toBuilder()
                .alternateKey(AlternateKey.of("red"))
                .alternateKey(AlternateKey.of("blue"))
                .build();
        ResponseMetadata blue = metadata().toBuilder().alternateKey(AlternateKey.of("blue")).build();
        store.put(KEY, URL, VaryHeaders.empty(), response("a"), red, StoreOptions.NONE);
        store.put(KEY, URL, VaryHeaders.empty(), response("b"), both, StoreOptions.NONE);
        store.put(KEY, URL, VaryHeaders.empty(), response("c"), blue, StoreOptions.NONE);

        long removed = store.alternateKeyInvalidation().orElseThrow()
                .invalidateByAlternateKey(List.of(AlternateKey.of("red")), StoreOptions.NONE)
                .count().getAsLong();

        assertEquals(2, removed);
        List<Candidate<UUID>> left = store.listCandidates(KEY, StoreOptions.NONE);
        assertEquals(1, left.size());
        assertEquals(blue, left.get(0).getMetadata());

        // "blue" index must no longer point at the removed response
        assertEquals(1L, store.invalidateByAlternateKey(List.of(AlternateKey.of("blue")), StoreOptions.NONE)
                .count().getAsLong());
        assertTrue(store.listCandidates(KEY, StoreOptions.NONE).isEmpty());
    }

    @Test
    void testUnknownAlternateKey() {
        store.put(KEY, URL, VaryHeaders.empty(), response("a"), metadata(), StoreOptions.NONE);

        assertEquals(0L, store.invalidateByAlternateKey(List.of(AlternateKey.of("none")), StoreOptions.NONE)
                .count().getAsLong());
        assertEquals(1, store.listCandidates(KEY, StoreOptions.NONE).size());
    }

    @Test
    void testNotifyUsedRecordsTime() {
        store.put(KEY, URL, VaryHeaders.empty(), response("a"), metadata(), StoreOptions.NONE);
        UUID ref = store.listCandidates(KEY, StoreOptions.NONE).get(0).getRef();
        assertEquals(Optional.of(Instant.ofEpochSecond(1_000)), store.lastUsed(ref));

        clock.advance(Duration.ofSeconds(42));
        store.notifyUsed(ref, StoreOptions.NONE);

        assertEquals(Optional.of(Instant.ofEpochSecond(1_042)), store.lastUsed(ref));
    }

    @Test
    void testNotifyUsedOnMissingResponseIsIgnored() {
        assertDoesNotThrow(() -> store.notifyUsed(UUID.randomUUID(), StoreOptions.NONE));
    }

    @Test
    void testSupportsAlternateKeys() {
        assertTrue(store.alternateKeyInvalidation().isPresent());
        assertEquals("memory", store.name());
    }

    private static OriginResponse response(String body) {
        return OriginResponse.builder()
                .status(200)
                .body(body.getBytes(StandardCharsets.UTF_8))
                .build();
    }

    private ResponseMetadata metadata() {
        Instant now = clock.instant();
        return ResponseMetadata.builder()
                .created(now)
                .expires(now.plusSeconds(60))
                .grace(now.plusSeconds(120))
                .build();
    }
}
