package com.varia.store.redis;

import com.varia.model.AlternateKey;
import com.varia.model.Candidate;
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
import com.varia.store.ResponseStoreException;
import com.varia.store.StoreOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Redis based store.
 * Key pattern:
 * <pre>
 * {prefix}head:{id}            gzip JSON head (status, headers, vary, metadata)
 * {prefix}body:{id}            raw body bytes
 * {prefix}key:{requestKey}     set of ids stored for a request key
 * {prefix}url:{urlDigest}      set of ids stored for a URL
 * {prefix}alt:{alternateKey}   set of ids tagged with an alternate key
 * {prefix}used:{id}            epoch millis of the last reported use
 * </pre>
 * Heads and bodies expire when the response's grace period ends. Each index set expires
 * no earlier than the last response added to it; members whose head is gone are skipped,
 * and pruned from request key sets on listing.
 *
 * A response is selectable only while its head exists, and a body is only returned
 * together with its head. Invalidation deletes heads before bodies, so no reader can
 * get a head whose body was already removed.
 *
 * A {@link StoreOptions#timeout()} bounds each call: the Redis commands run on the given
 * executor and the caller gets a {@link ResponseStoreException} once the timeout elapses.
 */
@Slf4j
public class RedisResponseStore implements ResponseStore<String>, AlternateKeyInvalidation {

    private static final String NAME = "redis";
    private static final Duration MIN_TTL = Duration.ofSeconds(1);

    private final RedisTemplate<String, byte[]> redisTemplate;
    private final ResponseDocumentCodec codec;
    private final String keyPrefix;
    private final Clock clock;
    private final Executor executor;

    public RedisResponseStore(RedisTemplate<String, byte[]> redisTemplate, ResponseDocumentCodec codec,
                              String keyPrefix, Clock clock, Executor executor) {
        this.redisTemplate = redisTemplate;
        this.codec = codec;
        this.keyPrefix = keyPrefix;
        this.clock = clock;
        this.executor = executor;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<Candidate<String>> listCandidates(RequestKey key, StoreOptions options) {
        return withTimeout(options, "listCandidates", () -> doListCandidates(key));
    }

    private List<Candidate<String>> doListCandidates(RequestKey key) {
        String indexKey = requestKeyIndex(key);
        try {
            List<String> ids = members(indexKey);
            if (ids.isEmpty()) {
                return List.of();
            }

            List<byte[]> heads = redisTemplate.opsForValue().multiGet(
                    ids.stream().map(this::headKey).collect(Collectors.toList()));

            List<Candidate<String>> candidates = new ArrayList<>(ids.size());
            List<String> gone = new ArrayList<>();
            for (int i = 0; i < ids.size(); i++) {
                byte[] head = heads == null ? null : heads.get(i);
                if (head == null) {
                    gone.add(ids.get(i));
                    continue;
                }
                try {
                    candidates.add(codec.toCandidate(ids.get(i), codec.decode(head)));
                } catch (IOException e) {
                    // One unreadable head must not hide the other variants
                    log.error("Skipping unreadable Redis response head: id={}, key={}", ids.get(i), key, e);
                }
            }

            if (!gone.isEmpty()) {
                redisTemplate.opsForSet().remove(indexKey, gone.stream().map(RedisResponseStore::idBytes).toArray());
                log.debug("Pruned {} expired members from {}", gone.size(), indexKey);
            }
            return candidates;

        } catch (Exception e) {
            log.error("Error listing candidates from Redis: key={}", key, e);
            throw new ResponseStoreException(NAME, "Failed to list candidates for " + key, e);
        }
    }

    @Override
    public Optional<StoredResponse> getResponse(String ref, StoreOptions options) {
        return withTimeout(options, "getResponse", () -> doGetResponse(ref));
    }

    private Optional<StoredResponse> doGetResponse(String ref) {
        try {
            byte[] head = redisTemplate.opsForValue().get(headKey(ref));
            if (head == null) {
                log.debug("Redis response head missing: {}", ref);
                return Optional.empty();
            }
            byte[] body = redisTemplate.opsForValue().get(bodyKey(ref));
            if (body == null) {
                log.debug("Redis response body missing: {}", ref);
                return Optional.empty();
            }

            ResponseHeadDocument document = codec.decode(head);
            return Optional.of(StoredResponse.builder()
                    .status(document.getStatus())
                    .headers(codec.headers(document))
                    .body(ResponseBody.ofBytes(body))
                    .metadata(codec.metadata(document))
                    .build());

        } catch (Exception e) {
            log.error("Error retrieving response from Redis: ref={}", ref, e);
            throw new ResponseStoreException(NAME, "Failed to get response " + ref, e);
        }
    }

    @Override
    public void put(RequestKey key, UrlDigest urlDigest, VaryHeaders varyHeaders, OriginResponse response,
                    ResponseMetadata metadata, StoreOptions options) {
        withTimeout(options, "put", () -> {
            doPut(key, urlDigest, varyHeaders, response, metadata);
            return null;
        });
    }

    private void doPut(RequestKey key, UrlDigest urlDigest, VaryHeaders varyHeaders, OriginResponse response,
                       ResponseMetadata metadata) {
        String id = UUID.randomUUID().toString();
        try {
            byte[] head = codec.encode(codec.toDocument(key, urlDigest, varyHeaders, response, metadata));
            Duration ttl = ttlUntil(metadata);

            // Body first: a visible head always has its body
            redisTemplate.opsForValue().set(bodyKey(id), response.getBody(), ttl);
            redisTemplate.opsForValue().set(headKey(id), head, ttl);

            addToIndex(requestKeyIndex(key), id, ttl);
            addToIndex(urlIndex(urlDigest), id, ttl);
            for (AlternateKey alternateKey : metadata.getAlternateKeys()) {
                addToIndex(alternateKeyIndex(alternateKey), id, ttl);
            }

            log.debug("Stored in Redis: id={}, key={}, ttl={}, head={}B, body={}B",
                    id, key, ttl, head.length, response.getBody().length);

        } catch (IllegalArgumentException e) {
            log.warn("Refusing to store response for key={}: {}", key, e.getMessage());
            throw e;
        } catch (Exception e) {
            log.error("Error storing response in Redis: key={}", key, e);
            throw new ResponseStoreException(NAME, "Failed to store response for " + key, e);
        }
    }

    @Override
    public void notifyUsed(String ref, StoreOptions options) {
        withTimeout(options, "notifyUsed", () -> {
            doNotifyUsed(ref);
            return null;
        });
    }

    private void doNotifyUsed(String ref) {
        try {
            Long remainingSeconds = redisTemplate.getExpire(headKey(ref));
            if (remainingSeconds == null || remainingSeconds <= 0) {
                // -2: head gone, -1: no expiry
                return;
            }
            byte[] now = String.valueOf(clock.millis()).getBytes(StandardCharsets.UTF_8);
            redisTemplate.opsForValue().set(usedKey(ref), now, Duration.ofSeconds(remainingSeconds));
        } catch (Exception e) {
            throw new ResponseStoreException(NAME, "Failed to record use of " + ref, e);
        }
    }

    @Override
    public InvalidationResult invalidateUrl(UrlDigest urlDigest, StoreOptions options) {
        return withTimeout(options, "invalidateUrl", () -> doInvalidateUrl(urlDigest));
    }

    private InvalidationResult doInvalidateUrl(UrlDigest urlDigest) {
        String indexKey = urlIndex(urlDigest);
        try {
            List<String> ids = members(indexKey);
            redisTemplate.delete(indexKey);
            long removed = deleteResponses(ids);
            log.info("Invalidated {} Redis responses for url digest {}", removed, urlDigest);
            return InvalidationResult.counted(removed);
        } catch (Exception e) {
            log.error("Error invalidating url digest in Redis: {}", urlDigest, e);
            throw new ResponseStoreException(NAME, "Failed to invalidate url " + urlDigest, e);
        }
    }

    @Override
    public InvalidationResult invalidateByAlternateKey(Collection<AlternateKey> keys, StoreOptions options) {
        return withTimeout(options, "invalidateByAlternateKey", () -> doInvalidateByAlternateKey(keys));
    }

    private InvalidationResult doInvalidateByAlternateKey(Collection<AlternateKey> keys) {
        try {
            Set<String> ids = new LinkedHashSet<>();
            List<String> indexKeys = new ArrayList<>();
            for (AlternateKey key : keys) {
                String indexKey = alternateKeyIndex(key);
                indexKeys.add(indexKey);
                ids.addAll(members(indexKey));
            }
            if (!indexKeys.isEmpty()) {
                redisTemplate.delete(indexKeys);
            }
            long removed = deleteResponses(ids);
            log.info("Invalidated {} Redis responses for alternate keys {}", removed, keys);
            return InvalidationResult.counted(removed);
        } catch (Exception e) {
            log.error("Error invalidating alternate keys in Redis: {}", keys, e);
            throw new ResponseStoreException(NAME, "Failed to invalidate alternate keys " + keys, e);
        }
    }

    @Override
    public Optional<AlternateKeyInvalidation> alternateKeyInvalidation() {
        return Optional.of(this);
    }

    /**
     * Run a store call, bounded by the caller's timeout if one was given.
     */
    private <T> T withTimeout(StoreOptions options, String operation, Supplier<T> call) {
        Optional<Duration> timeout = options.timeout();
        if (timeout.isEmpty()) {
            return call.get();
        }

        CompletableFuture<T> future = CompletableFuture.supplyAsync(call, executor);
        try {
            return future.get(timeout.get().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Redis {} timed out after {}", operation, timeout.get());
            throw new ResponseStoreException(NAME, operation + " timed out after " + timeout.get(), e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new ResponseStoreException(NAME, operation + " failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ResponseStoreException(NAME, operation + " interrupted", e);
        }
    }

    /**
     * Add a response id to an index set and keep the set alive at least as long as the response.
     */
    private void addToIndex(String indexKey, String id, Duration ttl) {
        redisTemplate.opsForSet().add(indexKey, idBytes(id));
        Long remainingSeconds = redisTemplate.getExpire(indexKey);
        // -1: no expiry yet
        if (remainingSeconds == null || remainingSeconds < ttl.toSeconds()) {
            redisTemplate.expire(indexKey, ttl);
        }
    }

    private long deleteResponses(Collection<String> ids) {
        if (ids.isEmpty()) {
            return 0;
        }
        Long heads = redisTemplate.delete(ids.stream().map(this::headKey).collect(Collectors.toList()));
        List<String> rest = new ArrayList<>(ids.size() * 2);
        for (String id : ids) {
            rest.add(bodyKey(id));
            rest.add(usedKey(id));
        }
        redisTemplate.delete(rest);
        return heads == null ? 0 : heads;
    }

    private List<String> members(String indexKey) {
        Set<byte[]> members = redisTemplate.opsForSet().members(indexKey);
        if (members == null) {
            return List.of();
        }
        return members.stream()
                .map(member -> new String(member, StandardCharsets.UTF_8))
                .sorted()
                .collect(Collectors.toList());
    }

    private Duration ttlUntil(ResponseMetadata metadata) {
        Duration ttl = Duration.between(clock.instant(), metadata.getGrace());
        return ttl.compareTo(MIN_TTL) < 0 ? MIN_TTL : ttl;
    }

    private static byte[] idBytes(String id) {
        return id.getBytes(StandardCharsets.UTF_8);
    }

    String headKey(String id) {
        return keyPrefix + "head:" + id;
    }

    String bodyKey(String id) {
        return keyPrefix + "body:" + id;
    }

    String usedKey(String id) {
        return keyPrefix + "used:" + id;
    }

    String requestKeyIndex(RequestKey key) {
        return keyPrefix + "key:" + key.getValue();
    }

    String urlIndex(UrlDigest urlDigest) {
        return keyPrefix + "url:" + urlDigest.getValue();
    }

    String alternateKeyIndex(AlternateKey key) {
        return keyPrefix + "alt:" + key.getValue();
    }
}
