package com.varia.controller;

import com.varia.model.AlternateKey;
import com.varia.model.UrlDigest;
import com.varia.model.dto.CacheStatistics;
import com.varia.model.dto.InvalidationRequest;
import com.varia.service.HttpResponseCache;
import com.varia.service.InvalidationOutcome;
import com.varia.store.StoreOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Cache management controller.
 * Provides invalidation and statistics for the active response store.
 */
@Slf4j
@RestController
@RequestMapping("/v1/cache")
public class CacheController {

    private final HttpResponseCache<?> cache;

    public CacheController(HttpResponseCache<?> cache) {
        this.cache = cache;
    }

    /**
     * Get cache statistics.
     */
    @GetMapping("/stats")
    public ResponseEntity<CacheStatistics> getStats() {
        return ResponseEntity.ok(cache.getStatistics());
    }

    /**
     * Invalidate every response stored for a URL (or URL digest).
     */
    @PostMapping("/invalidate/url")
    public ResponseEntity<Map<String, Object>> invalidateUrl(@RequestBody InvalidationRequest request) {
        if (isBlank(request.getUrl()) && isBlank(request.getDigest())) {
            return ResponseEntity.badRequest().body(Map.of(
                    "status", "error",
                    "message", "Either url or digest is required"));
        }

        log.info("URL invalidation requested: url={}, digest={}", request.getUrl(), request.getDigest());
        InvalidationOutcome outcome = isBlank(request.getUrl())
                ? cache.invalidateUrl(UrlDigest.of(request.getDigest()), StoreOptions.NONE)
                : cache.invalidateUrl(request.getUrl());
        return toResponse(outcome);
    }

    /**
     * Invalidate every response tagged with one of the given alternate keys.
     */
    @PostMapping("/invalidate/alternate-keys")
    public ResponseEntity<Map<String, Object>> invalidateAlternateKeys(@RequestBody InvalidationRequest request) {
        if (request.getKeys() == null || request.getKeys().isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of(
                    "status", "error",
                    "message", "At least one alternate key is required"));
        }

        log.info("Alternate key invalidation requested: keys={}", request.getKeys());
        List<AlternateKey> keys = request.getKeys().stream()
                .map(AlternateKey::of)
                .collect(Collectors.toList());
        return toResponse(cache.invalidateByAlternateKeys(keys));
    }

    private ResponseEntity<Map<String, Object>> toResponse(InvalidationOutcome outcome) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", outcome.getStatus().name().toLowerCase(Locale.ROOT));

        return switch (outcome.getStatus()) {
            case INVALIDATED -> {
                outcome.count().ifPresent(count -> body.put("invalidated", count));
                yield ResponseEntity.ok(body);
            }
            case UNSUPPORTED -> {
                body.put("message", outcome.getReason());
                yield ResponseEntity.status(HttpStatus.NOT_IMPLEMENTED).body(body);
            }
            case FAILED -> {
                body.put("message", outcome.getReason());
                yield ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
            }
        };
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
