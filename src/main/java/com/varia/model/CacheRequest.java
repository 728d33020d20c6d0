package com.varia.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Request seen by the cache: what identifies it, and the headers used for variant selection.
 */
@Value
@Builder
public class CacheRequest {

    private static final String RANGE = "range";

    @NonNull
    @Builder.Default
    String method = "GET";

    @NonNull
    String url;

    @NonNull
    @Builder.Default
    byte[] body = new byte[0];

    /**
     * Partition tag, {@code null} for the configured default bucket.
     */
    String bucket;

    /**
     * Request headers, names matched case-insensitively.
     */
    @NonNull
    @Builder.Default
    Map<String, List<String>> headers = Map.of();

    public VaryHeaders varyValues() {
        return VaryHeaders.ofRequest(headers);
    }

    /**
     * The single byte range requested, if any and well formed.
     */
    public Optional<ByteRange> range() {
        return headers.entrySet().stream()
                .filter(entry -> entry.getKey().equalsIgnoreCase(RANGE))
                .flatMap(entry -> entry.getValue().stream())
                .findFirst()
                .flatMap(ByteRange::parse);
    }
}
