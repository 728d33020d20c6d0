package com.varia.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Metadata stored alongside a response.
 *
 * Accepted metadata always satisfies {@code created <= expires <= grace}; this is checked
 * before a response reaches a store, see {@code MetadataValidator}.
 */
@Value
@Builder(toBuilder = true)
public class ResponseMetadata {

    /**
     * When the response was received (or last revalidated).
     */
    @NonNull
    Instant created;

    /**
     * End of the freshness lifetime.
     */
    @NonNull
    Instant expires;

    /**
     * End of the window during which the response may still be served stale.
     */
    @NonNull
    Instant grace;

    @NonNull
    @Builder.Default
    TtlSource ttlSetBy = TtlSource.HEADER;

    /**
     * Parsed response headers, e.g. {@code content-range} mapped to a {@link ContentRange}.
     */
    @Singular
    Map<String, Object> parsedHeaders;

    @Singular
    Set<AlternateKey> alternateKeys;

    public Optional<ContentRange> contentRange() {
        Object value = parsedHeaders.get(ContentRange.HEADER);
        return value instanceof ContentRange ? Optional.of((ContentRange) value) : Optional.empty();
    }

    /**
     * Whether the response is a {@code 206} holding only part of the representation.
     */
    public boolean isPartial() {
        return contentRange().isPresent();
    }
}
