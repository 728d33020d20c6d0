package com.varia.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Lightweight projection of a stored response, enough to pick a variant without loading its body.
 *
 * @param <R> the store's response reference type
 */
@Value
@Builder
public class Candidate<R> {

    /**
     * Backend handle, only meaningful to the store that returned it.
     */
    @NonNull
    R ref;

    int status;

    @Singular
    List<HttpHeader> headers;

    @NonNull
    @Builder.Default
    VaryHeaders varyHeaders = VaryHeaders.empty();

    @NonNull
    ResponseMetadata metadata;
}
