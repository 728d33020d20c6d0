package com.varia.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Response received from the origin, handed to a store to be cached.
 */
@Value
@Builder
public class OriginResponse {

    private static final String VARY = "vary";

    int status;

    @Singular
    List<HttpHeader> headers;

    @NonNull
    @Builder.Default
    byte[] body = new byte[0];

    public List<String> headerValues(String name) {
        return headers.stream()
                .filter(header -> header.getName().equalsIgnoreCase(name))
                .map(HttpHeader::getValue)
                .collect(Collectors.toList());
    }

    /**
     * Lower-cased header names listed by the {@code vary} header(s), in order, without duplicates.
     */
    public List<String> varyHeaderNames() {
        return headerValues(VARY).stream()
                .flatMap(value -> Arrays.stream(value.split(",")))
                .map(name -> name.trim().toLowerCase(Locale.ROOT))
                .filter(name -> !name.isEmpty())
                .distinct()
                .collect(Collectors.toList());
    }

    /**
     * {@code Vary: *} means no later request can be shown to match.
     */
    public boolean variesOnEverything() {
        return varyHeaderNames().contains("*");
    }
}
