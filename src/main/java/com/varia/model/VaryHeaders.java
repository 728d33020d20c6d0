package com.varia.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Normalized header values taken into account by {@code Vary}.
 *
 * Each entry maps a lower-cased header name either to the header's normalized value or to
 * an explicit absent marker. Absent and empty are different: {@code accept-encoding: ""}
 * does not match a request that carries no {@code accept-encoding} at all.
 *
 * The same type describes both sides of a match: the values recorded when a response was
 * stored, and the values carried by a new request. On the request side a name that was
 * never mentioned reads as absent.
 */
public final class VaryHeaders {

    private static final VaryHeaders EMPTY = new VaryHeaders(new TreeMap<>());

    // null value = header absent
    private final SortedMap<String, String> values;

    private VaryHeaders(SortedMap<String, String> values) {
        this.values = values;
    }

    public static VaryHeaders empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Record the request values of the headers a response varies on.
     *
     * @param varyHeaderNames header names listed by the response's {@code vary} header
     * @param requestHeaders  request headers, names matched case-insensitively
     * @return vary headers with an absent marker for every name the request lacks
     */
    public static VaryHeaders fromRequest(Collection<String> varyHeaderNames,
                                          Map<String, List<String>> requestHeaders) {
        Builder builder = builder();
        Map<String, List<String>> normalized = normalizeNames(requestHeaders);
        for (String name : varyHeaderNames) {
            String key = normalizeName(name);
            List<String> requestValues = normalized.get(key);
            if (requestValues == null || requestValues.isEmpty()) {
                builder.absent(key);
            } else {
                builder.header(key, joinValues(requestValues));
            }
        }
        return builder.build();
    }

    /**
     * Every header of a request, as the request side of a vary match.
     */
    public static VaryHeaders ofRequest(Map<String, List<String>> requestHeaders) {
        Builder builder = builder();
        normalizeNames(requestHeaders).forEach((name, requestValues) -> {
            if (!requestValues.isEmpty()) {
                builder.header(name, joinValues(requestValues));
            }
        });
        return builder.build();
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(values.keySet());
    }

    public boolean declares(String name) {
        return values.containsKey(normalizeName(name));
    }

    /**
     * @return the header value, or empty when the header is absent or not mentioned
     */
    public Optional<String> valueOf(String name) {
        return Optional.ofNullable(values.get(normalizeName(name)));
    }

    public boolean isAbsent(String name) {
        return values.get(normalizeName(name)) == null;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Entries with absent headers mapped to {@code null}. Iteration follows header name order.
     */
    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(values);
    }

    static String normalizeName(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    private static Map<String, List<String>> normalizeNames(Map<String, List<String>> headers) {
        Map<String, List<String>> normalized = new TreeMap<>();
        headers.forEach((name, headerValues) -> normalized
                .computeIfAbsent(normalizeName(name), k -> new ArrayList<>())
                .addAll(headerValues == null ? List.of() : headerValues));
        return normalized;
    }

    private static String joinValues(List<String> headerValues) {
        return headerValues.stream()
                .map(String::trim)
                .collect(Collectors.joining(", "));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof VaryHeaders)) {
            return false;
        }
        return values.equals(((VaryHeaders) o).values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return values.entrySet().stream()
                .map(e -> e.getKey() + "=" + (e.getValue() == null ? "<absent>" : "\"" + e.getValue() + "\""))
                .collect(Collectors.joining(", ", "VaryHeaders{", "}"));
    }

    public static final class Builder {

        private final SortedMap<String, String> values = new TreeMap<>();

        private Builder() {
        }

        public Builder header(String name, String value) {
            values.put(normalizeName(name), Objects.requireNonNull(value, "value"));
            return this;
        }

        public Builder absent(String name) {
            values.put(normalizeName(name), null);
            return this;
        }

        public Builder putAll(Map<String, String> entries) {
            entries.forEach((name, value) -> {
                if (value == null) {
                    absent(name);
                } else {
                    header(name, value);
                }
            });
            return this;
        }

        public VaryHeaders build() {
            return values.isEmpty() ? EMPTY : new VaryHeaders(new TreeMap<>(values));
        }
    }
}
