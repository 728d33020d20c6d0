package com.varia.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Byte range held by a stored {@code 206 Partial Content} response.
 *
 * Kept in {@link ResponseMetadata#getParsedHeaders()} under {@code content-range}.
 */
@Value
public class ContentRange {

    public static final String HEADER = "content-range";

    private static final Pattern CONTENT_RANGE = Pattern.compile(
            "^\\s*bytes\\s+(\\d+)\\s*-\\s*(\\d+)\\s*/\\s*(\\d+|\\*)\\s*$", Pattern.CASE_INSENSITIVE);

    long first;

    long last;

    /**
     * Complete length of the representation, {@code null} when the origin sent {@code *}.
     */
    Long completeLength;

    @JsonCreator
    public ContentRange(@JsonProperty("first") long first,
                        @JsonProperty("last") long last,
                        @JsonProperty("completeLength") Long completeLength) {
        if (first < 0 || last < first) {
            throw new IllegalArgumentException("Invalid content range: " + first + "-" + last);
        }
        if (completeLength != null && last >= completeLength) {
            throw new IllegalArgumentException(
                    "Content range " + first + "-" + last + " exceeds complete length " + completeLength);
        }
        this.first = first;
        this.last = last;
        this.completeLength = completeLength;
    }

    /**
     * Parse a {@code content-range} header value. Unsatisfied ranges ({@code bytes *}/len)
     * and malformed values yield empty.
     */
    public static Optional<ContentRange> parse(String headerValue) {
        if (headerValue == null) {
            return Optional.empty();
        }
        Matcher matcher = CONTENT_RANGE.matcher(headerValue);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        try {
            long first = Long.parseLong(matcher.group(1));
            long last = Long.parseLong(matcher.group(2));
            Long length = "*".equals(matcher.group(3)) ? null : Long.valueOf(matcher.group(3));
            if (last < first || (length != null && last >= length)) {
                return Optional.empty();
            }
            return Optional.of(new ContentRange(first, last, length));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Whether this stored range holds every byte of the requested range.
     */
    public boolean covers(ByteRange requested) {
        return requested.resolve(completeLength)
                .map(range -> first <= range.getFirst() && range.getLast() <= last)
                .orElse(false);
    }

    public long length() {
        return last - first + 1;
    }

    public String toHeaderValue() {
        return "bytes " + first + "-" + last + "/" + (completeLength == null ? "*" : completeLength);
    }
}
