package com.varia.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Single byte range requested through a {@code range} header.
 *
 * Three forms exist: closed ({@code bytes=0-499}), open ended ({@code bytes=500-}) and
 * suffix ({@code bytes=-500}). Open ended and suffix ranges only become concrete once the
 * complete length of the representation is known, see {@link #resolve(Long)}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ByteRange {

    private static final Pattern RANGE = Pattern.compile("^\\s*bytes\\s*=\\s*(\\d*)\\s*-\\s*(\\d*)\\s*$",
            Pattern.CASE_INSENSITIVE);

    /**
     * First byte position, {@code null} for a suffix range.
     */
    Long first;

    /**
     * Last byte position (inclusive), {@code null} for open ended and suffix ranges.
     */
    Long last;

    /**
     * Number of trailing bytes, only set for a suffix range.
     */
    Long suffixLength;

    public static ByteRange closed(long first, long last) {
        if (first < 0 || last < first) {
            throw new IllegalArgumentException("Invalid byte range: " + first + "-" + last);
        }
        return new ByteRange(first, last, null);
    }

    public static ByteRange from(long first) {
        if (first < 0) {
            throw new IllegalArgumentException("Invalid byte range start: " + first);
        }
        return new ByteRange(first, null, null);
    }

    public static ByteRange suffix(long length) {
        if (length <= 0) {
            throw new IllegalArgumentException("Invalid suffix length: " + length);
        }
        return new ByteRange(null, null, length);
    }

    /**
     * Parse a {@code range} header value. Multi-range and malformed values yield empty,
     * in which case the request is treated as a request for the full representation.
     */
    public static Optional<ByteRange> parse(String headerValue) {
        if (headerValue == null || headerValue.isBlank() || headerValue.indexOf(',') >= 0) {
            return Optional.empty();
        }
        Matcher matcher = RANGE.matcher(headerValue);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        String start = matcher.group(1);
        String end = matcher.group(2);
        try {
            if (start.isEmpty() && end.isEmpty()) {
                return Optional.empty();
            }
            if (start.isEmpty()) {
                long length = Long.parseLong(end);
                return length > 0 ? Optional.of(suffix(length)) : Optional.empty();
            }
            long first = Long.parseLong(start);
            if (end.isEmpty()) {
                return Optional.of(from(first));
            }
            long last = Long.parseLong(end);
            return last >= first ? Optional.of(closed(first, last)) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public boolean isClosed() {
        return first != null && last != null;
    }

    /**
     * Turn this range into a closed range against a representation's complete length.
     *
     * @param completeLength complete length in bytes, or {@code null} when unknown
     * @return the concrete range, or empty when it cannot be determined or is unsatisfiable
     */
    public Optional<ByteRange> resolve(Long completeLength) {
        if (completeLength == null) {
            return isClosed() ? Optional.of(this) : Optional.empty();
        }
        if (suffixLength != null) {
            if (completeLength == 0) {
                return Optional.empty();
            }
            long length = Math.min(suffixLength, completeLength);
            return Optional.of(closed(completeLength - length, completeLength - 1));
        }
        if (first >= completeLength) {
            return Optional.empty();
        }
        long end = last == null ? completeLength - 1 : Math.min(last, completeLength - 1);
        return Optional.of(closed(first, end));
    }

    public String toHeaderValue() {
        if (suffixLength != null) {
            return "bytes=-" + suffixLength;
        }
        return "bytes=" + first + "-" + (last == null ? "" : last);
    }

    @Override
    public String toString() {
        return toHeaderValue();
    }
}
