package com.varia.service.selection;

import com.varia.model.ByteRange;
import com.varia.model.Candidate;
import com.varia.model.ContentRange;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Filters candidates by compatibility with the request's byte range.
 */
public final class RangeMatcher {

    private RangeMatcher() {
    }

    /**
     * With a range: full responses, plus partial responses whose stored range covers it.
     * Without one: full responses only, or every candidate if none of them is full.
     *
     * @param range requested range, {@code null} when the request has none
     */
    public static <R> List<Candidate<R>> eligible(List<Candidate<R>> candidates, ByteRange range) {
        if (range != null) {
            return candidates.stream()
                    .filter(candidate -> covers(candidate, range))
                    .collect(Collectors.toList());
        }

        List<Candidate<R>> full = candidates.stream()
                .filter(candidate -> !candidate.getMetadata().isPartial())
                .collect(Collectors.toList());
        return full.isEmpty() ? candidates : full;
    }

    static boolean covers(Candidate<?> candidate, ByteRange range) {
        Optional<ContentRange> stored = candidate.getMetadata().contentRange();
        return stored.map(contentRange -> contentRange.covers(range)).orElse(true);
    }
}
