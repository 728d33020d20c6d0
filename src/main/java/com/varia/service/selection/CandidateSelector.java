package com.varia.service.selection;

import com.varia.config.VariaProperties;
import com.varia.model.ByteRange;
import com.varia.model.Candidate;
import com.varia.model.Freshness;
import com.varia.model.RequestKey;
import com.varia.model.ResponseMetadata;
import com.varia.model.StoredResponse;
import com.varia.model.VaryHeaders;
import com.varia.service.FreshnessEvaluator;
import com.varia.store.ResponseStore;
import com.varia.store.StoreOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Picks the one stored response that answers a request.
 *
 * Flow:
 * 1. List every candidate stored under the request key
 * 2. Keep candidates whose vary headers match the request
 * 3. Keep candidates compatible with the requested byte range
 * 4. Drop expired candidates (and stale ones when serving stale is disabled)
 * 5. Order the rest with the configured {@link SelectionPolicy}
 * 6. Fetch bodies in that order until one is still in the store
 *
 * Stores may evict between steps 1 and 6; a candidate that no longer resolves is skipped.
 * Store failures are not caught here and reach the caller as they are.
 */
@Slf4j
@Service
public class CandidateSelector {

    private final FreshnessEvaluator freshnessEvaluator;
    private final VariaProperties properties;

    public CandidateSelector(FreshnessEvaluator freshnessEvaluator, VariaProperties properties) {
        this.freshnessEvaluator = freshnessEvaluator;
        this.properties = properties;
    }

    /**
     * Resolve the response for a request.
     *
     * @param store         store holding the candidates
     * @param key           request key (method, URL, body, bucket)
     * @param requestValues request header values, names not mentioned count as absent
     * @param range         requested byte range, {@code null} if the request has none
     * @param options       passed to the store untouched
     * @return the selected response, or a miss
     */
    public <R> Selection<R> resolve(ResponseStore<R> store, RequestKey key, VaryHeaders requestValues,
                                    ByteRange range, StoreOptions options) {
        List<Candidate<R>> candidates = store.listCandidates(key, options);
        if (candidates.isEmpty()) {
            log.debug("No candidates for key={}", key);
            return Selection.none(0, 0, 0);
        }

        List<Ranked<R>> ranked = rank(candidates, requestValues, range, freshnessEvaluator.now());
        log.debug("key={}: {} candidates, {} eligible", key, candidates.size(), ranked.size());

        int evicted = 0;
        for (Ranked<R> entry : ranked) {
            Candidate<R> candidate = entry.candidate;
            Optional<StoredResponse> response = store.getResponse(candidate.getRef(), options);
            if (response.isPresent()) {
                return Selection.<R>builder()
                        .resolved(new ResolvedResponse<>(candidate, response.get(), entry.freshness))
                        .listed(candidates.size())
                        .eligible(ranked.size())
                        .evicted(evicted)
                        .build();
            }
            evicted++;
            log.debug("Candidate {} for key={} was evicted, trying next", candidate.getRef(), key);
        }

        return Selection.none(candidates.size(), ranked.size(), evicted);
    }

    /**
     * Eligible candidates, best first.
     */
    <R> List<Ranked<R>> rank(List<Candidate<R>> candidates, VaryHeaders requestValues, ByteRange range,
                             Instant now) {
        List<Candidate<R>> varyMatching = candidates.stream()
                .filter(candidate -> VaryMatcher.matches(candidate.getVaryHeaders(), requestValues))
                .collect(Collectors.toList());

        boolean serveStale = properties.getSelection().isServeStale();
        Comparator<Ranked<R>> ordering = Comparator.<Ranked<R>, ResponseMetadata>comparing(
                entry -> entry.candidate.getMetadata(), properties.getSelection().getPolicy().ordering());

        // Stream.sorted is stable: full ties keep listing order
        return RangeMatcher.eligible(varyMatching, range).stream()
                .map(candidate -> new Ranked<>(candidate,
                        freshnessEvaluator.evaluate(candidate.getMetadata(), now)))
                .filter(entry -> entry.freshness == Freshness.FRESH
                        || (serveStale && entry.freshness == Freshness.STALE))
                .sorted(ordering)
                .collect(Collectors.toList());
    }

    static final class Ranked<R> {

        final Candidate<R> candidate;
        final Freshness freshness;

        Ranked(Candidate<R> candidate, Freshness freshness) {
            this.candidate = candidate;
            this.freshness = freshness;
        }
    }
}
