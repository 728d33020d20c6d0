package com.varia.service;

import com.varia.model.Freshness;
import com.varia.model.ResponseMetadata;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Classifies stored responses as fresh, stale-but-servable or expired.
 *
 * Only the three timestamps matter; {@code ttlSetBy} is ignored.
 */
@Component
public class FreshnessEvaluator {

    private final Clock clock;

    public FreshnessEvaluator(Clock clock) {
        this.clock = clock;
    }

    public Freshness evaluate(ResponseMetadata metadata) {
        return evaluate(metadata, clock.instant());
    }

    public Freshness evaluate(ResponseMetadata metadata, Instant now) {
        if (now.isBefore(metadata.getExpires())) {
            return Freshness.FRESH;
        }
        if (now.isBefore(metadata.getGrace())) {
            return Freshness.STALE;
        }
        return Freshness.EXPIRED;
    }

    public Instant now() {
        return clock.instant();
    }
}
