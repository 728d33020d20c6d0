package com.varia.service.selection;

import com.varia.model.Candidate;
import com.varia.model.Freshness;
import com.varia.model.StoredResponse;
import lombok.NonNull;
import lombok.Value;

/**
 * The variant chosen for a request, with its body loaded.
 */
@Value
public class ResolvedResponse<R> {

    @NonNull
    Candidate<R> candidate;

    @NonNull
    StoredResponse response;

    /**
     * {@link Freshness#FRESH} or {@link Freshness#STALE}, never expired.
     */
    @NonNull
    Freshness freshness;

    public R getRef() {
        return candidate.getRef();
    }
}
