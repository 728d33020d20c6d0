package com.varia.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Application defined tag attached to stored responses for bulk invalidation.
 *
 * Example: every response rendering product 42 tagged with {@code product-42}.
 */
@Value(staticConstructor = "of")
public class AlternateKey {

    @NonNull
    String value;

    @Override
    public String toString() {
        return value;
    }
}
