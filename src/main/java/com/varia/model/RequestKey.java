package com.varia.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Opaque key identifying a request by method, URL, body and bucket.
 *
 * Varying headers and byte ranges are not part of the key, so several stored
 * responses can share one request key.
 */
@Value(staticConstructor = "of")
public class RequestKey {

    @NonNull
    String value;

    @Override
    public String toString() {
        return value;
    }
}
