package com.varia.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Opaque digest of a URL alone, used to invalidate every response stored for that URL.
 */
@Value(staticConstructor = "of")
public class UrlDigest {

    @NonNull
    String value;

    @Override
    public String toString() {
        return value;
    }
}
