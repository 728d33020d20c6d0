package com.varia.service;

/**
 * Metadata handed to the cache breaks {@code created <= expires <= grace}.
 * A caller error: such metadata never reaches a store.
 */
public class InvalidMetadataException extends IllegalArgumentException {

    public InvalidMetadataException(String message) {
        super(message);
    }
}
