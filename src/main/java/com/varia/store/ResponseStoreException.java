package com.varia.store;

import lombok.Getter;

/**
 * A store operation failed (I/O error, store unavailable, corrupt document).
 *
 * Never used for a missing response, which is an empty result instead.
 */
@Getter
public class ResponseStoreException extends RuntimeException {

    private final String store;

    public ResponseStoreException(String store, String message) {
        super("[" + store + "] " + message);
        this.store = store;
    }

    public ResponseStoreException(String store, String message, Throwable cause) {
        super("[" + store + "] " + message, cause);
        this.store = store;
    }
}
