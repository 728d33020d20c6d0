package com.varia.model;

/**
 * Freshness state of a stored response at a given instant.
 */
public enum Freshness {

    /**
     * {@code now < expires}.
     */
    FRESH,

    /**
     * {@code expires <= now < grace}. Servable, the caller should revalidate in the background.
     */
    STALE,

    /**
     * {@code now >= grace}. Never selectable.
     */
    EXPIRED;

    public boolean isServable() {
        return this != EXPIRED;
    }
}
