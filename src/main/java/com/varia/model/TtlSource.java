package com.varia.model;

/**
 * Where the freshness lifetime of a stored response came from.
 * Recorded for observability only, it never changes how freshness is evaluated.
 */
public enum TtlSource {

    /**
     * Explicit {@code cache-control} / {@code expires} response header.
     */
    HEADER,

    /**
     * Heuristic lifetime (e.g. a fraction of the age since {@code last-modified}).
     */
    HEURISTICS
}
