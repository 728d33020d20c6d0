package com.varia.service.selection;

import com.varia.model.ResponseMetadata;

import java.util.Comparator;

/**
 * Order in which eligible candidates are tried, best first.
 *
 * Candidates that tie on both timestamps keep the order the store listed them in.
 */
public enum SelectionPolicy {

    /**
     * Most recently created (or revalidated) first, then the one that stays fresh longest.
     */
    NEWEST_CREATED(Comparator.comparing(ResponseMetadata::getCreated).reversed()
            .thenComparing(Comparator.comparing(ResponseMetadata::getExpires).reversed())),

    /**
     * Longest remaining freshness first, then most recently created.
     */
    LONGEST_EXPIRES(Comparator.comparing(ResponseMetadata::getExpires).reversed()
            .thenComparing(Comparator.comparing(ResponseMetadata::getCreated).reversed()));

    private final Comparator<ResponseMetadata> ordering;

    SelectionPolicy(Comparator<ResponseMetadata> ordering) {
        this.ordering = ordering;
    }

    public Comparator<ResponseMetadata> ordering() {
        return ordering;
    }
}
