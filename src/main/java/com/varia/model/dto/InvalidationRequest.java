package com.varia.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body of the admin invalidation endpoints.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvalidationRequest {

    /**
     * URL to invalidate; its digest is computed server side.
     */
    private String url;

    /**
     * Precomputed URL digest, used when no URL is given.
     */
    private String digest;

    /**
     * Alternate keys to invalidate.
     */
    private List<String> keys;
}
