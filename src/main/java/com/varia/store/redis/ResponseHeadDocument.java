package com.varia.store.redis;

import com.varia.model.TtlSource;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Redis representation of everything about a stored response except its body.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResponseHeadDocument implements Serializable {

    private static final long serialVersionUID = 1L;

    private String requestKey;

    private String urlDigest;

    private int status;

    private List<HeaderEntry> headers;

    /**
     * Vary headers that were present when the response was stored.
     */
    private Map<String, String> varyHeaders;

    /**
     * Vary headers that were absent when the response was stored.
     */
    private List<String> absentVaryHeaders;

    private MetadataDocument metadata;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class HeaderEntry implements Serializable {

        private static final long serialVersionUID = 1L;

        private String name;

        private String value;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MetadataDocument implements Serializable {

        private static final long serialVersionUID = 1L;

        private Instant created;

        private Instant expires;

        private Instant grace;

        private TtlSource ttlSetBy;

        /**
         * Written with type information so parsed values come back as the same Java types.
         */
        private Map<String, Object> parsedHeaders;

        private List<String> alternateKeys;
    }
}
