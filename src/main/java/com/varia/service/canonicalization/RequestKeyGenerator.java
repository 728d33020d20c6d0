package com.varia.service.canonicalization;

import com.varia.config.VariaProperties;
import com.varia.model.CacheRequest;
import com.varia.model.RequestKey;
import com.varia.model.UrlDigest;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Derives request keys and URL digests.
 *
 * Request key: SHA-256 over method, URL, body hash and bucket, each field length
 * prefixed so that no two different tuples share an input.
 * URL digest: SHA-256 over the URL alone.
 *
 * Target: same method, URL, body and bucket → same key, whatever the headers.
 */
@Service
public class RequestKeyGenerator {

    private final VariaProperties properties;

    public RequestKeyGenerator(VariaProperties properties) {
        this.properties = properties;
    }

    public RequestKey requestKey(CacheRequest request) {
        return requestKey(request.getMethod(), request.getUrl(), request.getBody(), request.getBucket());
    }

    /**
     * @param bucket partition tag, {@code null} for the configured default bucket
     * @return 64 hex chars key
     */
    public RequestKey requestKey(String method, String url, byte[] body, String bucket) {
        String effectiveBucket = bucket == null ? properties.getKeys().getDefaultBucket() : bucket;
        StringBuilder canonical = new StringBuilder();
        appendField(canonical, method.toUpperCase(Locale.ROOT));
        appendField(canonical, url);
        appendField(canonical, DigestUtils.sha256Hex(body));
        appendField(canonical, effectiveBucket);
        return RequestKey.of(DigestUtils.sha256Hex(canonical.toString()));
    }

    public UrlDigest urlDigest(String url) {
        return UrlDigest.of(DigestUtils.sha256Hex(url));
    }

    private static void appendField(StringBuilder canonical, String value) {
        canonical.append(value.length()).append(':').append(value).append(';');
    }
}
