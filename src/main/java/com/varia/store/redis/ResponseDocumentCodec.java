package com.varia.store.redis;

import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.jsontype.BasicPolymorphicTypeValidator;
import com.varia.model.AlternateKey;
import com.varia.model.Candidate;
import com.varia.model.HttpHeader;
import com.varia.model.OriginResponse;
import com.varia.model.RequestKey;
import com.varia.model.ResponseMetadata;
import com.varia.model.UrlDigest;
import com.varia.model.VaryHeaders;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Maps response heads to gzip compressed JSON and back.
 */
public class ResponseDocumentCodec {

    private final ObjectMapper objectMapper;

    public ResponseDocumentCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .activateDefaultTyping(BasicPolymorphicTypeValidator.builder()
                                .allowIfSubType("com.varia.model.")
                                .allowIfSubType("java.lang.")
                                .allowIfSubType("java.util.")
                                .allowIfSubType("java.time.")
                                .allowIfSubTypeIsArray()
                                .build(),
                        ObjectMapper.DefaultTyping.JAVA_LANG_OBJECT);
    }

    public ResponseHeadDocument toDocument(RequestKey key, UrlDigest urlDigest, VaryHeaders varyHeaders,
                                           OriginResponse response, ResponseMetadata metadata) {
        Map<String, String> present = new LinkedHashMap<>();
        List<String> absent = new ArrayList<>();
        varyHeaders.asMap().forEach((name, value) -> {
            if (value == null) {
                absent.add(name);
            } else {
                present.put(name, value);
            }
        });

        return ResponseHeadDocument.builder()
                .requestKey(key.getValue())
                .urlDigest(urlDigest.getValue())
                .status(response.getStatus())
                .headers(response.getHeaders().stream()
                        .map(header -> new ResponseHeadDocument.HeaderEntry(header.getName(), header.getValue()))
                        .collect(Collectors.toList()))
                .varyHeaders(present)
                .absentVaryHeaders(absent)
                .metadata(ResponseHeadDocument.MetadataDocument.builder()
                        .created(metadata.getCreated())
                        .expires(metadata.getExpires())
                        .grace(metadata.getGrace())
                        .ttlSetBy(metadata.getTtlSetBy())
                        .parsedHeaders(new LinkedHashMap<>(metadata.getParsedHeaders()))
                        .alternateKeys(metadata.getAlternateKeys().stream()
                                .map(AlternateKey::getValue)
                                .collect(Collectors.toList()))
                        .build())
                .build();
    }

    public <R> Candidate<R> toCandidate(R ref, ResponseHeadDocument document) {
        return Candidate.<R>builder()
                .ref(ref)
                .status(document.getStatus())
                .headers(headers(document))
                .varyHeaders(varyHeaders(document))
                .metadata(metadata(document))
                .build();
    }

    public List<HttpHeader> headers(ResponseHeadDocument document) {
        if (document.getHeaders() == null) {
            return List.of();
        }
        return document.getHeaders().stream()
                .map(entry -> HttpHeader.of(entry.getName(), entry.getValue()))
                .collect(Collectors.toList());
    }

    public VaryHeaders varyHeaders(ResponseHeadDocument document) {
        VaryHeaders.Builder builder = VaryHeaders.builder();
        if (document.getVaryHeaders() != null) {
            builder.putAll(document.getVaryHeaders());
        }
        if (document.getAbsentVaryHeaders() != null) {
            document.getAbsentVaryHeaders().forEach(builder::absent);
        }
        return builder.build();
    }

    public ResponseMetadata metadata(ResponseHeadDocument document) {
        ResponseHeadDocument.MetadataDocument metadata = document.getMetadata();
        ResponseMetadata.ResponseMetadataBuilder builder = ResponseMetadata.builder()
                .created(metadata.getCreated())
                .expires(metadata.getExpires())
                .grace(metadata.getGrace());
        if (metadata.getTtlSetBy() != null) {
            builder.ttlSetBy(metadata.getTtlSetBy());
        }
        if (metadata.getParsedHeaders() != null) {
            builder.parsedHeaders(metadata.getParsedHeaders());
        }
        if (metadata.getAlternateKeys() != null) {
            metadata.getAlternateKeys().forEach(key -> builder.alternateKey(AlternateKey.of(key)));
        }
        return builder.build();
    }

    /**
     * Serialize and GZIP compress a response head.
     *
     * @throws IllegalArgumentException if the head could not be decoded again, e.g. because a
     *                                  parsed header value has a type that may not be read
     */
    public byte[] encode(ResponseHeadDocument document) throws IOException {
        byte[] json = objectMapper.writeValueAsBytes(document);
        checkReadable(json);
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            try (GZIPOutputStream gzipOut = new GZIPOutputStream(baos)) {
                gzipOut.write(json);
            }
            return baos.toByteArray();
        }
    }

    private void checkReadable(byte[] json) throws IOException {
        try {
            objectMapper.readValue(json, ResponseHeadDocument.class);
        } catch (JsonMappingException e) {
            throw new IllegalArgumentException("Response head cannot be read back: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Decompress and deserialize a response head.
     */
    public ResponseHeadDocument decode(byte[] compressed) throws IOException {
        try (GZIPInputStream gzipIn = new GZIPInputStream(new ByteArrayInputStream(compressed))) {
            return objectMapper.readValue(gzipIn.readAllBytes(), ResponseHeadDocument.class);
        }
    }
}
