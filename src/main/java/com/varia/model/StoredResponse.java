package com.varia.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Full stored response as returned by a store.
 */
@Value
@Builder
public class StoredResponse {

    int status;

    @Singular
    List<HttpHeader> headers;

    @NonNull
    ResponseBody body;

    @NonNull
    ResponseMetadata metadata;
}
