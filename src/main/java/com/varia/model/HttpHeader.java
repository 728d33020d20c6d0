package com.varia.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Single response header field. Order and duplicates are preserved by the lists holding them.
 */
@Value(staticConstructor = "of")
public class HttpHeader {

    @NonNull
    String name;

    @NonNull
    String value;
}
