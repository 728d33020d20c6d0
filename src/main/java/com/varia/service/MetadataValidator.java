package com.varia.service;

import com.varia.model.ResponseMetadata;
import org.springframework.stereotype.Component;

/**
 * Checks response metadata before it is handed to a store.
 */
@Component
public class MetadataValidator {

    /**
     * @throws InvalidMetadataException if {@code created > expires} or {@code expires > grace}
     */
    public void validate(ResponseMetadata metadata) {
        if (metadata.getCreated().isAfter(metadata.getExpires())) {
            throw new InvalidMetadataException("created " + metadata.getCreated()
                    + " is after expires " + metadata.getExpires());
        }
        if (metadata.getExpires().isAfter(metadata.getGrace())) {
            throw new InvalidMetadataException("expires " + metadata.getExpires()
                    + " is after grace " + metadata.getGrace());
        }
    }
}
