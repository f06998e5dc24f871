package dev.pekelund.carereport.storage;

import java.time.Instant;
import java.util.Map;

/**
 * Listing entry: everything about a blob except its content.
 */
public record BlobListing(String key, long size, String contentType, Map<String, String> metadata,
    Instant updated) {

    public BlobListing {
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }
}
