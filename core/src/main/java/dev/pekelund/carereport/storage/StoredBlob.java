package dev.pekelund.carereport.storage;

import java.time.Instant;
import java.util.Map;

public record StoredBlob(String key, byte[] content, String contentType, Map<String, String> metadata,
    Instant updated) {

    public StoredBlob {
        content = content != null ? content : new byte[0];
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }
}
