package dev.pekelund.carereport.storage;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable key/value storage for report sources and their index entries.
 *
 * <p>Keys are slash separated paths. Every method throws {@link ReportStorageException} when the
 * backend cannot complete the operation.</p>
 */
public interface ReportBlobStore {

    void put(String key, byte[] content, String contentType, Map<String, String> metadata);

    Optional<StoredBlob> get(String key);

    List<BlobListing> list(String prefix);

    /**
     * @return {@code true} when a blob was removed, {@code false} when none existed
     */
    boolean delete(String key);

    /**
     * Short description of the backend for diagnostics, e.g. {@code gs://bucket}.
     */
    String describe();
}
