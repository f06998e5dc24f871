package dev.pekelund.carereport.storage;

import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

public class GcsReportBlobStore implements ReportBlobStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(GcsReportBlobStore.class);

    private final Storage storage;
    private final String bucket;

    public GcsReportBlobStore(Storage storage, String bucket) {
        this.storage = Objects.requireNonNull(storage, "storage");
        Assert.isTrue(StringUtils.hasText(bucket), "A bucket is required");
        this.bucket = bucket;
    }

    @Override
    public void put(String key, byte[] content, String contentType, Map<String, String> metadata) {
        BlobInfo blobInfo = BlobInfo.newBuilder(BlobId.of(bucket, key))
            .setContentType(StringUtils.hasText(contentType) ? contentType : "application/octet-stream")
            .setMetadata(metadata != null ? metadata : Map.of())
            .build();
        try {
            storage.create(blobInfo, content != null ? content : new byte[0]);
            LOGGER.debug("Wrote gs://{}/{}", bucket, key);
        } catch (StorageException ex) {
            throw new ReportStorageException("Failed to write gs://%s/%s".formatted(bucket, key), ex);
        }
    }

    @Override
    public Optional<StoredBlob> get(String key) {
        try {
            Blob blob = storage.get(BlobId.of(bucket, key));
            if (blob == null) {
                return Optional.empty();
            }
            return Optional.of(new StoredBlob(key, blob.getContent(), blob.getContentType(), blob.getMetadata(),
                updated(blob)));
        } catch (StorageException ex) {
            if (ex.getCode() == 404) {
                return Optional.empty();
            }
            throw new ReportStorageException("Failed to read gs://%s/%s".formatted(bucket, key), ex);
        }
    }

    @Override
    public List<BlobListing> list(String prefix) {
        try {
            Iterable<Blob> blobs = storage.list(bucket, Storage.BlobListOption.prefix(prefix)).iterateAll();
            List<BlobListing> listings = new ArrayList<>();
            for (Blob blob : blobs) {
                if (blob.isDirectory()) {
                    continue;
                }
                Long size = blob.getSize();
                listings.add(new BlobListing(blob.getName(), size != null ? size : 0L, blob.getContentType(),
                    blob.getMetadata(), updated(blob)));
            }
            return listings;
        } catch (StorageException ex) {
            throw new ReportStorageException("Unable to list gs://%s/%s".formatted(bucket, prefix), ex);
        }
    }

    @Override
    public boolean delete(String key) {
        try {
            return storage.delete(BlobId.of(bucket, key));
        } catch (StorageException ex) {
            throw new ReportStorageException("Failed to delete gs://%s/%s".formatted(bucket, key), ex);
        }
    }

    @Override
    public String describe() {
        return "gs://" + bucket;
    }

    private static Instant updated(Blob blob) {
        OffsetDateTime updateTime = blob.getUpdateTimeOffsetDateTime();
        return updateTime != null ? updateTime.toInstant() : null;
    }
}
