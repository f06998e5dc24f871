package dev.pekelund.carereport.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.api.gax.paging.Page;
import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class GcsReportBlobStoreTest {

    private Storage storage;
    private GcsReportBlobStore store;

    @BeforeEach
    void setUp() {
        storage = mock(Storage.class);
        store = new GcsReportBlobStore(storage, "test-bucket");
    }

    @Test
    void writesBlobWithMetadataAndContentType() {
        store.put("pending-reports/index/1", new byte[0], "application/x-pending-report", Map.of("pending.id", "1"));

        ArgumentCaptor<BlobInfo> captor = ArgumentCaptor.forClass(BlobInfo.class);
        verify(storage).create(captor.capture(), any(byte[].class));
        BlobInfo info = captor.getValue();
        assertThat(info.getBlobId()).isEqualTo(BlobId.of("test-bucket", "pending-reports/index/1"));
        assertThat(info.getContentType()).isEqualTo("application/x-pending-report");
        assertThat(info.getMetadata()).containsEntry("pending.id", "1");
    }

    @Test
    void wrapsStorageFailuresWithTheFailingObject() {
        when(storage.create(any(BlobInfo.class), any(byte[].class)))
            .thenThrow(new StorageException(503, "Service Unavailable"));

        assertThatThrownBy(() -> store.put("pending-reports/source/1", new byte[] {1}, null, Map.of()))
            .isInstanceOf(ReportStorageException.class)
            .hasMessageContaining("gs://test-bucket/pending-reports/source/1");
    }

    @Test
    void listsNonDirectoryBlobsUnderPrefix() {
        Blob indexBlob = mock(Blob.class);
        when(indexBlob.isDirectory()).thenReturn(false);
        when(indexBlob.getName()).thenReturn("pending-reports/index/1");
        when(indexBlob.getSize()).thenReturn(0L);
        when(indexBlob.getMetadata()).thenReturn(Map.of("pending.id", "1"));
        when(indexBlob.getUpdateTimeOffsetDateTime())
            .thenReturn(OffsetDateTime.ofInstant(Instant.parse("2024-03-04T10:00:00Z"), ZoneOffset.UTC));
        Blob directory = mock(Blob.class);
        when(directory.isDirectory()).thenReturn(true);

        @SuppressWarnings("unchecked")
        Page<Blob> page = mock(Page.class);
        when(page.iterateAll()).thenReturn(List.of(indexBlob, directory));
        when(storage.list(eq("test-bucket"), any(Storage.BlobListOption.class))).thenReturn(page);

        List<BlobListing> listings = store.list("pending-reports/index/");

        assertThat(listings).singleElement().satisfies(listing -> {
            assertThat(listing.key()).isEqualTo("pending-reports/index/1");
            assertThat(listing.metadata()).containsEntry("pending.id", "1");
            assertThat(listing.updated()).isEqualTo(Instant.parse("2024-03-04T10:00:00Z"));
        });
    }

    @Test
    void missingBlobIsEmpty() {
        when(storage.get(BlobId.of("test-bucket", "missing"))).thenReturn(null);

        assertThat(store.get("missing")).isEmpty();
    }

    @Test
    void readsContentOfExistingBlob() {
        Blob blob = mock(Blob.class);
        when(blob.getContent()).thenReturn(new byte[] {7});
        when(blob.getContentType()).thenReturn("image/png");
        when(storage.get(BlobId.of("test-bucket", "pending-reports/source/1"))).thenReturn(blob);

        StoredBlob stored = store.get("pending-reports/source/1").orElseThrow();

        assertThat(stored.content()).containsExactly(7);
        assertThat(stored.contentType()).isEqualTo("image/png");
    }
}
