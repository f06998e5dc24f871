package dev.pekelund.carereport.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSystemReportBlobStoreTest {

    @TempDir
    Path directory;

    @Test
    void storesContentAndMetadata() {
        FileSystemReportBlobStore store = new FileSystemReportBlobStore(directory);

        store.put("reports/a", "hello".getBytes(StandardCharsets.UTF_8), "text/plain", Map.of("k", "v"));

        StoredBlob blob = store.get("reports/a").orElseThrow();
        assertThat(new String(blob.content(), StandardCharsets.UTF_8)).isEqualTo("hello");
        assertThat(blob.contentType()).isEqualTo("text/plain");
        assertThat(blob.metadata()).containsExactly(Map.entry("k", "v"));
        assertThat(blob.updated()).isNotNull();
    }

    @Test
    void listsByPrefixAndSurvivesNewInstances() {
        new FileSystemReportBlobStore(directory).put("index/1", new byte[0], null, Map.of("id", "1"));
        new FileSystemReportBlobStore(directory).put("source/1", new byte[] {1, 2, 3}, null, Map.of());

        FileSystemReportBlobStore reopened = new FileSystemReportBlobStore(directory);

        assertThat(reopened.list("index/")).singleElement().satisfies(listing -> {
            assertThat(listing.key()).isEqualTo("index/1");
            assertThat(listing.metadata()).containsEntry("id", "1");
        });
        assertThat(reopened.list("source/")).singleElement()
            .satisfies(listing -> assertThat(listing.size()).isEqualTo(3L));
    }

    @Test
    void deleteReportsWhetherSomethingWasRemoved() {
        FileSystemReportBlobStore store = new FileSystemReportBlobStore(directory);
        store.put("a", new byte[] {1}, null, null);

        assertThat(store.delete("a")).isTrue();
        assertThat(store.delete("a")).isFalse();
        assertThat(store.get("a")).isEmpty();
    }

    @Test
    void rejectsKeysEscapingTheDirectory() {
        FileSystemReportBlobStore store = new FileSystemReportBlobStore(directory.resolve("nested"));

        assertThatThrownBy(() -> store.put("../../outside", new byte[0], null, Map.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
