package dev.pekelund.carereport.pending;

import dev.pekelund.carereport.events.CandidateEvent;
import dev.pekelund.carereport.extraction.ExtractionCancelledException;
import dev.pekelund.carereport.extraction.ReportExtractionException;
import dev.pekelund.carereport.extraction.ReportExtractor;
import dev.pekelund.carereport.extraction.ReportSource;
import dev.pekelund.carereport.storage.BlobListing;
import dev.pekelund.carereport.storage.ReportBlobStore;
import dev.pekelund.carereport.storage.ReportStorageException;
import dev.pekelund.carereport.storage.StoredBlob;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Durable queue of reports awaiting another extraction attempt.
 *
 * <p>A report consists of two blobs: the source bytes under {@code pending-reports/source/<id>} and an
 * empty index entry under {@code pending-reports/index/<id>} whose metadata describes the report. The
 * index entry is written last and removed last on discard, so a report is only listed while its source
 * is expected to exist. Nothing is cached; {@link #list()} always reads the store.</p>
 *
 * <p>Operations on the same report id are serialised. Different ids proceed concurrently.</p>
 */
public class PendingReportQueue {

    static final String SOURCE_PREFIX = "pending-reports/source/";
    static final String INDEX_PREFIX = "pending-reports/index/";

    private static final Logger LOGGER = LoggerFactory.getLogger(PendingReportQueue.class);
    private static final String INDEX_CONTENT_TYPE = "application/x-pending-report";

    private final ReportBlobStore store;
    private final ReportExtractor extractor;
    private final Clock clock;
    private final Map<String, IdLock> locks = new ConcurrentHashMap<>();

    public PendingReportQueue(ReportBlobStore store, ReportExtractor extractor) {
        this(store, extractor, Clock.systemUTC());
    }

    public PendingReportQueue(ReportBlobStore store, ReportExtractor extractor, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Stores the upload durably and returns the new pending report.
     *
     * @throws ReportStorageException when either blob could not be written; no partial report remains
     */
    public PendingReport enqueue(ReportUpload upload, String failure) {
        Objects.requireNonNull(upload, "upload");
        String id = UUID.randomUUID().toString();
        ReportSource source = upload.source();
        PendingReport report = new PendingReport(id, Instant.now(clock), SOURCE_PREFIX + id, source.fileName(),
            source.contentType(), source.format(), source.reportDate(), source.zone(), upload.profile(), failure);

        return withLock(id, () -> {
            try {
                store.put(report.sourceReference(), source.content(), source.contentType(), Map.of());
            } catch (ReportStorageException ex) {
                throw new ReportStorageException("Failed to write pending report source for " + id, ex);
            }
            try {
                writeIndex(report);
            } catch (ReportStorageException ex) {
                rollbackSource(report);
                throw new ReportStorageException("Failed to write pending report index for " + id, ex);
            }
            LOGGER.info("Queued pending report {} ({}, {} bytes): {}", id, source.fileName(), source.size(), failure);
            return report;
        });
    }

    /**
     * Every pending report in the store, newest first.
     */
    public List<PendingReport> list() {
        List<PendingReport> reports = new ArrayList<>();
        for (BlobListing listing : store.list(INDEX_PREFIX)) {
            try {
                reports.add(PendingReport.fromMetadata(listing.metadata()));
            } catch (IllegalArgumentException ex) {
                LOGGER.warn("Skipping unreadable pending report index {}: {}", listing.key(), ex.getMessage());
            }
        }
        reports.sort(Comparator.comparing(PendingReport::createdAt).reversed());
        return reports;
    }

    public Optional<PendingReport> find(String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        return store.get(INDEX_PREFIX + id).map(blob -> PendingReport.fromMetadata(blob.metadata()));
    }

    /**
     * Runs extraction again on the stored source. A successful retry removes the report; a failed one
     * keeps it and records the new error.
     */
    public RetryOutcome retry(String id) {
        if (id == null || id.isBlank()) {
            return RetryOutcome.notFound();
        }
        return withLock(id, () -> {
            Optional<PendingReport> found = find(id);
            if (found.isEmpty()) {
                return RetryOutcome.notFound();
            }
            PendingReport report = found.get();
            Optional<StoredBlob> sourceBlob = store.get(report.sourceReference());
            if (sourceBlob.isEmpty()) {
                LOGGER.warn("Pending report {} has no stored source at {}", id, report.sourceReference());
                return RetryOutcome.sourceMissing(report);
            }

            ReportSource source = new ReportSource(sourceBlob.get().content(), report.fileName(), report.contentType(),
                report.format(), report.reportDate(), report.zone());
            List<CandidateEvent> candidates;
            try {
                candidates = extractor.extract(source);
            } catch (ExtractionCancelledException ex) {
                throw ex;
            } catch (ReportExtractionException ex) {
                PendingReport updated = report.withLastError(ex.getMessage());
                try {
                    writeIndex(updated);
                } catch (ReportStorageException storageEx) {
                    LOGGER.warn("Unable to record retry failure for pending report {}: {}", id,
                        storageEx.getMessage());
                    updated = report;
                }
                LOGGER.info("Retry of pending report {} failed: {}", id, ex.getMessage());
                return RetryOutcome.failed(updated, source, ex);
            }

            // the index goes first so a failure here leaves the report intact for another retry
            try {
                store.delete(INDEX_PREFIX + id);
            } catch (ReportStorageException ex) {
                throw new ReportStorageException("Failed to delete pending report index for " + id, ex);
            }
            try {
                store.delete(report.sourceReference());
            } catch (ReportStorageException ex) {
                LOGGER.warn("Orphaned pending report source {} after successful retry: {}", report.sourceReference(),
                    ex.getMessage());
            }
            LOGGER.info("Retry of pending report {} extracted {} candidate(s)", id, candidates.size());
            return RetryOutcome.succeeded(report, source, candidates);
        });
    }

    /**
     * Deletes the source bytes and then the index entry. Unknown ids are ignored.
     *
     * @return {@code true} when a report was discarded
     */
    public boolean discard(String id) {
        if (id == null || id.isBlank()) {
            return false;
        }
        return withLock(id, () -> {
            Optional<PendingReport> found = find(id);
            if (found.isEmpty()) {
                LOGGER.debug("Ignoring discard of unknown pending report {}", id);
                return false;
            }
            PendingReport report = found.get();
            try {
                store.delete(report.sourceReference());
            } catch (ReportStorageException ex) {
                throw new ReportStorageException("Failed to delete pending report source for " + id, ex);
            }
            try {
                store.delete(INDEX_PREFIX + id);
            } catch (ReportStorageException ex) {
                throw new ReportStorageException("Failed to delete pending report index for " + id, ex);
            }
            LOGGER.info("Discarded pending report {}", id);
            return true;
        });
    }

    private void writeIndex(PendingReport report) {
        store.put(INDEX_PREFIX + report.id(), new byte[0], INDEX_CONTENT_TYPE, report.toMetadata());
    }

    private void rollbackSource(PendingReport report) {
        try {
            store.delete(report.sourceReference());
            LOGGER.warn("Rolled back pending report source {} after index write failure", report.sourceReference());
        } catch (ReportStorageException ex) {
            LOGGER.error("Failed to roll back pending report source {} after index write failure",
                report.sourceReference(), ex);
        }
    }

    /**
     * Runs {@code action} while holding the lock of {@code id}. A lock lives only while some caller
     * holds or waits for it.
     */
    private <T> T withLock(String id, Supplier<T> action) {
        IdLock idLock = locks.compute(id, (key, existing) -> {
            IdLock acquired = existing != null ? existing : new IdLock();
            acquired.users++;
            return acquired;
        });
        idLock.lock.lock();
        try {
            return action.get();
        } finally {
            idLock.lock.unlock();
            locks.computeIfPresent(id, (key, existing) -> --existing.users == 0 ? null : existing);
        }
    }

    int activeLocks() {
        return locks.size();
    }

    private static final class IdLock {

        private final ReentrantLock lock = new ReentrantLock();

        // guarded by the map's per-key compute
        private int users;
    }
}
