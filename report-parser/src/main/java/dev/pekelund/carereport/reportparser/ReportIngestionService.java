package dev.pekelund.carereport.reportparser;

import dev.pekelund.carereport.carelog.CareLogStore;
import dev.pekelund.carereport.carelog.CareLogStoreException;
import dev.pekelund.carereport.carelog.ExistingRecord;
import dev.pekelund.carereport.carelog.TimeRange;
import dev.pekelund.carereport.commit.CommitDispatcher;
import dev.pekelund.carereport.commit.CommitOutcome;
import dev.pekelund.carereport.commit.CommitResult;
import dev.pekelund.carereport.duplicates.DuplicateDetector;
import dev.pekelund.carereport.events.CandidateEvent;
import dev.pekelund.carereport.events.CareProfile;
import dev.pekelund.carereport.extraction.ExtractionCancelledException;
import dev.pekelund.carereport.extraction.ReportExtractionException;
import dev.pekelund.carereport.extraction.ReportExtractor;
import dev.pekelund.carereport.extraction.UnsupportedReportFormatException;
import dev.pekelund.carereport.pending.PendingReport;
import dev.pekelund.carereport.pending.PendingReportQueue;
import dev.pekelund.carereport.pending.ReportUpload;
import dev.pekelund.carereport.pending.RetryOutcome;
import dev.pekelund.carereport.review.CandidateEdit;
import dev.pekelund.carereport.review.ReviewSession;
import dev.pekelund.carereport.storage.ReportStorageException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Coordinates a report from upload to commit: extraction, reconciliation against history, review and
 * the hand-off to the pending queue whenever a step fails for a reason that may go away.
 */
public class ReportIngestionService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReportIngestionService.class);

    private final ReportExtractor extractor;
    private final DuplicateDetector duplicateDetector;
    private final CareLogStore careLogStore;
    private final CommitDispatcher commitDispatcher;
    private final PendingReportQueue pendingReportQueue;
    private final ReviewSessionRegistry sessionRegistry;
    private final ExecutorService ingestionExecutor;
    private final Duration historyPadding;
    private final Duration historyMaxWindow;

    public ReportIngestionService(ReportExtractor extractor, DuplicateDetector duplicateDetector,
        CareLogStore careLogStore, CommitDispatcher commitDispatcher, PendingReportQueue pendingReportQueue,
        ReviewSessionRegistry sessionRegistry, ExecutorService ingestionExecutor, Duration historyPadding,
        Duration historyMaxWindow) {

        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.duplicateDetector = Objects.requireNonNull(duplicateDetector, "duplicateDetector");
        this.careLogStore = Objects.requireNonNull(careLogStore, "careLogStore");
        this.commitDispatcher = Objects.requireNonNull(commitDispatcher, "commitDispatcher");
        this.pendingReportQueue = Objects.requireNonNull(pendingReportQueue, "pendingReportQueue");
        this.sessionRegistry = Objects.requireNonNull(sessionRegistry, "sessionRegistry");
        this.ingestionExecutor = Objects.requireNonNull(ingestionExecutor, "ingestionExecutor");
        this.historyPadding = historyPadding != null ? historyPadding : Duration.ZERO;
        this.historyMaxWindow = historyMaxWindow;
    }

    /**
     * Starts ingesting a report in the background.
     */
    public IngestionHandle submit(ReportUpload upload) {
        Objects.requireNonNull(upload, "upload");
        IngestionHandle handle = new IngestionHandle(UUID.randomUUID().toString());
        LOGGER.info("Accepted report '{}' as ingestion {}", upload.source().fileName(), handle.id());
        handle.attach(ingestionExecutor.submit(() -> run(handle, upload)));
        return handle;
    }

    /**
     * Ingests a report and waits for the outcome.
     */
    public IngestionOutcome ingest(ReportUpload upload) {
        return submit(upload).await();
    }

    /**
     * Queues a report that failed to ingest so it can be retried later.
     */
    public PendingReport saveForLater(ReportUpload upload, String reason) {
        Objects.requireNonNull(upload, "upload");
        String failure = StringUtils.hasText(reason) ? reason : "Saved for later";
        try (ReportProcessingMdc.Context ignored = ReportProcessingMdc.open(null)) {
            ReportProcessingMdc.attachProfile(upload.profile());
            ReportProcessingMdc.setStage("save-for-later");
            PendingReport report = pendingReportQueue.enqueue(upload, failure);
            LOGGER.info("Saved report '{}' for later as pending report {}", upload.source().fileName(), report.id());
            return report;
        }
    }

    public List<PendingReport> pendingReports() {
        return pendingReportQueue.list();
    }

    public boolean discardPending(String reportId) {
        return pendingReportQueue.discard(reportId);
    }

    /**
     * Retries a pending report and opens a review session for the candidates it yields.
     */
    public PendingRetryResult retryPending(String reportId) {
        try (ReportProcessingMdc.Context ignored = ReportProcessingMdc.open(reportId)) {
            ReportProcessingMdc.setStage("retry");
            RetryOutcome outcome = pendingReportQueue.retry(reportId);
            if (outcome.status() != RetryOutcome.Status.SUCCEEDED) {
                return unsuccessfulRetry(reportId, outcome);
            }

            ReportUpload upload = new ReportUpload(outcome.source(), outcome.report().profile());
            ReportProcessingMdc.attachProfile(upload.profile());
            List<CandidateEvent> candidates = new ArrayList<>(outcome.candidates());
            try {
                reconcile(upload.profile(), candidates);
            } catch (CareLogStoreException ex) {
                // the retry already removed the stored report
                PendingReport requeued = requeue(upload, ex);
                if (!ex.isTransientFailure()) {
                    LOGGER.error("History read failed after retrying {}; queued again as {}", reportId,
                        requeued.id(), ex);
                    throw ex;
                }
                LOGGER.warn("History unavailable after retrying {}; queued again as {}", reportId, requeued.id());
                return new PendingRetryResult(RetryOutcome.Status.FAILED, null, requeued, ex.getMessage(), true);
            }
            ReviewSession session = sessionRegistry.open(upload, candidates).session();
            return new PendingRetryResult(outcome.status(), session, null, null, false);
        }
    }

    private PendingReport requeue(ReportUpload upload, CareLogStoreException failure) {
        try {
            return pendingReportQueue.enqueue(upload, failure.getMessage());
        } catch (ReportStorageException ex) {
            ex.addSuppressed(failure);
            throw ex;
        }
    }

    private static PendingRetryResult unsuccessfulRetry(String reportId, RetryOutcome outcome) {
        if (outcome.status() == RetryOutcome.Status.NOT_FOUND) {
            return new PendingRetryResult(outcome.status(), null, null, "No pending report with id " + reportId, false);
        }
        if (outcome.status() == RetryOutcome.Status.SOURCE_MISSING) {
            return new PendingRetryResult(outcome.status(), null, outcome.report(),
                "The stored report content is missing; discard the pending report", false);
        }
        String message = outcome.failure().getMessage();
        return new PendingRetryResult(outcome.status(), null, outcome.report().withLastError(message), message,
            outcome.failure().isTransient());
    }

    public ReviewSession session(String sessionId) {
        return sessionRegistry.get(sessionId).session();
    }

    /**
     * Applies an edit to one candidate. Edits of time or kind run duplicate detection again for the
     * whole session.
     */
    public CandidateEvent editCandidate(String sessionId, int index, CandidateEdit edit) {
        ReviewSession session = session(sessionId);
        CandidateEvent edited = session.edit(index, edit);
        if (edit.affectsTiming()) {
            try (ReportProcessingMdc.Context ignored = ReportProcessingMdc.open(null)) {
                ReportProcessingMdc.attachSession(sessionId);
                ReportProcessingMdc.setStage("duplicate-check");
                synchronized (session) {
                    reconcile(session.profile(), session.candidates());
                }
            } catch (CareLogStoreException ex) {
                LOGGER.warn("Could not re-check duplicates for session {} after edit: {}", sessionId,
                    ex.getMessage());
            }
        }
        return edited;
    }

    public CandidateEvent confirm(String sessionId, int index) {
        return session(sessionId).confirm(index);
    }

    public CandidateEvent reject(String sessionId, int index) {
        return session(sessionId).reject(index);
    }

    public ReviewSession confirmAll(String sessionId) {
        ReviewSession session = session(sessionId);
        session.confirmAll();
        return session;
    }

    public ReviewSession rejectAll(String sessionId) {
        ReviewSession session = session(sessionId);
        session.rejectAll();
        return session;
    }

    /**
     * Writes the confirmed candidates of a session. Candidates written by an earlier commit of the same
     * session are not written again, and commits of one session run one at a time.
     */
    public CommitSummary commit(String sessionId) {
        ReviewSessionRegistry.Entry entry = sessionRegistry.get(sessionId);
        ReviewSession session = entry.session();
        try (ReportProcessingMdc.Context ignored = ReportProcessingMdc.open(null)) {
            ReportProcessingMdc.attachSession(sessionId);
            ReportProcessingMdc.attachProfile(session.profile());
            ReportProcessingMdc.setStage("commit");

            synchronized (entry) {
                return commitConfirmed(sessionId, entry);
            }
        }
    }

    private CommitSummary commitConfirmed(String sessionId, ReviewSessionRegistry.Entry entry) {
        ReviewSession session = entry.session();
        List<CandidateEvent> pending = new ArrayList<>();
        for (CandidateEvent candidate : session.confirmedCandidates()) {
            if (!entry.isCommitted(candidate)) {
                pending.add(candidate);
            }
        }
        CommitResult result = commitDispatcher.commit(session.profile(), pending);
        for (CommitOutcome outcome : result.outcomes()) {
            if (outcome.succeeded()) {
                entry.markCommitted(outcome.candidate());
            }
        }
        LOGGER.info("Committed {} of {} confirmed events for session {}", result.successes().size(),
            pending.size(), sessionId);

        PendingReport queued = null;
        if (result.hasTransientFailures() && entry.queuedReportId() == null) {
            String reason = result.failures().stream()
                .filter(CommitOutcome::transientFailure)
                .map(CommitOutcome::reason)
                .findFirst()
                .orElse("Care log unavailable");
            queued = pendingReportQueue.enqueue(entry.upload(), "Commit interrupted: " + reason);
            entry.markQueued(queued.id());
            LOGGER.warn("Care log unavailable while committing session {}; report queued as {}", sessionId,
                queued.id());
        }

        boolean closed = !result.hasFailures();
        if (closed) {
            if (entry.queuedReportId() != null) {
                pendingReportQueue.discard(entry.queuedReportId());
                LOGGER.info("Discarded pending report {} after session {} committed completely",
                    entry.queuedReportId(), sessionId);
            }
            sessionRegistry.close(sessionId);
        }
        return new CommitSummary(sessionId, result, closed, queued);
    }

    private IngestionOutcome run(IngestionHandle handle, ReportUpload upload) {
        try (ReportProcessingMdc.Context ignored = ReportProcessingMdc.open(handle.id())) {
            ReportProcessingMdc.attachProfile(upload.profile());
            ReportProcessingMdc.setStage("extraction");

            List<CandidateEvent> candidates;
            try {
                candidates = new ArrayList<>(extractor.extract(upload.source()));
            } catch (ExtractionCancelledException ex) {
                LOGGER.info("Extraction of ingestion {} was cancelled", handle.id());
                return IngestionOutcome.cancelled();
            } catch (UnsupportedReportFormatException ex) {
                handle.finish();
                throw ex;
            } catch (ReportExtractionException ex) {
                if (!handle.beginPersisting()) {
                    return IngestionOutcome.cancelled();
                }
                return handleExtractionFailure(handle, upload, ex);
            }

            if (!handle.beginPersisting()) {
                LOGGER.info("Ingestion {} was cancelled before its results were kept", handle.id());
                return IngestionOutcome.cancelled();
            }

            ReportProcessingMdc.setStage("duplicate-check");
            try {
                reconcile(upload.profile(), candidates);
            } catch (CareLogStoreException ex) {
                if (!ex.isTransientFailure()) {
                    handle.finish();
                    throw ex;
                }
                PendingReport report = pendingReportQueue.enqueue(upload, ex.getMessage());
                handle.finish();
                LOGGER.warn("History unavailable for ingestion {}; queued as pending report {}", handle.id(),
                    report.id());
                return IngestionOutcome.queued(report, ex.getMessage());
            }

            ReviewSession session = sessionRegistry.open(upload, candidates).session();
            ReportProcessingMdc.attachSession(session.id());
            handle.finish();
            LOGGER.info("Ingestion {} produced {} candidates ({} possible duplicates)", handle.id(),
                candidates.size(), session.summary().duplicates());
            return IngestionOutcome.extracted(session);
        }
    }

    private IngestionOutcome handleExtractionFailure(IngestionHandle handle, ReportUpload upload,
        ReportExtractionException failure) {

        try {
            if (failure.isTransient()) {
                ReportProcessingMdc.setStage("queue");
                PendingReport report = pendingReportQueue.enqueue(upload, failure.getMessage());
                LOGGER.warn("Extraction of ingestion {} failed transiently ({}); queued as pending report {}",
                    handle.id(), failure.getMessage(), report.id());
                return IngestionOutcome.queued(report, failure.getMessage());
            }
            LOGGER.warn("Extraction of ingestion {} returned an unusable result: {}", handle.id(),
                failure.getMessage());
            return IngestionOutcome.malformed(failure.getMessage());
        } finally {
            handle.finish();
        }
    }

    private void reconcile(CareProfile profile, List<CandidateEvent> candidates) {
        TimeRange window = historyWindow(candidates);
        if (window == null) {
            return;
        }
        List<ExistingRecord> history = careLogStore.query(profile, window);
        duplicateDetector.detect(candidates, history);
    }

    private TimeRange historyWindow(List<CandidateEvent> candidates) {
        Instant earliest = null;
        Instant latest = null;
        for (CandidateEvent candidate : candidates) {
            Instant start = candidate.startTime();
            Instant end = candidate.endTime() != null ? candidate.endTime() : start;
            earliest = earliest == null || start.isBefore(earliest) ? start : earliest;
            latest = latest == null || end.isAfter(latest) ? end : latest;
        }
        if (earliest == null) {
            return null;
        }
        return new TimeRange(earliest, latest).padded(historyPadding, historyMaxWindow);
    }
}
