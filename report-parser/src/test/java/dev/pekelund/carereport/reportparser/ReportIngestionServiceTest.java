package dev.pekelund.carereport.reportparser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.carereport.carelog.BottleFeedRecord;
import dev.pekelund.carereport.carelog.CareLogStore;
import dev.pekelund.carereport.carelog.CareLogStoreException;
import dev.pekelund.carereport.carelog.CareRecord;
import dev.pekelund.carereport.carelog.DiaperRecord;
import dev.pekelund.carereport.carelog.DiaperType;
import dev.pekelund.carereport.carelog.ExistingRecord;
import dev.pekelund.carereport.carelog.InMemoryCareLogStore;
import dev.pekelund.carereport.carelog.RecordReference;
import dev.pekelund.carereport.carelog.SleepRecord;
import dev.pekelund.carereport.carelog.TimeRange;
import dev.pekelund.carereport.commit.CommitDispatcher;
import dev.pekelund.carereport.duplicates.DuplicateDetector;
import dev.pekelund.carereport.events.CandidateEvent;
import dev.pekelund.carereport.events.CareProfile;
import dev.pekelund.carereport.events.EventKind;
import dev.pekelund.carereport.extraction.ExtractionCancelledException;
import dev.pekelund.carereport.extraction.ReportExtractor;
import dev.pekelund.carereport.extraction.ReportFormat;
import dev.pekelund.carereport.extraction.ReportSource;
import dev.pekelund.carereport.extraction.ReportTextRecognizer;
import dev.pekelund.carereport.extraction.TimeLimitedReportExtractor;
import dev.pekelund.carereport.normalize.QuantityUnit;
import dev.pekelund.carereport.pending.PendingReportQueue;
import dev.pekelund.carereport.pending.ReportUpload;
import dev.pekelund.carereport.pending.RetryOutcome;
import dev.pekelund.carereport.reportparser.googleai.GeminiClient;
import dev.pekelund.carereport.reportparser.googleai.GeminiClientException;
import dev.pekelund.carereport.reportparser.googleai.GeminiReportExtractor;
import dev.pekelund.carereport.reportparser.googleai.GoogleAiGeminiChatOptions;
import dev.pekelund.carereport.review.CandidateEdit;
import dev.pekelund.carereport.review.ReviewSession;
import dev.pekelund.carereport.storage.FileSystemReportBlobStore;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ReportIngestionServiceTest {

    private static final Instant NOW = Instant.parse("2024-03-13T07:00:00Z");
    private static final LocalDate REPORT_DATE = LocalDate.of(2024, 3, 12);
    private static final CareProfile PROFILE = new CareProfile("owner-1", "child-1");
    private static final String REPORT_TEXT =
        "7:00 PM nap, woke 8:30 PM. Bottle 4 oz at 9:15 PM. Wet diaper 10:00 PM.";
    private static final String EXTRACTED_EVENTS = """
        [
          {"type": "sleep", "startTime": "19:00", "endTime": "20:30", "quantity": null, "details": null},
          {"type": "bottle", "startTime": "21:15", "endTime": null, "quantity": "4 oz", "details": null},
          {"type": "diaper", "startTime": "22:00", "isWet": true, "isDirty": false}
        ]
        """;

    @TempDir
    Path tempDir;

    private final GeminiClient geminiClient = mock(GeminiClient.class);
    private final FlakyCareLogStore careLogStore = new FlakyCareLogStore();
    private final ExecutorService ingestionExecutor = Executors.newCachedThreadPool();
    private final ExecutorService extractionExecutor = Executors.newCachedThreadPool();

    private PendingReportQueue pendingReportQueue;
    private ReviewSessionRegistry sessionRegistry;
    private ReportIngestionService service;

    @BeforeEach
    void setUp() {
        ReportExtractor extractor = new GeminiReportExtractor(geminiClient, mock(ReportTextRecognizer.class),
            new ObjectMapper(), GoogleAiGeminiChatOptions.builder().model("gemini-test").build());
        service = createService(extractor);
    }

    @AfterEach
    void tearDown() {
        ingestionExecutor.shutdownNow();
        extractionExecutor.shutdownNow();
    }

    @Test
    void extractsReviewsAndCommitsAnEveningReport() {
        givenGeminiReturns(EXTRACTED_EVENTS);

        IngestionOutcome outcome = service.ingest(upload());

        assertThat(outcome.status()).isEqualTo(IngestionOutcome.Status.EXTRACTED);
        ReviewSession session = outcome.session();
        assertThat(session.candidates()).extracting(CandidateEvent::kind)
            .containsExactly(EventKind.SLEEP, EventKind.FEED, EventKind.DIAPER);
        assertThat(session.summary().duplicates()).isZero();

        service.confirmAll(session.id());
        CommitSummary summary = service.commit(session.id());

        assertThat(summary.sessionClosed()).isTrue();
        assertThat(summary.result().successes()).hasSize(3);
        assertThat(summary.queuedReport()).isNull();

        List<CareRecord> records = careLogStore.delegate.records(PROFILE);
        assertThat(records).hasSize(3);
        assertThat(records.get(0)).isEqualTo(new SleepRecord(at("19:00"), at("20:30")));
        BottleFeedRecord bottle = (BottleFeedRecord) records.get(1);
        assertThat(bottle.timestamp()).isEqualTo(at("21:15"));
        assertThat(bottle.amount()).isEqualByComparingTo(new BigDecimal("4"));
        assertThat(bottle.unit()).isEqualTo(QuantityUnit.OUNCE);
        assertThat(records.get(2)).isEqualTo(new DiaperRecord(at("22:00"), DiaperType.WET));

        assertThatThrownBy(() -> service.session(session.id()))
            .isInstanceOf(UnknownReviewSessionException.class);
    }

    @Test
    void queuesReportWhenExtractionIsUnavailableAndRetriesItLater() {
        when(geminiClient.generateContent(anyString(), any(GoogleAiGeminiChatOptions.class)))
            .thenThrow(new GeminiClientException("Google AI Gemini request failed with HTTP 503", true))
            .thenReturn(EXTRACTED_EVENTS);

        IngestionOutcome outcome = service.ingest(upload());

        assertThat(outcome.status()).isEqualTo(IngestionOutcome.Status.QUEUED);
        assertThat(outcome.pendingReport()).isNotNull();
        assertThat(outcome.message()).contains("HTTP 503");
        assertThat(service.pendingReports()).hasSize(1);
        assertThat(sessionRegistry.size()).isZero();

        PendingRetryResult retry = service.retryPending(outcome.pendingReport().id());

        assertThat(retry.status()).isEqualTo(RetryOutcome.Status.SUCCEEDED);
        assertThat(retry.session().candidates()).hasSize(3);
        assertThat(retry.session().profile()).isEqualTo(PROFILE);
        assertThat(service.pendingReports()).isEmpty();
    }

    @Test
    void unusableResponsesAreReportedWithoutQueueing() {
        givenGeminiReturns("Sorry, I could not read this report.");

        IngestionOutcome outcome = service.ingest(upload());

        assertThat(outcome.status()).isEqualTo(IngestionOutcome.Status.MALFORMED);
        assertThat(outcome.message()).contains("not valid JSON");
        assertThat(service.pendingReports()).isEmpty();
        assertThat(sessionRegistry.size()).isZero();
    }

    @Test
    void queuesReportWhenHistoryCannotBeRead() {
        givenGeminiReturns(EXTRACTED_EVENTS);
        careLogStore.queryFailure = new CareLogStoreException("Care log unavailable", true);

        IngestionOutcome outcome = service.ingest(upload());

        assertThat(outcome.status()).isEqualTo(IngestionOutcome.Status.QUEUED);
        assertThat(outcome.message()).isEqualTo("Care log unavailable");
        assertThat(service.pendingReports()).extracting(report -> report.lastError())
            .containsExactly("Care log unavailable");
    }

    @Test
    void concurrentCommitsOfOneSessionWriteEachEventOnce() throws Exception {
        givenGeminiReturns("""
            [{"type": "bottle", "startTime": "21:15", "endTime": null, "quantity": "4 oz", "details": null}]
            """);
        ReviewSession session = service.ingest(upload()).session();
        service.confirmAll(session.id());
        CountDownLatch gate = new CountDownLatch(1);
        careLogStore.appendGate = gate;
        ExecutorService committers = Executors.newFixedThreadPool(2);
        try {
            Future<CommitSummary> first = committers.submit(() -> service.commit(session.id()));
            assertThat(careLogStore.appending.await(5, TimeUnit.SECONDS)).isTrue();
            Future<CommitSummary> second = committers.submit(() -> service.commit(session.id()));
            Thread.sleep(100);

            gate.countDown();

            assertThat(first.get(5, TimeUnit.SECONDS).result().successes()).hasSize(1);
            assertThat(second.get(5, TimeUnit.SECONDS).result().outcomes()).isEmpty();
        } finally {
            gate.countDown();
            committers.shutdownNow();
        }
        assertThat(careLogStore.delegate.records(PROFILE)).hasSize(1);
    }

    @Test
    void retriedReportIsQueuedAgainWhenHistoryRejectsTheRead() {
        when(geminiClient.generateContent(anyString(), any(GoogleAiGeminiChatOptions.class)))
            .thenThrow(new GeminiClientException("Google AI Gemini request failed with HTTP 503", true))
            .thenReturn(EXTRACTED_EVENTS);
        String pendingId = service.ingest(upload()).pendingReport().id();
        CareLogStoreException denied = new CareLogStoreException("Failed to query sleepLogs: PERMISSION_DENIED",
            false);
        careLogStore.queryFailure = denied;

        assertThatThrownBy(() -> service.retryPending(pendingId)).isSameAs(denied);

        assertThat(service.pendingReports()).singleElement().satisfies(report -> {
            assertThat(report.id()).isNotEqualTo(pendingId);
            assertThat(report.profile()).isEqualTo(PROFILE);
            assertThat(report.lastError()).isEqualTo("Failed to query sleepLogs: PERMISSION_DENIED");
        });
        assertThat(sessionRegistry.size()).isZero();
    }

    @Test
    void cancelledIngestionLeavesNothingBehind() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ReportExtractor blocking = source -> {
            started.countDown();
            try {
                release.await();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                throw new ExtractionCancelledException("Interrupted", ex);
            }
            return List.of();
        };
        service = createService(new TimeLimitedReportExtractor(blocking, extractionExecutor, Duration.ofSeconds(30)));

        IngestionHandle handle = service.submit(upload());
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(handle.cancel()).isTrue();

        assertThat(handle.await().status()).isEqualTo(IngestionOutcome.Status.CANCELLED);
        assertThat(handle.phase()).isEqualTo(IngestionHandle.Phase.CANCELLED);
        assertThat(handle.cancel()).isFalse();
        release.countDown();
        assertThat(service.pendingReports()).isEmpty();
        assertThat(sessionRegistry.size()).isZero();
    }

    @Test
    void interruptedCommitIsQueuedAndFinishedByASecondCommit() {
        givenGeminiReturns(EXTRACTED_EVENTS);
        ReviewSession session = service.ingest(upload()).session();
        service.confirmAll(session.id());
        careLogStore.failDiapers = true;

        CommitSummary first = service.commit(session.id());

        assertThat(first.sessionClosed()).isFalse();
        assertThat(first.result().successes()).hasSize(2);
        assertThat(first.result().failures()).singleElement()
            .satisfies(failure -> assertThat(failure.transientFailure()).isTrue());
        assertThat(first.queuedReport()).isNotNull();
        assertThat(first.queuedReport().lastError()).startsWith("Commit interrupted: ");
        assertThat(service.pendingReports()).hasSize(1);

        careLogStore.failDiapers = false;
        CommitSummary second = service.commit(session.id());

        assertThat(second.sessionClosed()).isTrue();
        assertThat(second.result().outcomes()).singleElement()
            .satisfies(outcome -> assertThat(outcome.candidate().kind()).isEqualTo(EventKind.DIAPER));
        assertThat(careLogStore.delegate.records(PROFILE)).hasSize(3);
        assertThat(service.pendingReports()).isEmpty();
    }

    @Test
    void editingTheTimeOfACandidateChecksForDuplicatesAgain() {
        careLogStore.delegate.append(PROFILE, new BottleFeedRecord(at("23:00"), new BigDecimal("5"),
            QuantityUnit.OUNCE, null));
        givenGeminiReturns(EXTRACTED_EVENTS);
        ReviewSession session = service.ingest(upload()).session();
        assertThat(session.candidate(1).duplicateFlag()).isFalse();

        service.editCandidate(session.id(), 1,
            new CandidateEdit(null, at("23:05"), null, null, null, null, null, null));

        CandidateEvent edited = session.candidate(1);
        assertThat(edited.duplicateFlag()).isTrue();
        assertThat(edited.duplicateReason()).isEqualTo("Similar bottle feed logged at 23:00");
        assertThat(session.summary().duplicates()).isEqualTo(1);
    }

    @Test
    void savedReportsCanBeListedAndDiscarded() {
        String id = service.saveForLater(upload(), null).id();

        assertThat(service.pendingReports()).singleElement()
            .satisfies(report -> {
                assertThat(report.id()).isEqualTo(id);
                assertThat(report.lastError()).isEqualTo("Saved for later");
                assertThat(report.profile()).isEqualTo(PROFILE);
            });

        assertThat(service.discardPending(id)).isTrue();
        assertThat(service.discardPending(id)).isFalse();
        assertThat(service.retryPending(id).status()).isEqualTo(RetryOutcome.Status.NOT_FOUND);
    }

    private ReportIngestionService createService(ReportExtractor extractor) {
        pendingReportQueue = new PendingReportQueue(new FileSystemReportBlobStore(tempDir), extractor,
            Clock.fixed(NOW, ZoneOffset.UTC));
        sessionRegistry = new ReviewSessionRegistry(Duration.ofHours(2), Clock.fixed(NOW, ZoneOffset.UTC));
        return new ReportIngestionService(extractor, new DuplicateDetector(ZoneOffset.UTC), careLogStore,
            new CommitDispatcher(careLogStore), pendingReportQueue, sessionRegistry, ingestionExecutor,
            Duration.ofHours(12), Duration.ofDays(14));
    }

    private void givenGeminiReturns(String response) {
        when(geminiClient.generateContent(anyString(), any(GoogleAiGeminiChatOptions.class))).thenReturn(response);
    }

    private static ReportUpload upload() {
        ReportSource source = new ReportSource(REPORT_TEXT.getBytes(StandardCharsets.UTF_8), "evening.txt",
            "text/plain", ReportFormat.TEXT, REPORT_DATE, ZoneOffset.UTC);
        return new ReportUpload(source, PROFILE);
    }

    private static Instant at(String time) {
        return Instant.parse("2024-03-12T" + time + ":00Z");
    }

    private static final class FlakyCareLogStore implements CareLogStore {

        private final InMemoryCareLogStore delegate = new InMemoryCareLogStore();
        private final CountDownLatch appending = new CountDownLatch(1);
        private volatile CareLogStoreException queryFailure;
        private volatile boolean failDiapers;
        private volatile CountDownLatch appendGate;

        @Override
        public List<ExistingRecord> query(CareProfile profile, TimeRange range) {
            CareLogStoreException failure = queryFailure;
            if (failure != null) {
                throw failure;
            }
            return delegate.query(profile, range);
        }

        @Override
        public RecordReference append(CareProfile profile, CareRecord record) {
            if (failDiapers && record instanceof DiaperRecord) {
                throw new CareLogStoreException("Failed to write diaper record to diaperLogs: UNAVAILABLE", true);
            }
            CountDownLatch gate = appendGate;
            if (gate != null) {
                appending.countDown();
                try {
                    gate.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                }
            }
            return delegate.append(profile, record);
        }
    }
}
