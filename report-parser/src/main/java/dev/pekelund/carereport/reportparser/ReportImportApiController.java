package dev.pekelund.carereport.reportparser;

import dev.pekelund.carereport.carelog.CareLogStoreException;
import dev.pekelund.carereport.commit.CommitOutcome;
import dev.pekelund.carereport.events.CandidateEvent;
import dev.pekelund.carereport.events.CareProfile;
import dev.pekelund.carereport.events.EventKind;
import dev.pekelund.carereport.events.ReviewTransitionException;
import dev.pekelund.carereport.extraction.ReportFormat;
import dev.pekelund.carereport.extraction.ReportSource;
import dev.pekelund.carereport.extraction.UnsupportedReportFormatException;
import dev.pekelund.carereport.normalize.NormalizedQuantity;
import dev.pekelund.carereport.pending.PendingReport;
import dev.pekelund.carereport.pending.ReportUpload;
import dev.pekelund.carereport.pending.RetryOutcome;
import dev.pekelund.carereport.review.BulkConfirmationException;
import dev.pekelund.carereport.review.CandidateEdit;
import dev.pekelund.carereport.review.ReviewSession;
import dev.pekelund.carereport.review.ReviewSummary;
import dev.pekelund.carereport.review.UnknownCandidateException;
import dev.pekelund.carereport.storage.ReportStorageException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

/**
 * REST API for importing daily reports: upload, review, commit and the pending report queue.
 */
@RestController
@RequestMapping(path = "/api/reports", produces = MediaType.APPLICATION_JSON_VALUE)
public class ReportImportApiController {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReportImportApiController.class);

    private final ReportIngestionService ingestionService;
    private final CareReportProperties properties;
    private final Clock clock;

    public ReportImportApiController(ReportIngestionService ingestionService, CareReportProperties properties,
        Clock clock) {
        this.ingestionService = ingestionService;
        this.properties = properties;
        this.clock = clock;
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<IngestionResponse> importReport(@RequestPart("file") MultipartFile file,
        @RequestParam("ownerId") String ownerId, @RequestParam("childId") String childId,
        @RequestParam(value = "reportDate", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
        LocalDate reportDate,
        @RequestParam(value = "zone", required = false) String zone) throws IOException {

        ReportUpload upload = toUpload(file, ownerId, childId, reportDate, zone);
        LOGGER.info("Importing report '{}' ({} bytes) for child {}", upload.source().fileName(),
            upload.source().size(), upload.profile().childId());
        IngestionOutcome outcome = ingestionService.ingest(upload);
        IngestionResponse response = new IngestionResponse(outcome.status().name(),
            outcome.session() != null ? SessionView.of(outcome.session()) : null,
            outcome.pendingReport() != null ? PendingReportView.of(outcome.pendingReport()) : null,
            outcome.message());
        HttpStatus status = switch (outcome.status()) {
            case EXTRACTED -> HttpStatus.CREATED;
            case QUEUED -> HttpStatus.ACCEPTED;
            case MALFORMED -> HttpStatus.UNPROCESSABLE_ENTITY;
            case CANCELLED -> HttpStatus.CONFLICT;
        };
        return ResponseEntity.status(status).body(response);
    }

    @GetMapping("/sessions/{sessionId}")
    public SessionView session(@PathVariable("sessionId") String sessionId) {
        return SessionView.of(ingestionService.session(sessionId));
    }

    @PatchMapping(path = "/sessions/{sessionId}/events/{index}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public CandidateView editEvent(@PathVariable("sessionId") String sessionId, @PathVariable("index") int index,
        @Valid @RequestBody EditEventRequest request) {
        CandidateEvent edited = ingestionService.editCandidate(sessionId, index, request.toEdit());
        return CandidateView.of(index, edited);
    }

    @PostMapping("/sessions/{sessionId}/events/{index}/confirm")
    public CandidateView confirmEvent(@PathVariable("sessionId") String sessionId, @PathVariable("index") int index) {
        return CandidateView.of(index, ingestionService.confirm(sessionId, index));
    }

    @PostMapping("/sessions/{sessionId}/events/{index}/reject")
    public CandidateView rejectEvent(@PathVariable("sessionId") String sessionId, @PathVariable("index") int index) {
        return CandidateView.of(index, ingestionService.reject(sessionId, index));
    }

    @PostMapping("/sessions/{sessionId}/confirm-all")
    public SessionView confirmAll(@PathVariable("sessionId") String sessionId) {
        return SessionView.of(ingestionService.confirmAll(sessionId));
    }

    @PostMapping("/sessions/{sessionId}/reject-all")
    public SessionView rejectAll(@PathVariable("sessionId") String sessionId) {
        return SessionView.of(ingestionService.rejectAll(sessionId));
    }

    @PostMapping("/sessions/{sessionId}/commit")
    public CommitResponse commit(@PathVariable("sessionId") String sessionId) {
        return CommitResponse.of(ingestionService.commit(sessionId));
    }

    @GetMapping("/pending")
    public List<PendingReportView> pendingReports() {
        return ingestionService.pendingReports().stream().map(PendingReportView::of).toList();
    }

    @PostMapping(path = "/pending", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public PendingReportView saveForLater(@RequestPart("file") MultipartFile file,
        @RequestParam("ownerId") String ownerId, @RequestParam("childId") String childId,
        @RequestParam(value = "reportDate", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
        LocalDate reportDate,
        @RequestParam(value = "zone", required = false) String zone,
        @RequestParam(value = "reason", required = false) String reason) throws IOException {

        ReportUpload upload = toUpload(file, ownerId, childId, reportDate, zone);
        return PendingReportView.of(ingestionService.saveForLater(upload, reason));
    }

    @PostMapping("/pending/{reportId}/retry")
    public ResponseEntity<RetryResponse> retryPending(@PathVariable("reportId") String reportId) {
        PendingRetryResult result = ingestionService.retryPending(reportId);
        RetryResponse response = new RetryResponse(result.status().name(),
            result.session() != null ? SessionView.of(result.session()) : null,
            result.report() != null ? PendingReportView.of(result.report()) : null,
            result.message());
        return ResponseEntity.status(retryStatus(result)).body(response);
    }

    @DeleteMapping("/pending/{reportId}")
    public ResponseEntity<Void> discardPending(@PathVariable("reportId") String reportId) {
        boolean discarded = ingestionService.discardPending(reportId);
        LOGGER.info("Discard of pending report {} requested (removed: {})", reportId, discarded);
        return ResponseEntity.noContent().build();
    }

    @ExceptionHandler({UnknownReviewSessionException.class, UnknownCandidateException.class})
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(RuntimeException exception) {
        return Map.of("error", exception.getMessage());
    }

    @ExceptionHandler(ReviewTransitionException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleReviewTransition(ReviewTransitionException exception) {
        LOGGER.info("Rejected review action {}: {}", exception.getAction(), exception.getMessage());
        return Map.of("error", exception.getMessage());
    }

    @ExceptionHandler(BulkConfirmationException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleBulkConfirmation(BulkConfirmationException exception) {
        return Map.of("error", exception.getMessage(), "positions", exception.getPositions());
    }

    @ExceptionHandler(UnsupportedReportFormatException.class)
    @ResponseStatus(HttpStatus.UNSUPPORTED_MEDIA_TYPE)
    public Map<String, Object> handleUnsupportedFormat(UnsupportedReportFormatException exception) {
        return Map.of("error", exception.getMessage());
    }

    @ExceptionHandler({ReportStorageException.class, CareLogStoreException.class})
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public Map<String, Object> handleStorageFailure(RuntimeException exception) {
        LOGGER.error("Storage failure while handling report request: {}", exception.getMessage(), exception);
        return Map.of("error", exception.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, DateTimeException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBadRequest(RuntimeException exception) {
        return Map.of("error", exception.getMessage());
    }

    private static HttpStatus retryStatus(PendingRetryResult result) {
        if (result.status() == RetryOutcome.Status.SUCCEEDED) {
            return HttpStatus.CREATED;
        }
        if (result.status() == RetryOutcome.Status.NOT_FOUND) {
            return HttpStatus.NOT_FOUND;
        }
        if (result.status() == RetryOutcome.Status.SOURCE_MISSING) {
            return HttpStatus.CONFLICT;
        }
        return result.transientFailure() ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.UNPROCESSABLE_ENTITY;
    }

    private ReportUpload toUpload(MultipartFile file, String ownerId, String childId, LocalDate reportDate,
        String zone) throws IOException {

        if (file == null || file.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                "A non-empty report must be provided as the 'file' part");
        }
        CareProfile profile = new CareProfile(ownerId, childId);
        if (!profile.isComplete()) {
            throw new IllegalArgumentException("Both ownerId and childId are required");
        }
        String fileName = StringUtils.hasText(file.getOriginalFilename()) ? file.getOriginalFilename() : "report";
        ReportFormat format = ReportFormat.detect(file.getContentType(), fileName);
        ZoneId resolvedZone = StringUtils.hasText(zone) ? ZoneId.of(zone.trim()) : properties.getZone();
        LocalDate resolvedDate = reportDate != null ? reportDate : LocalDate.now(clock.withZone(resolvedZone));
        ReportSource source = new ReportSource(file.getBytes(), fileName, file.getContentType(), format,
            resolvedDate, resolvedZone);
        return new ReportUpload(source, profile);
    }

    public record EditEventRequest(
        EventKind kind,
        Instant startTime,
        Instant endTime,
        Boolean clearEndTime,
        @Size(max = 200) String quantity,
        @Size(max = 2000) String details,
        Boolean wet,
        Boolean dirty
    ) {

        CandidateEdit toEdit() {
            return new CandidateEdit(kind, startTime, endTime, clearEndTime, quantity, details, wet, dirty);
        }
    }

    public record CandidateView(
        int index,
        EventKind kind,
        Instant startTime,
        Instant endTime,
        String quantity,
        BigDecimal normalizedAmount,
        String normalizedUnit,
        String details,
        boolean wet,
        boolean dirty,
        String reviewState,
        boolean duplicate,
        String duplicateReason
    ) {

        static CandidateView of(int index, CandidateEvent candidate) {
            NormalizedQuantity quantity = candidate.normalizedQuantity();
            return new CandidateView(index, candidate.kind(), candidate.startTime(), candidate.endTime(),
                candidate.quantityText(), quantity.amount(), quantity.unit().name(), candidate.details(),
                candidate.wet(), candidate.dirty(), candidate.reviewState().name(), candidate.duplicateFlag(),
                candidate.duplicateReason());
        }
    }

    public record SessionView(
        String id,
        String ownerId,
        String childId,
        LocalDate reportDate,
        ReviewSummary summary,
        List<CandidateView> events
    ) {

        static SessionView of(ReviewSession session) {
            List<CandidateView> events = new ArrayList<>();
            synchronized (session) {
                List<CandidateEvent> candidates = session.candidates();
                for (int i = 0; i < candidates.size(); i++) {
                    events.add(CandidateView.of(i, candidates.get(i)));
                }
                return new SessionView(session.id(), session.profile().ownerId(), session.profile().childId(),
                    session.reportDate(), session.summary(), events);
            }
        }
    }

    public record PendingReportView(
        String id,
        Instant createdAt,
        String fileName,
        String format,
        LocalDate reportDate,
        String ownerId,
        String childId,
        String lastError
    ) {

        static PendingReportView of(PendingReport report) {
            CareProfile profile = report.profile();
            return new PendingReportView(report.id(), report.createdAt(), report.fileName(), report.format().name(),
                report.reportDate(), profile != null ? profile.ownerId() : null,
                profile != null ? profile.childId() : null, report.lastError());
        }
    }

    public record IngestionResponse(String status, SessionView session, PendingReportView pendingReport,
        String message) { }

    public record RetryResponse(String status, SessionView session, PendingReportView pendingReport,
        String message) { }

    public record CommitFailureView(Instant startTime, EventKind kind, String failureType, String reason,
        boolean transientFailure) {

        static CommitFailureView of(CommitOutcome outcome) {
            return new CommitFailureView(outcome.candidate().startTime(), outcome.candidate().kind(),
                outcome.failureType().name(), outcome.reason(), outcome.transientFailure());
        }
    }

    public record CommitResponse(
        String sessionId,
        List<String> committed,
        List<CommitFailureView> failures,
        boolean sessionClosed,
        PendingReportView queuedReport
    ) {

        static CommitResponse of(CommitSummary summary) {
            List<String> committed = summary.result().successes().stream().map(Object::toString).toList();
            List<CommitFailureView> failures = summary.result().failures().stream()
                .map(CommitFailureView::of)
                .toList();
            return new CommitResponse(summary.sessionId(), committed, failures, summary.sessionClosed(),
                summary.queuedReport() != null ? PendingReportView.of(summary.queuedReport()) : null);
        }
    }
}
