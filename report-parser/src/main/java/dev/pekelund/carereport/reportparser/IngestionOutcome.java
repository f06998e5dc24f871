package dev.pekelund.carereport.reportparser;

import dev.pekelund.carereport.pending.PendingReport;
import dev.pekelund.carereport.review.ReviewSession;

/**
 * How an ingestion ended.
 *
 * @param session       the opened review session, present for {@link Status#EXTRACTED}
 * @param pendingReport the queued report, present for {@link Status#QUEUED}
 * @param message       failure message for every status except {@link Status#EXTRACTED}
 */
public record IngestionOutcome(Status status, ReviewSession session, PendingReport pendingReport, String message) {

    public enum Status {
        EXTRACTED,
        QUEUED,
        MALFORMED,
        CANCELLED
    }

    static IngestionOutcome extracted(ReviewSession session) {
        return new IngestionOutcome(Status.EXTRACTED, session, null, null);
    }

    static IngestionOutcome queued(PendingReport report, String message) {
        return new IngestionOutcome(Status.QUEUED, null, report, message);
    }

    static IngestionOutcome malformed(String message) {
        return new IngestionOutcome(Status.MALFORMED, null, null, message);
    }

    static IngestionOutcome cancelled() {
        return new IngestionOutcome(Status.CANCELLED, null, null, "Ingestion was cancelled");
    }
}
