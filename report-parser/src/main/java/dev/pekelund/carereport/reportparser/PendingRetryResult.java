package dev.pekelund.carereport.reportparser;

import dev.pekelund.carereport.pending.PendingReport;
import dev.pekelund.carereport.pending.RetryOutcome;
import dev.pekelund.carereport.review.ReviewSession;

/**
 * Result of retrying a pending report through the service.
 *
 * @param session review session opened for the fresh candidates, present for {@code SUCCEEDED}
 * @param report  the pending report as it now stands, {@code null} once it has been removed
 * @param transientFailure whether a failed retry may succeed later
 */
public record PendingRetryResult(RetryOutcome.Status status, ReviewSession session, PendingReport report,
    String message, boolean transientFailure) {
}
