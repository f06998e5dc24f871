package dev.pekelund.carereport.reportparser;

import dev.pekelund.carereport.commit.CommitResult;
import dev.pekelund.carereport.pending.PendingReport;

/**
 * @param sessionClosed whether every confirmed event was written and the session closed
 * @param queuedReport  report queued because storage was unavailable, {@code null} otherwise
 */
public record CommitSummary(String sessionId, CommitResult result, boolean sessionClosed,
    PendingReport queuedReport) {
}
