package dev.pekelund.carereport.pending;

import dev.pekelund.carereport.events.CandidateEvent;
import dev.pekelund.carereport.extraction.ReportExtractionException;
import dev.pekelund.carereport.extraction.ReportSource;
import java.util.List;

/**
 * Result of retrying a pending report.
 *
 * @param report     the report as it was retried, {@code null} when {@link Status#NOT_FOUND}
 * @param source     the stored report rebuilt for extraction, present when the source could be read
 * @param candidates freshly extracted candidates, empty unless {@link Status#SUCCEEDED}
 * @param failure    extraction failure, present only for {@link Status#FAILED}
 */
public record RetryOutcome(Status status, PendingReport report, ReportSource source,
    List<CandidateEvent> candidates, ReportExtractionException failure) {

    public enum Status {
        SUCCEEDED,
        FAILED,
        NOT_FOUND,
        SOURCE_MISSING
    }

    public RetryOutcome {
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
    }

    static RetryOutcome succeeded(PendingReport report, ReportSource source, List<CandidateEvent> candidates) {
        return new RetryOutcome(Status.SUCCEEDED, report, source, candidates, null);
    }

    static RetryOutcome failed(PendingReport report, ReportSource source, ReportExtractionException failure) {
        return new RetryOutcome(Status.FAILED, report, source, List.of(), failure);
    }

    static RetryOutcome notFound() {
        return new RetryOutcome(Status.NOT_FOUND, null, null, List.of(), null);
    }

    static RetryOutcome sourceMissing(PendingReport report) {
        return new RetryOutcome(Status.SOURCE_MISSING, report, null, List.of(), null);
    }
}
