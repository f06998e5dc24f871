package dev.pekelund.carereport.commit;

import dev.pekelund.carereport.carelog.RecordReference;
import dev.pekelund.carereport.events.CandidateEvent;
import java.util.List;

public record CommitResult(List<CommitOutcome> outcomes) {

    public CommitResult {
        outcomes = outcomes != null ? List.copyOf(outcomes) : List.of();
    }

    public List<RecordReference> successes() {
        return outcomes.stream().filter(CommitOutcome::succeeded).map(CommitOutcome::reference).toList();
    }

    public List<CommitOutcome> failures() {
        return outcomes.stream().filter(outcome -> !outcome.succeeded()).toList();
    }

    /**
     * Candidates that were not written, in the order they were submitted, so they can be re-offered.
     */
    public List<CandidateEvent> failedCandidates() {
        return failures().stream().map(CommitOutcome::candidate).toList();
    }

    public boolean hasFailures() {
        return outcomes.stream().anyMatch(outcome -> !outcome.succeeded());
    }

    public boolean hasTransientFailures() {
        return outcomes.stream().anyMatch(CommitOutcome::transientFailure);
    }
}
