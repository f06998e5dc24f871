package dev.pekelund.carereport.commit;

import dev.pekelund.carereport.carelog.RecordReference;
import dev.pekelund.carereport.events.CandidateEvent;

/**
 * Result of committing a single candidate: either a reference or a failure with its reason.
 */
public record CommitOutcome(
    CandidateEvent candidate,
    RecordReference reference,
    CommitFailureType failureType,
    String reason,
    boolean transientFailure
) {

    static CommitOutcome success(CandidateEvent candidate, RecordReference reference) {
        return new CommitOutcome(candidate, reference, null, null, false);
    }

    static CommitOutcome failure(CandidateEvent candidate, CommitFailureType type, String reason,
        boolean transientFailure) {
        return new CommitOutcome(candidate, null, type, reason, transientFailure);
    }

    public boolean succeeded() {
        return reference != null;
    }
}
