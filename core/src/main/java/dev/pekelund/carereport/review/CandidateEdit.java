package dev.pekelund.carereport.review;

import dev.pekelund.carereport.events.CandidateEvent;
import dev.pekelund.carereport.events.EventKind;
import dev.pekelund.carereport.events.ReviewAction;
import java.time.Instant;

/**
 * A partial update to one candidate. Only non-null fields are applied.
 *
 * <p>{@code clearEndTime} removes the end time; it takes precedence over {@code endTime}.</p>
 */
public record CandidateEdit(
    EventKind kind,
    Instant startTime,
    Instant endTime,
    Boolean clearEndTime,
    String quantityText,
    String details,
    Boolean wet,
    Boolean dirty
) {

    public boolean isEmpty() {
        return kind == null && startTime == null && endTime == null && !Boolean.TRUE.equals(clearEndTime)
            && quantityText == null && details == null && wet == null && dirty == null;
    }

    /**
     * Whether applying this edit can change the outcome of duplicate detection.
     */
    public boolean affectsTiming() {
        return kind != null || startTime != null || endTime != null || Boolean.TRUE.equals(clearEndTime);
    }

    /**
     * Applies the edit. The resulting time window is checked before anything changes, so a rejected
     * edit leaves the candidate untouched.
     */
    void applyTo(CandidateEvent candidate) {
        if (candidate.reviewState().isResolved()) {
            // let the state machine raise the transition error
            candidate.reviewState().next(ReviewAction.EDIT);
        }
        boolean clearEnd = Boolean.TRUE.equals(clearEndTime);
        Instant finalStart = startTime != null ? startTime : candidate.startTime();
        Instant finalEnd = clearEnd ? null : (endTime != null ? endTime : candidate.endTime());
        if (finalEnd != null && !finalEnd.isAfter(finalStart)) {
            throw new IllegalArgumentException("End time " + finalEnd + " must be after start time " + finalStart);
        }

        if (kind != null && kind != candidate.kind()) {
            candidate.editKind(kind);
        }
        if (startTime != null || endTime != null || clearEnd) {
            if (candidate.endTime() != null) {
                candidate.editEndTime(null);
            }
            candidate.editStartTime(finalStart);
            candidate.editEndTime(finalEnd);
        }
        if (quantityText != null) {
            candidate.editQuantity(quantityText);
        }
        if (details != null) {
            candidate.editDetails(details);
        }
        if (wet != null || dirty != null) {
            boolean newWet = wet != null ? wet : candidate.wet();
            boolean newDirty = dirty != null ? dirty : candidate.dirty();
            candidate.editDiaperFlags(newWet, newDirty);
        }
    }
}
