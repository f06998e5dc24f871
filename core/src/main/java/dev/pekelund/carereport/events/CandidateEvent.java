package dev.pekelund.carereport.events;

import dev.pekelund.carereport.normalize.NormalizedQuantity;
import dev.pekelund.carereport.normalize.QuantityNormalizer;
import java.time.Instant;
import java.util.Objects;

/**
 * An extracted caregiving event awaiting review.
 *
 * <p>Candidates are mutable while the user reviews them. Every field edit passes through
 * {@link ReviewState#next(ReviewAction)} with {@link ReviewAction#EDIT}, so an event that is already
 * confirmed or rejected cannot be changed. Duplicate annotations are written by detection and do not
 * count as edits.</p>
 */
public final class CandidateEvent {

    private EventKind kind;
    private Instant startTime;
    private Instant endTime;
    private String quantityText;
    private String details;
    private boolean wet;
    private boolean dirty;
    private ReviewState reviewState;
    private boolean duplicateFlag;
    private String duplicateReason;

    private CandidateEvent(Builder builder) {
        this.kind = Objects.requireNonNull(builder.kind, "kind");
        this.startTime = Objects.requireNonNull(builder.startTime, "startTime");
        requireEndAfterStart(builder.startTime, builder.endTime);
        this.endTime = builder.endTime;
        this.quantityText = blankToNull(builder.quantityText);
        this.details = builder.details != null ? builder.details.trim() : "";
        this.wet = builder.wet;
        this.dirty = builder.dirty;
        this.reviewState = ReviewState.DETECTED;
    }

    public static Builder builder(EventKind kind, Instant startTime) {
        return new Builder(kind, startTime);
    }

    public EventKind kind() {
        return kind;
    }

    public Instant startTime() {
        return startTime;
    }

    public Instant endTime() {
        return endTime;
    }

    public String quantityText() {
        return quantityText;
    }

    public String details() {
        return details;
    }

    public boolean wet() {
        return wet;
    }

    public boolean dirty() {
        return dirty;
    }

    public ReviewState reviewState() {
        return reviewState;
    }

    public boolean duplicateFlag() {
        return duplicateFlag;
    }

    public String duplicateReason() {
        return duplicateReason;
    }

    public NormalizedQuantity normalizedQuantity() {
        return QuantityNormalizer.normalize(quantityText);
    }

    /**
     * A sleep without an end time cannot be confirmed or committed.
     */
    public boolean isComplete() {
        return kind != EventKind.SLEEP || endTime != null;
    }

    public void editKind(EventKind newKind) {
        Objects.requireNonNull(newKind, "kind");
        ReviewState next = reviewState.next(ReviewAction.EDIT);
        this.kind = newKind;
        this.reviewState = next;
    }

    public void editStartTime(Instant newStart) {
        Objects.requireNonNull(newStart, "startTime");
        ReviewState next = reviewState.next(ReviewAction.EDIT);
        requireEndAfterStart(newStart, endTime);
        this.startTime = newStart;
        this.reviewState = next;
    }

    public void editEndTime(Instant newEnd) {
        ReviewState next = reviewState.next(ReviewAction.EDIT);
        requireEndAfterStart(startTime, newEnd);
        this.endTime = newEnd;
        this.reviewState = next;
    }

    public void editQuantity(String newQuantityText) {
        ReviewState next = reviewState.next(ReviewAction.EDIT);
        this.quantityText = blankToNull(newQuantityText);
        this.reviewState = next;
    }

    public void editDetails(String newDetails) {
        ReviewState next = reviewState.next(ReviewAction.EDIT);
        this.details = newDetails != null ? newDetails.trim() : "";
        this.reviewState = next;
    }

    public void editDiaperFlags(boolean newWet, boolean newDirty) {
        ReviewState next = reviewState.next(ReviewAction.EDIT);
        this.wet = newWet;
        this.dirty = newDirty;
        this.reviewState = next;
    }

    /**
     * Moves the event to {@link ReviewState#CONFIRMED}.
     *
     * @throws ReviewTransitionException when the event is an incomplete sleep
     */
    public void confirm() {
        if (!isComplete()) {
            throw new ReviewTransitionException(reviewState, ReviewAction.CONFIRM,
                "A sleep event needs an end time before it can be confirmed");
        }
        this.reviewState = reviewState.next(ReviewAction.CONFIRM);
    }

    public void reject() {
        this.reviewState = reviewState.next(ReviewAction.REJECT);
    }

    /**
     * Records the outcome of duplicate detection. Passing {@code null} clears a previous flag.
     */
    public void annotateDuplicate(String reason) {
        this.duplicateFlag = reason != null;
        this.duplicateReason = reason;
    }

    @Override
    public String toString() {
        return "CandidateEvent{"
            + "kind=" + kind
            + ", startTime=" + startTime
            + ", endTime=" + endTime
            + ", quantityText='" + quantityText + '\''
            + ", reviewState=" + reviewState
            + ", duplicateFlag=" + duplicateFlag
            + '}';
    }

    private static void requireEndAfterStart(Instant start, Instant end) {
        if (end != null && !end.isAfter(start)) {
            throw new IllegalArgumentException("End time " + end + " must be after start time " + start);
        }
    }

    private static String blankToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static final class Builder {

        private final EventKind kind;
        private final Instant startTime;
        private Instant endTime;
        private String quantityText;
        private String details;
        private boolean wet;
        private boolean dirty;

        private Builder(EventKind kind, Instant startTime) {
            this.kind = kind;
            this.startTime = startTime;
        }

        public Builder endTime(Instant endTime) {
            this.endTime = endTime;
            return this;
        }

        public Builder quantityText(String quantityText) {
            this.quantityText = quantityText;
            return this;
        }

        public Builder details(String details) {
            this.details = details;
            return this;
        }

        public Builder wet(boolean wet) {
            this.wet = wet;
            return this;
        }

        public Builder dirty(boolean dirty) {
            this.dirty = dirty;
            return this;
        }

        public CandidateEvent build() {
            return new CandidateEvent(this);
        }
    }
}
