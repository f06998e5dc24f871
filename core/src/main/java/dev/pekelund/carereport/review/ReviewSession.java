package dev.pekelund.carereport.review;

import dev.pekelund.carereport.events.CandidateEvent;
import dev.pekelund.carereport.events.CareProfile;
import dev.pekelund.carereport.events.ReviewState;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Candidate list of one report while the user reviews it.
 *
 * <p>All mutating operations are synchronised on the session, so concurrent requests against the same
 * session observe each other's changes in order.</p>
 */
public class ReviewSession {

    private final String id;
    private final CareProfile profile;
    private final LocalDate reportDate;
    private final Instant createdAt;
    private final List<CandidateEvent> candidates;

    public ReviewSession(String id, CareProfile profile, LocalDate reportDate, Instant createdAt,
        List<CandidateEvent> candidates) {
        this.id = Objects.requireNonNull(id, "id");
        this.profile = Objects.requireNonNull(profile, "profile");
        this.reportDate = reportDate;
        this.createdAt = createdAt != null ? createdAt : Instant.now();
        this.candidates = new ArrayList<>(candidates != null ? candidates : List.of());
    }

    public String id() {
        return id;
    }

    public CareProfile profile() {
        return profile;
    }

    public LocalDate reportDate() {
        return reportDate;
    }

    public Instant createdAt() {
        return createdAt;
    }

    /**
     * Live, read-only view of the candidates in report order.
     */
    public synchronized List<CandidateEvent> candidates() {
        return Collections.unmodifiableList(candidates);
    }

    public synchronized CandidateEvent candidate(int index) {
        return require(index);
    }

    public synchronized CandidateEvent edit(int index, CandidateEdit edit) {
        Objects.requireNonNull(edit, "edit");
        CandidateEvent candidate = require(index);
        if (!edit.isEmpty()) {
            edit.applyTo(candidate);
        }
        return candidate;
    }

    public synchronized CandidateEvent confirm(int index) {
        CandidateEvent candidate = require(index);
        candidate.confirm();
        return candidate;
    }

    public synchronized CandidateEvent reject(int index) {
        CandidateEvent candidate = require(index);
        candidate.reject();
        return candidate;
    }

    /**
     * Confirms every candidate that is not rejected, or none of them.
     *
     * @throws BulkConfirmationException listing the zero-based positions that cannot be confirmed
     */
    public synchronized void confirmAll() {
        List<Integer> blocked = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            CandidateEvent candidate = candidates.get(i);
            if (candidate.reviewState() != ReviewState.REJECTED && !candidate.isComplete()) {
                blocked.add(i);
            }
        }
        if (!blocked.isEmpty()) {
            throw new BulkConfirmationException(blocked);
        }
        for (CandidateEvent candidate : candidates) {
            if (candidate.reviewState() != ReviewState.REJECTED) {
                candidate.confirm();
            }
        }
    }

    public synchronized void rejectAll() {
        for (CandidateEvent candidate : candidates) {
            candidate.reject();
        }
    }

    public synchronized List<CandidateEvent> confirmedCandidates() {
        List<CandidateEvent> confirmed = new ArrayList<>();
        for (CandidateEvent candidate : candidates) {
            if (candidate.reviewState() == ReviewState.CONFIRMED) {
                confirmed.add(candidate);
            }
        }
        return confirmed;
    }

    public synchronized ReviewSummary summary() {
        int detected = 0;
        int edited = 0;
        int confirmed = 0;
        int rejected = 0;
        int duplicates = 0;
        for (CandidateEvent candidate : candidates) {
            switch (candidate.reviewState()) {
                case DETECTED -> detected++;
                case EDITED -> edited++;
                case CONFIRMED -> confirmed++;
                case REJECTED -> rejected++;
                default -> throw new IllegalStateException("Unexpected review state " + candidate.reviewState());
            }
            if (candidate.duplicateFlag()) {
                duplicates++;
            }
        }
        return new ReviewSummary(candidates.size(), detected, edited, confirmed, rejected, duplicates);
    }

    private CandidateEvent require(int index) {
        if (index < 0 || index >= candidates.size()) {
            throw new UnknownCandidateException(index, candidates.size());
        }
        return candidates.get(index);
    }
}
