package dev.pekelund.carereport.commit;

import dev.pekelund.carereport.carelog.ActivityRecord;
import dev.pekelund.carereport.carelog.BottleFeedRecord;
import dev.pekelund.carereport.carelog.CareLogStore;
import dev.pekelund.carereport.carelog.CareLogStoreException;
import dev.pekelund.carereport.carelog.CareRecord;
import dev.pekelund.carereport.carelog.DiaperRecord;
import dev.pekelund.carereport.carelog.DiaperType;
import dev.pekelund.carereport.carelog.NursingRecord;
import dev.pekelund.carereport.carelog.RecordReference;
import dev.pekelund.carereport.carelog.SleepRecord;
import dev.pekelund.carereport.events.CandidateEvent;
import dev.pekelund.carereport.events.CareProfile;
import dev.pekelund.carereport.events.ReviewState;
import dev.pekelund.carereport.normalize.NormalizedQuantity;
import dev.pekelund.carereport.normalize.QuantityUnit;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes confirmed candidates to the domain stores.
 *
 * <p>Each candidate is committed independently: a store failure for one event is recorded in the
 * result and the remaining events are still attempted. Nothing already written is rolled back.</p>
 */
public class CommitDispatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(CommitDispatcher.class);

    private final CareLogStore store;

    public CommitDispatcher(CareLogStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    public CommitResult commit(CareProfile profile, List<CandidateEvent> confirmed) {
        Objects.requireNonNull(profile, "profile");
        List<CandidateEvent> candidates = confirmed != null ? confirmed : List.of();
        List<CommitOutcome> outcomes = new ArrayList<>(candidates.size());

        for (CandidateEvent candidate : candidates) {
            outcomes.add(commitOne(profile, candidate));
        }

        CommitResult result = new CommitResult(outcomes);
        LOGGER.info("Committed {} of {} event(s) for child {}", result.successes().size(), candidates.size(),
            profile.childId());
        return result;
    }

    private CommitOutcome commitOne(CareProfile profile, CandidateEvent candidate) {
        if (candidate.reviewState() != ReviewState.CONFIRMED) {
            return CommitOutcome.failure(candidate, CommitFailureType.NOT_CONFIRMED,
                "Event is " + candidate.reviewState() + ", only confirmed events are committed", false);
        }

        CareRecord record;
        try {
            record = toRecord(candidate);
        } catch (IllegalArgumentException ex) {
            return CommitOutcome.failure(candidate, CommitFailureType.VALIDATION, ex.getMessage(), false);
        }

        try {
            RecordReference reference = store.append(profile, record);
            LOGGER.debug("Committed {} at {} as {}", candidate.kind(), candidate.startTime(), reference);
            return CommitOutcome.success(candidate, reference);
        } catch (CareLogStoreException ex) {
            LOGGER.warn("Failed to commit {} at {}: {}", candidate.kind(), candidate.startTime(), ex.getMessage());
            return CommitOutcome.failure(candidate, CommitFailureType.STORAGE, ex.getMessage(),
                ex.isTransientFailure());
        }
    }

    /**
     * Maps a candidate to the record its kind is stored as.
     *
     * @throws IllegalArgumentException when the candidate lacks data its store requires
     */
    static CareRecord toRecord(CandidateEvent candidate) {
        switch (candidate.kind()) {
            case SLEEP -> {
                if (candidate.endTime() == null) {
                    throw new IllegalArgumentException("Sleep at " + candidate.startTime() + " has no end time");
                }
                return new SleepRecord(candidate.startTime(), candidate.endTime());
            }
            case FEED -> {
                return feedRecord(candidate);
            }
            case DIAPER -> {
                return new DiaperRecord(candidate.startTime(), diaperType(candidate));
            }
            default -> {
                return new ActivityRecord(candidate.startTime(), candidate.kind().name(), candidate.details(),
                    candidate.quantityText());
            }
        }
    }

    private static CareRecord feedRecord(CandidateEvent candidate) {
        NormalizedQuantity quantity = candidate.normalizedQuantity();
        if (quantity.isVolume()) {
            return new BottleFeedRecord(candidate.startTime(), quantity.amount(), quantity.unit(),
                candidate.details());
        }
        BigDecimal minutes = quantity.toMinutes();
        if (minutes == null && quantity.unit() == QuantityUnit.UNKNOWN) {
            minutes = quantity.amount();
        }
        return new NursingRecord(candidate.startTime(), minutes != null ? minutes : BigDecimal.ZERO);
    }

    private static DiaperType diaperType(CandidateEvent candidate) {
        if (candidate.wet() && candidate.dirty()) {
            return DiaperType.BOTH;
        }
        if (candidate.dirty()) {
            return DiaperType.DIRTY;
        }
        return DiaperType.WET;
    }
}
