package dev.pekelund.carereport.review;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.pekelund.carereport.events.CandidateEvent;
import dev.pekelund.carereport.events.CareProfile;
import dev.pekelund.carereport.events.EventKind;
import dev.pekelund.carereport.events.ReviewState;
import dev.pekelund.carereport.events.ReviewTransitionException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ReviewSessionTest {

    private static final Instant SEVEN_PM = Instant.parse("2024-03-04T19:00:00Z");
    private static final Instant HALF_EIGHT = Instant.parse("2024-03-04T20:30:00Z");
    private static final Instant QUARTER_PAST_NINE = Instant.parse("2024-03-04T21:15:00Z");

    private ReviewSession session;

    @BeforeEach
    void setUp() {
        List<CandidateEvent> candidates = List.of(
            CandidateEvent.builder(EventKind.SLEEP, SEVEN_PM).build(),
            CandidateEvent.builder(EventKind.FEED, QUARTER_PAST_NINE).quantityText("4oz").build(),
            CandidateEvent.builder(EventKind.DIAPER, QUARTER_PAST_NINE.plusSeconds(2700)).wet(true).build());
        session = new ReviewSession("session-1", new CareProfile("owner", "child"), LocalDate.of(2024, 3, 4),
            null, candidates);
    }

    @Test
    void confirmAllIsAllOrNothing() {
        assertThatThrownBy(session::confirmAll)
            .isInstanceOfSatisfying(BulkConfirmationException.class,
                ex -> assertThat(ex.getPositions()).containsExactly(0));

        assertThat(session.candidates()).extracting(CandidateEvent::reviewState)
            .containsOnly(ReviewState.DETECTED);
    }

    @Test
    void confirmAllSkipsRejectedEvents() {
        session.reject(0);

        session.confirmAll();

        assertThat(session.candidates()).extracting(CandidateEvent::reviewState)
            .containsExactly(ReviewState.REJECTED, ReviewState.CONFIRMED, ReviewState.CONFIRMED);
        assertThat(session.confirmedCandidates()).hasSize(2);
    }

    @Test
    void editCompletesSleepSoItCanBeConfirmed() {
        session.edit(0, new CandidateEdit(null, null, HALF_EIGHT, null, null, null, null, null));
        session.confirmAll();

        assertThat(session.candidate(0).endTime()).isEqualTo(HALF_EIGHT);
        assertThat(session.summary()).isEqualTo(new ReviewSummary(3, 0, 0, 3, 0, 0));
    }

    @Test
    void rejectedEditLeavesCandidateUntouched() {
        CandidateEdit invalid = new CandidateEdit(null, HALF_EIGHT, SEVEN_PM, null, "5 oz", null, null, null);

        assertThatThrownBy(() -> session.edit(1, invalid)).isInstanceOf(IllegalArgumentException.class);

        CandidateEvent feed = session.candidate(1);
        assertThat(feed.quantityText()).isEqualTo("4oz");
        assertThat(feed.reviewState()).isEqualTo(ReviewState.DETECTED);
    }

    @Test
    void editCanMoveBothEndsPastTheOldWindow() {
        session.edit(0, new CandidateEdit(null, null, HALF_EIGHT, null, null, null, null, null));
        Instant later = HALF_EIGHT.plusSeconds(3600);

        session.edit(0, new CandidateEdit(null, later, later.plusSeconds(1800), null, null, null, null, null));

        assertThat(session.candidate(0).startTime()).isEqualTo(later);
        assertThat(session.candidate(0).endTime()).isEqualTo(later.plusSeconds(1800));
        assertThat(session.candidate(0).reviewState()).isEqualTo(ReviewState.EDITED);
    }

    @Test
    void editingConfirmedEventIsIllegal() {
        session.confirm(1);

        assertThatThrownBy(() -> session.edit(1, new CandidateEdit(null, null, null, null, "6oz", null, null, null)))
            .isInstanceOf(ReviewTransitionException.class);
    }

    @Test
    void unknownPositionsAreReported() {
        assertThatThrownBy(() -> session.confirm(7))
            .isInstanceOf(UnknownCandidateException.class)
            .hasMessageContaining("position 7");
    }

    @Test
    void rejectAllRejectsEverything() {
        session.confirm(1);

        session.rejectAll();

        assertThat(session.confirmedCandidates()).isEmpty();
        assertThat(session.summary().rejected()).isEqualTo(3);
    }

    @Test
    void summaryCountsDuplicates() {
        session.candidate(2).annotateDuplicate("Similar wet diaper logged at 22:00");
        session.edit(1, new CandidateEdit(null, null, null, null, "5oz", null, null, null));

        ReviewSummary summary = session.summary();

        assertThat(summary.duplicates()).isEqualTo(1);
        assertThat(summary.edited()).isEqualTo(1);
        assertThat(summary.unresolved()).isEqualTo(3);
    }
}
