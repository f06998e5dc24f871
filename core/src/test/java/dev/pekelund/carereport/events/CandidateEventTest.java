package dev.pekelund.carereport.events;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.pekelund.carereport.normalize.QuantityUnit;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class CandidateEventTest {

    private static final Instant SEVEN_PM = Instant.parse("2024-03-04T19:00:00Z");
    private static final Instant HALF_EIGHT = Instant.parse("2024-03-04T20:30:00Z");

    @Test
    void startsDetectedWithoutDuplicateFlag() {
        CandidateEvent event = CandidateEvent.builder(EventKind.FEED, SEVEN_PM).quantityText("4oz").build();

        assertThat(event.reviewState()).isEqualTo(ReviewState.DETECTED);
        assertThat(event.duplicateFlag()).isFalse();
        assertThat(event.details()).isEmpty();
    }

    @Test
    void rejectsEndTimeNotAfterStart() {
        assertThatThrownBy(() -> CandidateEvent.builder(EventKind.SLEEP, SEVEN_PM).endTime(SEVEN_PM).build())
            .isInstanceOf(IllegalArgumentException.class);

        CandidateEvent sleep = CandidateEvent.builder(EventKind.SLEEP, SEVEN_PM).endTime(HALF_EIGHT).build();
        assertThatThrownBy(() -> sleep.editEndTime(SEVEN_PM.minusSeconds(60)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(sleep.endTime()).isEqualTo(HALF_EIGHT);
        assertThat(sleep.reviewState()).isEqualTo(ReviewState.DETECTED);
    }

    @Test
    void editsMoveToEdited() {
        CandidateEvent event = CandidateEvent.builder(EventKind.FEED, SEVEN_PM).build();

        event.editQuantity("6 oz");

        assertThat(event.reviewState()).isEqualTo(ReviewState.EDITED);
        assertThat(event.normalizedQuantity().unit()).isEqualTo(QuantityUnit.OUNCE);
    }

    @Test
    void duplicateAnnotationDoesNotChangeReviewState() {
        CandidateEvent event = CandidateEvent.builder(EventKind.DIAPER, SEVEN_PM).wet(true).build();

        event.annotateDuplicate("Similar wet diaper logged at 19:05");
        assertThat(event.reviewState()).isEqualTo(ReviewState.DETECTED);
        assertThat(event.duplicateFlag()).isTrue();

        event.annotateDuplicate(null);
        assertThat(event.duplicateFlag()).isFalse();
        assertThat(event.duplicateReason()).isNull();
    }

    @Test
    void incompleteSleepCannotBeConfirmed() {
        CandidateEvent sleep = CandidateEvent.builder(EventKind.SLEEP, SEVEN_PM).build();

        assertThatThrownBy(sleep::confirm)
            .isInstanceOf(ReviewTransitionException.class)
            .hasMessageContaining("end time");
        assertThat(sleep.reviewState()).isEqualTo(ReviewState.DETECTED);
    }

    @Test
    void confirmedEventsRejectFurtherEditsButCanFlipToRejected() {
        CandidateEvent event = CandidateEvent.builder(EventKind.ACTIVITY, SEVEN_PM).details("Tummy time").build();
        event.confirm();

        assertThatThrownBy(() -> event.editDetails("Reading")).isInstanceOf(ReviewTransitionException.class);
        assertThat(event.details()).isEqualTo("Tummy time");

        event.reject();
        assertThat(event.reviewState()).isEqualTo(ReviewState.REJECTED);
        event.confirm();
        assertThat(event.reviewState()).isEqualTo(ReviewState.CONFIRMED);
    }

    @Test
    void mapsExtractedTypeAliases() {
        assertThat(EventKind.fromExtractedType("Nap")).isEqualTo(EventKind.SLEEP);
        assertThat(EventKind.fromExtractedType("bottle")).isEqualTo(EventKind.FEED);
        assertThat(EventKind.fromExtractedType("nursing")).isEqualTo(EventKind.FEED);
        assertThat(EventKind.fromExtractedType("solid")).isEqualTo(EventKind.OTHER);
        assertThat(EventKind.fromExtractedType(null)).isEqualTo(EventKind.OTHER);
    }
}
