package dev.pekelund.carereport.reportparser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.pekelund.carereport.events.CandidateEvent;
import dev.pekelund.carereport.events.CareProfile;
import dev.pekelund.carereport.events.EventKind;
import dev.pekelund.carereport.extraction.ReportFormat;
import dev.pekelund.carereport.extraction.ReportSource;
import dev.pekelund.carereport.pending.ReportUpload;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;

class ReviewSessionRegistryTest {

    private static final Instant NOW = Instant.parse("2024-03-12T08:00:00Z");

    private final MutableClock clock = new MutableClock(NOW);
    private final ReviewSessionRegistry registry = new ReviewSessionRegistry(Duration.ofHours(2), clock);

    @Test
    void opensSessionsForTheUploadProfileAndDate() {
        ReviewSessionRegistry.Entry entry = registry.open(upload(), List.of(feed()));

        assertThat(entry.session().profile()).isEqualTo(new CareProfile("owner-1", "child-1"));
        assertThat(entry.session().reportDate()).isEqualTo(LocalDate.of(2024, 3, 12));
        assertThat(entry.session().createdAt()).isEqualTo(NOW);
        assertThat(registry.get(entry.session().id())).isSameAs(entry);
    }

    @Test
    void sessionsExpireAfterTheirIdleTime() {
        String id = registry.open(upload(), List.of(feed())).session().id();

        clock.advance(Duration.ofMinutes(90));
        registry.get(id);
        clock.advance(Duration.ofMinutes(90));
        assertThat(registry.get(id)).isNotNull();

        clock.advance(Duration.ofHours(2).plusSeconds(1));
        assertThatThrownBy(() -> registry.get(id))
            .isInstanceOf(UnknownReviewSessionException.class)
            .hasMessageContaining(id);
        assertThat(registry.size()).isZero();
    }

    @Test
    void closedSessionsAreGone() {
        String id = registry.open(upload(), List.of()).session().id();

        registry.close(id);

        assertThatThrownBy(() -> registry.get(id)).isInstanceOf(UnknownReviewSessionException.class);
    }

    @Test
    void committedCandidatesAreTrackedByIdentity() {
        CandidateEvent first = feed();
        CandidateEvent second = feed();
        ReviewSessionRegistry.Entry entry = registry.open(upload(), List.of(first, second));

        entry.markCommitted(first);

        assertThat(entry.isCommitted(first)).isTrue();
        assertThat(entry.isCommitted(second)).isFalse();
    }

    private static CandidateEvent feed() {
        return CandidateEvent.builder(EventKind.FEED, NOW).quantityText("4 oz").build();
    }

    private static ReportUpload upload() {
        ReportSource source = new ReportSource("Bottle 4oz".getBytes(), "report.txt", "text/plain",
            ReportFormat.TEXT, LocalDate.of(2024, 3, 12), ZoneOffset.UTC);
        return new ReportUpload(source, new CareProfile("owner-1", "child-1"));
    }

    private static final class MutableClock extends Clock {

        private Instant instant;

        private MutableClock(Instant instant) {
            this.instant = instant;
        }

        void advance(Duration duration) {
            instant = instant.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return instant;
        }
    }
}
