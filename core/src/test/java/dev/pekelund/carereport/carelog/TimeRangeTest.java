package dev.pekelund.carereport.carelog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class TimeRangeTest {

    private static final Instant DAY_START = Instant.parse("2024-03-04T00:00:00Z");
    private static final Instant DAY_END = Instant.parse("2024-03-05T00:00:00Z");

    @Test
    void isHalfOpen() {
        TimeRange range = new TimeRange(DAY_START, DAY_END);

        assertThat(range.contains(DAY_START)).isTrue();
        assertThat(range.contains(DAY_END)).isFalse();
        assertThat(range.contains(null)).isFalse();
    }

    @Test
    void paddingIsCappedAtTheMaximumWindow() {
        TimeRange range = new TimeRange(DAY_START, DAY_END);

        TimeRange padded = range.padded(Duration.ofHours(12), Duration.ofDays(14));
        TimeRange capped = range.padded(Duration.ofDays(30), Duration.ofDays(14));

        assertThat(padded.length()).isEqualTo(Duration.ofHours(48));
        assertThat(capped.length()).isEqualTo(Duration.ofDays(14));
        assertThat(capped.contains(DAY_START)).isTrue();
    }

    @Test
    void rejectsInvertedRanges() {
        assertThatThrownBy(() -> new TimeRange(DAY_END, DAY_START)).isInstanceOf(IllegalArgumentException.class);
    }
}
