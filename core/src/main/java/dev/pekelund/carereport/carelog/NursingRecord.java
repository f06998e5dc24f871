package dev.pekelund.carereport.carelog;

import dev.pekelund.carereport.events.EventKind;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

public record NursingRecord(Instant timestamp, BigDecimal durationMinutes) implements CareRecord {

    public NursingRecord {
        Objects.requireNonNull(timestamp, "timestamp");
        durationMinutes = durationMinutes != null ? durationMinutes : BigDecimal.ZERO;
    }

    @Override
    public EventKind kind() {
        return EventKind.FEED;
    }

    @Override
    public Instant startTime() {
        return timestamp;
    }
}
