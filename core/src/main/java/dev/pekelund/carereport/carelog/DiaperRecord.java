package dev.pekelund.carereport.carelog;

import dev.pekelund.carereport.events.EventKind;
import java.time.Instant;
import java.util.Objects;

public record DiaperRecord(Instant timestamp, DiaperType type) implements CareRecord {

    public DiaperRecord {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(type, "type");
    }

    @Override
    public EventKind kind() {
        return EventKind.DIAPER;
    }

    @Override
    public Instant startTime() {
        return timestamp;
    }
}
