package dev.pekelund.carereport.carelog;

import dev.pekelund.carereport.events.EventKind;
import java.time.Instant;
import java.util.Objects;

public record SleepRecord(Instant start, Instant end) implements CareRecord {

    public SleepRecord {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("Sleep end " + end + " must be after start " + start);
        }
    }

    @Override
    public EventKind kind() {
        return EventKind.SLEEP;
    }

    @Override
    public Instant startTime() {
        return start;
    }
}
