package dev.pekelund.carereport.carelog;

import dev.pekelund.carereport.events.EventKind;
import dev.pekelund.carereport.normalize.QuantityUnit;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

public record BottleFeedRecord(Instant timestamp, BigDecimal amount, QuantityUnit unit, String notes)
    implements CareRecord {

    public BottleFeedRecord {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(amount, "amount");
        if (unit == null || !unit.isVolume()) {
            throw new IllegalArgumentException("Bottle feeds need a volume unit, got " + unit);
        }
        notes = notes != null ? notes : "";
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
