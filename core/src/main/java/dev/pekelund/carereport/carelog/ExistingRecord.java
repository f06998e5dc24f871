package dev.pekelund.carereport.carelog;

import dev.pekelund.carereport.events.EventKind;
import java.time.Instant;
import java.util.Objects;

/**
 * Read-only view of a committed record used for reconciliation.
 *
 * @param quantity    display form of the recorded amount or duration, may be {@code null}
 * @param description short noun phrase naming the record, e.g. "bottle feed"
 */
public record ExistingRecord(
    EventKind kind,
    Instant startTime,
    Instant endTime,
    String quantity,
    String description,
    RecordReference reference
) {

    public ExistingRecord {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(startTime, "startTime");
        description = description != null && !description.isBlank() ? description : kind.label();
    }
}
