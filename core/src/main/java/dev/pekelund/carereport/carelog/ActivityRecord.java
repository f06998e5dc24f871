package dev.pekelund.carereport.carelog;

import dev.pekelund.carereport.events.EventKind;
import java.time.Instant;
import java.util.Objects;

/**
 * Free-form entry. Used for activities and for anything extraction could not classify.
 */
public record ActivityRecord(Instant timestamp, String activityType, String description, String notes)
    implements CareRecord {

    public ActivityRecord {
        Objects.requireNonNull(timestamp, "timestamp");
        activityType = activityType != null ? activityType : EventKind.OTHER.name();
        description = description != null ? description : "";
        notes = notes != null ? notes : "";
    }

    @Override
    public EventKind kind() {
        return EventKind.OTHER.name().equals(activityType) ? EventKind.OTHER : EventKind.ACTIVITY;
    }

    @Override
    public Instant startTime() {
        return timestamp;
    }
}
