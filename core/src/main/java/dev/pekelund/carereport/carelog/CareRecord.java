package dev.pekelund.carereport.carelog;

import dev.pekelund.carereport.events.EventKind;
import java.time.Instant;

/**
 * A record accepted by one of the domain stores.
 */
public interface CareRecord {

    EventKind kind();

    Instant startTime();
}
