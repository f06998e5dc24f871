package dev.pekelund.carereport.carelog;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Half-open query window {@code [from, to)} over care history.
 */
public record TimeRange(Instant from, Instant to) {

    public TimeRange {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("Range end " + to + " is before range start " + from);
        }
    }

    public boolean contains(Instant instant) {
        return instant != null && !instant.isBefore(from) && instant.isBefore(to);
    }

    public Duration length() {
        return Duration.between(from, to);
    }

    /**
     * Widens the range by {@code padding} on both sides, keeping the result within {@code maxWindow}
     * centred on the original range.
     */
    public TimeRange padded(Duration padding, Duration maxWindow) {
        Instant paddedFrom = from.minus(padding);
        Instant paddedTo = to.plus(padding);
        Duration padded = Duration.between(paddedFrom, paddedTo);
        if (maxWindow == null || padded.compareTo(maxWindow) <= 0) {
            return new TimeRange(paddedFrom, paddedTo);
        }
        Instant middle = from.plus(length().dividedBy(2));
        Duration half = maxWindow.dividedBy(2);
        return new TimeRange(middle.minus(half), middle.plus(half));
    }
}
