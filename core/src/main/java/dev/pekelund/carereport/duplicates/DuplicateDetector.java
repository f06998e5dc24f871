package dev.pekelund.carereport.duplicates;

import dev.pekelund.carereport.carelog.ExistingRecord;
import dev.pekelund.carereport.events.CandidateEvent;
import dev.pekelund.carereport.events.EventKind;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flags candidates that overlap history already recorded for the child.
 *
 * <p>Sleep candidates are compared as half-open intervals, so a sleep that starts exactly when an
 * earlier one ended is not a duplicate. A missing end time on either side is treated as
 * {@code defaultSleepDuration} for the comparison only. Every other kind is an instant event and
 * matches a record of the same kind whose start lies within {@code instantTolerance}, inclusive.</p>
 *
 * <p>Detection rewrites the flag on every run, so it can be repeated after edits.</p>
 */
public class DuplicateDetector {

    public static final Duration DEFAULT_INSTANT_TOLERANCE = Duration.ofMinutes(15);
    public static final Duration DEFAULT_SLEEP_DURATION = Duration.ofHours(1);

    private static final Logger LOGGER = LoggerFactory.getLogger(DuplicateDetector.class);
    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");

    private final ZoneId zone;
    private final Duration instantTolerance;
    private final Duration defaultSleepDuration;

    public DuplicateDetector(ZoneId zone) {
        this(zone, DEFAULT_INSTANT_TOLERANCE, DEFAULT_SLEEP_DURATION);
    }

    public DuplicateDetector(ZoneId zone, Duration instantTolerance, Duration defaultSleepDuration) {
        this.zone = Objects.requireNonNull(zone, "zone");
        this.instantTolerance = requirePositive(instantTolerance, "instantTolerance", true);
        this.defaultSleepDuration = requirePositive(defaultSleepDuration, "defaultSleepDuration", false);
    }

    /**
     * Annotates {@code candidates} in place and returns the same list.
     */
    public List<CandidateEvent> detect(List<CandidateEvent> candidates, List<ExistingRecord> history) {
        Objects.requireNonNull(candidates, "candidates");
        List<ExistingRecord> records = history != null ? history : List.of();

        int flagged = 0;
        for (CandidateEvent candidate : candidates) {
            ExistingRecord match = closestMatch(candidate, records);
            if (match == null) {
                candidate.annotateDuplicate(null);
                continue;
            }
            candidate.annotateDuplicate(reasonFor(candidate.kind(), match));
            flagged++;
        }
        LOGGER.debug("Duplicate detection flagged {} of {} candidate(s) against {} record(s)", flagged,
            candidates.size(), records.size());
        return candidates;
    }

    private ExistingRecord closestMatch(CandidateEvent candidate, List<ExistingRecord> records) {
        ExistingRecord best = null;
        Duration bestDistance = null;
        for (ExistingRecord record : records) {
            if (record.kind() != candidate.kind() || !matches(candidate, record)) {
                continue;
            }
            Duration distance = Duration.between(candidate.startTime(), record.startTime()).abs();
            if (best == null
                || distance.compareTo(bestDistance) < 0
                || (distance.equals(bestDistance) && record.startTime().isBefore(best.startTime()))) {
                best = record;
                bestDistance = distance;
            }
        }
        return best;
    }

    private boolean matches(CandidateEvent candidate, ExistingRecord record) {
        if (candidate.kind() == EventKind.SLEEP) {
            Instant candidateEnd = effectiveEnd(candidate.startTime(), candidate.endTime());
            Instant recordEnd = effectiveEnd(record.startTime(), record.endTime());
            return candidate.startTime().isBefore(recordEnd) && record.startTime().isBefore(candidateEnd);
        }
        Duration distance = Duration.between(candidate.startTime(), record.startTime()).abs();
        return distance.compareTo(instantTolerance) <= 0;
    }

    private String reasonFor(EventKind kind, ExistingRecord match) {
        if (kind == EventKind.SLEEP) {
            Instant end = effectiveEnd(match.startTime(), match.endTime());
            return "Overlaps existing sleep log from " + format(match.startTime()) + " to " + format(end);
        }
        return "Similar " + match.description() + " logged at " + format(match.startTime());
    }

    private Instant effectiveEnd(Instant start, Instant end) {
        return end != null && end.isAfter(start) ? end : start.plus(defaultSleepDuration);
    }

    private String format(Instant instant) {
        return TIME_FORMAT.format(instant.atZone(zone));
    }

    private static Duration requirePositive(Duration value, String name, boolean allowZero) {
        Objects.requireNonNull(value, name);
        if (value.isNegative() || (!allowZero && value.isZero())) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
        return value;
    }
}
