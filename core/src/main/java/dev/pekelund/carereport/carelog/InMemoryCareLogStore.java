package dev.pekelund.carereport.carelog;

import dev.pekelund.carereport.events.CareProfile;
import dev.pekelund.carereport.events.EventKind;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Volatile store used for local runs and tests. Records live only as long as the instance.
 */
public class InMemoryCareLogStore implements CareLogStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryCareLogStore.class);

    private final Map<CareProfile, List<StoredEntry>> entries = new ConcurrentHashMap<>();

    @Override
    public List<ExistingRecord> query(CareProfile profile, TimeRange range) {
        Objects.requireNonNull(profile, "profile");
        Objects.requireNonNull(range, "range");
        List<StoredEntry> stored = entries.getOrDefault(profile, List.of());
        List<ExistingRecord> matches = new ArrayList<>();
        for (StoredEntry entry : stored) {
            if (range.contains(entry.record().startTime())) {
                matches.add(toExistingRecord(entry));
            }
        }
        matches.sort(Comparator.comparing(ExistingRecord::startTime));
        return matches;
    }

    @Override
    public RecordReference append(CareProfile profile, CareRecord record) {
        Objects.requireNonNull(profile, "profile");
        Objects.requireNonNull(record, "record");
        RecordReference reference = new RecordReference(collectionFor(record), UUID.randomUUID().toString());
        entries.computeIfAbsent(profile, key -> new CopyOnWriteArrayList<>()).add(new StoredEntry(reference, record));
        LOGGER.debug("Stored {} record {} for child {}", record.kind(), reference, profile.childId());
        return reference;
    }

    public List<CareRecord> records(CareProfile profile) {
        List<CareRecord> records = new ArrayList<>();
        for (StoredEntry entry : entries.getOrDefault(profile, List.of())) {
            records.add(entry.record());
        }
        return records;
    }

    public void clear() {
        entries.clear();
    }

    private static String collectionFor(CareRecord record) {
        if (record instanceof SleepRecord) {
            return "sleepLogs";
        }
        if (record instanceof BottleFeedRecord) {
            return "bottleFeedLogs";
        }
        if (record instanceof NursingRecord) {
            return "nursingLogs";
        }
        if (record instanceof DiaperRecord) {
            return "diaperLogs";
        }
        return "activityLogs";
    }

    private static ExistingRecord toExistingRecord(StoredEntry entry) {
        CareRecord record = entry.record();
        if (record instanceof SleepRecord sleep) {
            return new ExistingRecord(EventKind.SLEEP, sleep.start(), sleep.end(), null, "sleep log",
                entry.reference());
        }
        if (record instanceof BottleFeedRecord bottle) {
            String quantity = bottle.amount().stripTrailingZeros().toPlainString() + " "
                + bottle.unit().name().toLowerCase(Locale.ROOT);
            return new ExistingRecord(EventKind.FEED, bottle.timestamp(), null, quantity, "bottle feed",
                entry.reference());
        }
        if (record instanceof NursingRecord nursing) {
            String quantity = nursing.durationMinutes().compareTo(BigDecimal.ZERO) > 0
                ? nursing.durationMinutes().stripTrailingZeros().toPlainString() + " min"
                : null;
            return new ExistingRecord(EventKind.FEED, nursing.timestamp(), null, quantity, "nursing session",
                entry.reference());
        }
        if (record instanceof DiaperRecord diaper) {
            return new ExistingRecord(EventKind.DIAPER, diaper.timestamp(), null, null,
                diaper.type().name().toLowerCase(Locale.ROOT) + " diaper", entry.reference());
        }
        ActivityRecord activity = (ActivityRecord) record;
        String description = activity.description().isBlank() ? "activity" : activity.description();
        return new ExistingRecord(activity.kind(), activity.timestamp(), null, activity.notes(), description,
            entry.reference());
    }

    private record StoredEntry(RecordReference reference, CareRecord record) {
    }
}
