package dev.pekelund.carereport.reportparser.firestore;

import com.google.api.core.ApiFuture;
import com.google.api.gax.rpc.ApiException;
import com.google.cloud.BaseServiceException;
import com.google.cloud.Timestamp;
import com.google.cloud.firestore.DocumentReference;
import com.google.cloud.firestore.DocumentSnapshot;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.QueryDocumentSnapshot;
import com.google.cloud.firestore.QuerySnapshot;
import dev.pekelund.carereport.carelog.ActivityRecord;
import dev.pekelund.carereport.carelog.BottleFeedRecord;
import dev.pekelund.carereport.carelog.CareLogStore;
import dev.pekelund.carereport.carelog.CareLogStoreException;
import dev.pekelund.carereport.carelog.CareRecord;
import dev.pekelund.carereport.carelog.DiaperRecord;
import dev.pekelund.carereport.carelog.ExistingRecord;
import dev.pekelund.carereport.carelog.NursingRecord;
import dev.pekelund.carereport.carelog.RecordReference;
import dev.pekelund.carereport.carelog.SleepRecord;
import dev.pekelund.carereport.carelog.TimeRange;
import dev.pekelund.carereport.events.CareProfile;
import dev.pekelund.carereport.events.EventKind;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Reads and appends caregiving history in Firestore. Every document carries the {@code ownerId} and
 * {@code childId} of the profile it belongs to and a {@code timestamp} with the record's start.
 */
public class FirestoreCareLogStore implements CareLogStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(FirestoreCareLogStore.class);

    static final String OWNER_FIELD = "ownerId";
    static final String CHILD_FIELD = "childId";
    static final String TIMESTAMP_FIELD = "timestamp";
    static final String END_FIELD = "endTime";

    private final Firestore firestore;
    private final CareLogCollections collections;

    public FirestoreCareLogStore(Firestore firestore, CareLogCollections collections) {
        this.firestore = Objects.requireNonNull(firestore, "firestore");
        this.collections = Objects.requireNonNull(collections, "collections");
        LOGGER.info("FirestoreCareLogStore initialized with collections {}", collections);
    }

    @Override
    public List<ExistingRecord> query(CareProfile profile, TimeRange range) {
        requireComplete(profile);
        Objects.requireNonNull(range, "range");

        List<ExistingRecord> records = new ArrayList<>();
        for (String collection : List.of(collections.sleep(), collections.bottleFeed(), collections.nursing(),
            collections.diaper(), collections.activity())) {
            for (QueryDocumentSnapshot document : fetch(collection, profile, range)) {
                ExistingRecord record = toExistingRecord(collection, document);
                if (record != null) {
                    records.add(record);
                }
            }
        }
        records.sort(Comparator.comparing(ExistingRecord::startTime));
        LOGGER.debug("Loaded {} history records for child {} between {} and {}", records.size(),
            profile.childId(), range.from(), range.to());
        return records;
    }

    @Override
    public RecordReference append(CareProfile profile, CareRecord record) {
        requireComplete(profile);
        Objects.requireNonNull(record, "record");

        String collection = collectionFor(record);
        Map<String, Object> payload = toPayload(record);
        payload.put(OWNER_FIELD, profile.ownerId());
        payload.put(CHILD_FIELD, profile.childId());
        payload.put("createdAt", Timestamp.now());

        DocumentReference document = await(firestore.collection(collection).add(payload),
            "write " + record.kind().label() + " record to " + collection);
        LOGGER.info("Stored {} record {}/{} for child {}", record.kind(), collection, document.getId(),
            profile.childId());
        return new RecordReference(collection, document.getId());
    }

    private List<QueryDocumentSnapshot> fetch(String collection, CareProfile profile, TimeRange range) {
        QuerySnapshot snapshot = await(firestore.collection(collection)
                .whereEqualTo(OWNER_FIELD, profile.ownerId())
                .whereEqualTo(CHILD_FIELD, profile.childId())
                .whereGreaterThanOrEqualTo(TIMESTAMP_FIELD, toTimestamp(range.from()))
                .whereLessThan(TIMESTAMP_FIELD, toTimestamp(range.to()))
                .get(),
            "query " + collection);
        return snapshot.getDocuments();
    }

    private <T> T await(ApiFuture<T> future, String operation) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new CareLogStoreException("Interrupted while trying to " + operation, ex, true);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            boolean transientFailure = isRetryable(cause);
            LOGGER.error("Firestore failed to {} (transient: {})", operation, transientFailure, cause);
            throw new CareLogStoreException("Failed to " + operation + ": " + cause.getMessage(), cause,
                transientFailure);
        }
    }

    static boolean isRetryable(Throwable failure) {
        if (failure instanceof BaseServiceException serviceException) {
            return serviceException.isRetryable();
        }
        if (failure instanceof ApiException apiException) {
            return apiException.isRetryable();
        }
        return false;
    }

    private String collectionFor(CareRecord record) {
        if (record instanceof SleepRecord) {
            return collections.sleep();
        }
        if (record instanceof BottleFeedRecord) {
            return collections.bottleFeed();
        }
        if (record instanceof NursingRecord) {
            return collections.nursing();
        }
        if (record instanceof DiaperRecord) {
            return collections.diaper();
        }
        return collections.activity();
    }

    private static Map<String, Object> toPayload(CareRecord record) {
        Map<String, Object> payload = new HashMap<>();
        payload.put(TIMESTAMP_FIELD, toTimestamp(record.startTime()));
        if (record instanceof SleepRecord sleep) {
            payload.put(END_FIELD, toTimestamp(sleep.end()));
        } else if (record instanceof BottleFeedRecord bottle) {
            payload.put("amount", bottle.amount().doubleValue());
            payload.put("unit", bottle.unit().name());
            payload.put("notes", bottle.notes());
        } else if (record instanceof NursingRecord nursing) {
            payload.put("durationMinutes", nursing.durationMinutes().doubleValue());
        } else if (record instanceof DiaperRecord diaper) {
            payload.put("type", diaper.type().name());
        } else if (record instanceof ActivityRecord activity) {
            payload.put("activityType", activity.activityType());
            payload.put("description", activity.description());
            payload.put("notes", activity.notes());
        }
        return payload;
    }

    private ExistingRecord toExistingRecord(String collection, DocumentSnapshot document) {
        Timestamp start = document.getTimestamp(TIMESTAMP_FIELD);
        if (start == null) {
            LOGGER.warn("Ignoring history document {}/{} without a timestamp", collection, document.getId());
            return null;
        }
        RecordReference reference = new RecordReference(collection, document.getId());
        Instant startTime = toInstant(start);

        if (collection.equals(collections.sleep())) {
            Timestamp end = document.getTimestamp(END_FIELD);
            return new ExistingRecord(EventKind.SLEEP, startTime, end != null ? toInstant(end) : null, null,
                "sleep log", reference);
        }
        if (collection.equals(collections.bottleFeed())) {
            Double amount = document.getDouble("amount");
            String unit = document.getString("unit");
            String quantity = amount != null
                ? BigDecimal.valueOf(amount).stripTrailingZeros().toPlainString()
                    + (StringUtils.hasText(unit) ? " " + unit.toLowerCase(Locale.ROOT) : "")
                : null;
            return new ExistingRecord(EventKind.FEED, startTime, null, quantity, "bottle feed", reference);
        }
        if (collection.equals(collections.nursing())) {
            Double minutes = document.getDouble("durationMinutes");
            String quantity = minutes != null && minutes > 0
                ? BigDecimal.valueOf(minutes).stripTrailingZeros().toPlainString() + " min"
                : null;
            return new ExistingRecord(EventKind.FEED, startTime, null, quantity, "nursing session", reference);
        }
        if (collection.equals(collections.diaper())) {
            String type = document.getString("type");
            String description = StringUtils.hasText(type) ? type.toLowerCase(Locale.ROOT) + " diaper" : null;
            return new ExistingRecord(EventKind.DIAPER, startTime, null, null, description, reference);
        }
        String activityType = document.getString("activityType");
        EventKind kind = "OTHER".equalsIgnoreCase(activityType) ? EventKind.OTHER : EventKind.ACTIVITY;
        return new ExistingRecord(kind, startTime, null, document.getString("notes"),
            document.getString("description"), reference);
    }

    private static void requireComplete(CareProfile profile) {
        Objects.requireNonNull(profile, "profile");
        if (!profile.isComplete()) {
            throw new IllegalArgumentException("Care profile must name both owner and child");
        }
    }

    static Timestamp toTimestamp(Instant instant) {
        return Timestamp.ofTimeSecondsAndNanos(instant.getEpochSecond(), instant.getNano());
    }

    static Instant toInstant(Timestamp timestamp) {
        return Instant.ofEpochSecond(timestamp.getSeconds(), timestamp.getNanos());
    }
}
