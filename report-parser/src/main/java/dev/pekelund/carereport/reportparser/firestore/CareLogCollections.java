package dev.pekelund.carereport.reportparser.firestore;

import java.util.Objects;

/**
 * Firestore collection names of the caregiving history.
 */
public record CareLogCollections(
    String sleep,
    String bottleFeed,
    String nursing,
    String diaper,
    String activity
) {

    public static final String DEFAULT_SLEEP_COLLECTION = "sleepLogs";
    public static final String DEFAULT_BOTTLE_FEED_COLLECTION = "bottleFeedLogs";
    public static final String DEFAULT_NURSING_COLLECTION = "nursingLogs";
    public static final String DEFAULT_DIAPER_COLLECTION = "diaperLogs";
    public static final String DEFAULT_ACTIVITY_COLLECTION = "activityLogs";

    public CareLogCollections {
        Objects.requireNonNull(sleep, "sleep");
        Objects.requireNonNull(bottleFeed, "bottleFeed");
        Objects.requireNonNull(nursing, "nursing");
        Objects.requireNonNull(diaper, "diaper");
        Objects.requireNonNull(activity, "activity");
    }

    public static CareLogCollections defaults() {
        return new CareLogCollections(DEFAULT_SLEEP_COLLECTION, DEFAULT_BOTTLE_FEED_COLLECTION,
            DEFAULT_NURSING_COLLECTION, DEFAULT_DIAPER_COLLECTION, DEFAULT_ACTIVITY_COLLECTION);
    }
}
