package dev.pekelund.carereport.events;

import java.util.Locale;
import java.util.Map;

/**
 * Kind of caregiving event a report line describes.
 */
public enum EventKind {

    SLEEP("sleep"),
    FEED("feeding"),
    DIAPER("diaper change"),
    ACTIVITY("activity"),
    OTHER("entry");

    private static final Map<String, EventKind> ALIASES = Map.ofEntries(
        Map.entry("sleep", SLEEP),
        Map.entry("nap", SLEEP),
        Map.entry("feed", FEED),
        Map.entry("feeding", FEED),
        Map.entry("bottle", FEED),
        Map.entry("nursing", FEED),
        Map.entry("diaper", DIAPER),
        Map.entry("nappy", DIAPER),
        Map.entry("activity", ACTIVITY),
        Map.entry("play", ACTIVITY),
        Map.entry("other", OTHER)
    );

    private final String label;

    EventKind(String label) {
        this.label = label;
    }

    /**
     * Human readable noun used in review messages, e.g. "diaper change".
     */
    public String label() {
        return label;
    }

    public boolean isInstant() {
        return this != SLEEP;
    }

    /**
     * Resolves the type string returned by extraction. Unknown or missing values map to {@link #OTHER}.
     */
    public static EventKind fromExtractedType(String value) {
        if (value == null) {
            return OTHER;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return ALIASES.getOrDefault(normalized, OTHER);
    }
}
