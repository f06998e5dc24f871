package dev.pekelund.carereport.events;

import java.util.HashMap;
import java.util.Map;

/**
 * Identifies whose history a report is reconciled against: the account owner and the child.
 */
public record CareProfile(String ownerId, String childId) {

    public static final String METADATA_OWNER_ID = "report.owner.id";
    public static final String METADATA_CHILD_ID = "report.child.id";

    public CareProfile {
        ownerId = normalize(ownerId);
        childId = normalize(childId);
    }

    public boolean isComplete() {
        return ownerId != null && childId != null;
    }

    public Map<String, String> toMetadata() {
        Map<String, String> metadata = new HashMap<>();
        if (ownerId != null) {
            metadata.put(METADATA_OWNER_ID, ownerId);
        }
        if (childId != null) {
            metadata.put(METADATA_CHILD_ID, childId);
        }
        return metadata;
    }

    public static CareProfile fromMetadata(Map<String, String> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        CareProfile profile = new CareProfile(metadata.get(METADATA_OWNER_ID), metadata.get(METADATA_CHILD_ID));
        return profile.ownerId() != null || profile.childId() != null ? profile : null;
    }

    private static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
