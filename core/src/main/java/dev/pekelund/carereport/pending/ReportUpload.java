package dev.pekelund.carereport.pending;

import dev.pekelund.carereport.events.CareProfile;
import dev.pekelund.carereport.extraction.ReportSource;
import java.util.Objects;

/**
 * A report received from a caregiver together with whose history it belongs to.
 */
public record ReportUpload(ReportSource source, CareProfile profile) {

    public ReportUpload {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(profile, "profile");
    }
}
