package dev.pekelund.carereport.carelog;

import dev.pekelund.carereport.events.CareProfile;
import java.util.List;

/**
 * System of record for committed caregiving history.
 */
public interface CareLogStore {

    /**
     * Returns every record of the profile that starts within {@code range}, ordered by start time.
     *
     * @throws CareLogStoreException when the backend cannot be read
     */
    List<ExistingRecord> query(CareProfile profile, TimeRange range);

    /**
     * Appends a record and returns its reference.
     *
     * @throws CareLogStoreException when the record could not be written
     */
    RecordReference append(CareProfile profile, CareRecord record);
}
