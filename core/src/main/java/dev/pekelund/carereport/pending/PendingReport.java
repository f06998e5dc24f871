package dev.pekelund.carereport.pending;

import dev.pekelund.carereport.events.CareProfile;
import dev.pekelund.carereport.extraction.ReportFormat;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.Map;
import org.springframework.util.StringUtils;

/**
 * Durable record of a report whose ingestion could not complete.
 *
 * @param sourceReference blob key of the stored report bytes
 * @param lastError       message of the most recent failure
 */
public record PendingReport(
    String id,
    Instant createdAt,
    String sourceReference,
    String fileName,
    String contentType,
    ReportFormat format,
    LocalDate reportDate,
    ZoneId zone,
    CareProfile profile,
    String lastError
) {

    static final String METADATA_ID = "pending.id";
    static final String METADATA_CREATED_AT = "pending.created-at";
    static final String METADATA_SOURCE = "pending.source";
    static final String METADATA_FILE_NAME = "pending.file-name";
    static final String METADATA_CONTENT_TYPE = "pending.content-type";
    static final String METADATA_FORMAT = "pending.format";
    static final String METADATA_REPORT_DATE = "pending.report-date";
    static final String METADATA_ZONE = "pending.zone";
    static final String METADATA_LAST_ERROR = "pending.last-error";

    private static final int MAX_ERROR_LENGTH = 500;

    public PendingReport withLastError(String error) {
        return new PendingReport(id, createdAt, sourceReference, fileName, contentType, format, reportDate, zone,
            profile, error);
    }

    Map<String, String> toMetadata() {
        Map<String, String> metadata = new HashMap<>();
        metadata.put(METADATA_ID, id);
        metadata.put(METADATA_CREATED_AT, createdAt.toString());
        metadata.put(METADATA_SOURCE, sourceReference);
        metadata.put(METADATA_FORMAT, format.name());
        metadata.put(METADATA_REPORT_DATE, reportDate.toString());
        metadata.put(METADATA_ZONE, zone.getId());
        putIfHasText(metadata, METADATA_FILE_NAME, fileName);
        putIfHasText(metadata, METADATA_CONTENT_TYPE, contentType);
        putIfHasText(metadata, METADATA_LAST_ERROR, truncate(lastError));
        if (profile != null) {
            metadata.putAll(profile.toMetadata());
        }
        return metadata;
    }

    /**
     * Rebuilds a report from its index metadata.
     *
     * @throws IllegalArgumentException when a required entry is missing or unreadable
     */
    static PendingReport fromMetadata(Map<String, String> metadata) {
        if (metadata == null) {
            throw new IllegalArgumentException("Pending report metadata is missing");
        }
        try {
            return new PendingReport(
                require(metadata, METADATA_ID),
                Instant.parse(require(metadata, METADATA_CREATED_AT)),
                require(metadata, METADATA_SOURCE),
                metadata.get(METADATA_FILE_NAME),
                metadata.get(METADATA_CONTENT_TYPE),
                ReportFormat.valueOf(require(metadata, METADATA_FORMAT)),
                LocalDate.parse(require(metadata, METADATA_REPORT_DATE)),
                ZoneId.of(require(metadata, METADATA_ZONE)),
                CareProfile.fromMetadata(metadata),
                metadata.get(METADATA_LAST_ERROR));
        } catch (DateTimeException ex) {
            throw new IllegalArgumentException("Pending report metadata is unreadable: " + ex.getMessage(), ex);
        }
    }

    private static String require(Map<String, String> metadata, String key) {
        String value = metadata.get(key);
        if (!StringUtils.hasText(value)) {
            throw new IllegalArgumentException("Pending report metadata lacks " + key);
        }
        return value;
    }

    private static void putIfHasText(Map<String, String> metadata, String key, String value) {
        if (StringUtils.hasText(value)) {
            metadata.put(key, value);
        }
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= MAX_ERROR_LENGTH) {
            return value;
        }
        return value.substring(0, MAX_ERROR_LENGTH - 1) + "…";
    }
}
