package dev.pekelund.carereport.extraction;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Raw report handed to an extractor.
 *
 * @param reportDate calendar day the report describes, times on the sheet are read on this day
 * @param zone       zone the caregiver wrote times in
 */
public record ReportSource(
    byte[] content,
    String fileName,
    String contentType,
    ReportFormat format,
    LocalDate reportDate,
    ZoneId zone
) {

    public ReportSource {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(format, "format");
        Objects.requireNonNull(reportDate, "reportDate");
        Objects.requireNonNull(zone, "zone");
    }

    public int size() {
        return content.length;
    }

    @Override
    public String toString() {
        return "ReportSource{fileName='" + fileName + "', format=" + format + ", reportDate=" + reportDate
            + ", size=" + content.length + '}';
    }
}
