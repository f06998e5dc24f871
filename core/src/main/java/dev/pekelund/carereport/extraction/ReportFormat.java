package dev.pekelund.carereport.extraction;

import java.util.Locale;
import org.springframework.util.StringUtils;

/**
 * Input formats accepted for extraction.
 */
public enum ReportFormat {

    IMAGE,
    TEXT,
    CSV;

    /**
     * Resolves the format from the declared content type, falling back to the file extension.
     *
     * @throws UnsupportedReportFormatException when neither identifies a supported format
     */
    public static ReportFormat detect(String contentType, String fileName) {
        String type = contentType != null ? contentType.trim().toLowerCase(Locale.ROOT) : "";
        int parameters = type.indexOf(';');
        if (parameters >= 0) {
            type = type.substring(0, parameters).trim();
        }
        if (type.startsWith("image/")) {
            return IMAGE;
        }
        if (type.equals("text/plain")) {
            return TEXT;
        }
        if (type.equals("text/csv")) {
            return CSV;
        }

        String extension = StringUtils.getFilenameExtension(fileName);
        if (extension != null) {
            switch (extension.toLowerCase(Locale.ROOT)) {
                case "png", "jpg", "jpeg", "heic", "webp" -> {
                    return IMAGE;
                }
                case "txt" -> {
                    return TEXT;
                }
                case "csv" -> {
                    return CSV;
                }
                default -> {
                    // fall through to the error below
                }
            }
        }
        throw new UnsupportedReportFormatException("Unsupported report format: content type '"
            + (contentType != null ? contentType : "") + "', file '" + (fileName != null ? fileName : "") + "'");
    }

    public boolean isText() {
        return this != IMAGE;
    }
}
