package dev.pekelund.carereport.extraction;

/**
 * Base type of failures raised while turning a report into candidate events.
 */
public class ReportExtractionException extends RuntimeException {

    public ReportExtractionException(String message) {
        super(message);
    }

    public ReportExtractionException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Whether retrying the same source later may succeed.
     */
    public boolean isTransient() {
        return false;
    }
}
