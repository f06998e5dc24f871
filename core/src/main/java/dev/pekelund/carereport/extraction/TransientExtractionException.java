package dev.pekelund.carereport.extraction;

/**
 * Timeouts, network errors and unavailable services. The report should be kept for a later retry.
 */
public class TransientExtractionException extends ReportExtractionException {

    public TransientExtractionException(String message) {
        super(message);
    }

    public TransientExtractionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
