package dev.pekelund.carereport.extraction;

/**
 * The extraction service answered, but the answer could not be turned into candidates.
 */
public class MalformedExtractionException extends ReportExtractionException {

    public MalformedExtractionException(String message) {
        super(message);
    }

    public MalformedExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
