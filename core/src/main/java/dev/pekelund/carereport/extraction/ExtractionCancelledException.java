package dev.pekelund.carereport.extraction;

public class ExtractionCancelledException extends ReportExtractionException {

    public ExtractionCancelledException(String message) {
        super(message);
    }

    public ExtractionCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
