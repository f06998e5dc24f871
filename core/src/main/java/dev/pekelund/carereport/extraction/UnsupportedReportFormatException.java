package dev.pekelund.carereport.extraction;

public class UnsupportedReportFormatException extends ReportExtractionException {

    public UnsupportedReportFormatException(String message) {
        super(message);
    }
}
