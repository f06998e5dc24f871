package dev.pekelund.carereport.extraction;

/**
 * Transcribes a photographed report into plain text.
 */
public interface ReportTextRecognizer {

    /**
     * @return the recognised text, empty when the image holds no legible text
     * @throws TransientExtractionException when the recognition service could not be reached
     */
    String recognize(ReportSource source);
}
