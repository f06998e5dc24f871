package dev.pekelund.carereport.extraction;

import dev.pekelund.carereport.events.CandidateEvent;
import java.util.List;

/**
 * Turns a report into candidate events. An empty list is a valid result.
 */
public interface ReportExtractor {

    /**
     * @throws TransientExtractionException when the service could not be reached in time
     * @throws MalformedExtractionException when the response cannot be interpreted
     * @throws ExtractionCancelledException when the calling thread was interrupted
     */
    List<CandidateEvent> extract(ReportSource source);
}
