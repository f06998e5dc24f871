package dev.pekelund.carereport.extraction;

import dev.pekelund.carereport.events.CandidateEvent;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a delegate extractor on an executor and bounds it with a timeout.
 *
 * <p>A timeout becomes a {@link TransientExtractionException}. Interrupting the calling thread cancels
 * the running extraction and surfaces as {@link ExtractionCancelledException}.</p>
 */
public class TimeLimitedReportExtractor implements ReportExtractor {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(45);

    private static final Logger LOGGER = LoggerFactory.getLogger(TimeLimitedReportExtractor.class);

    private final ReportExtractor delegate;
    private final ExecutorService executor;
    private final Duration timeout;

    public TimeLimitedReportExtractor(ReportExtractor delegate, ExecutorService executor, Duration timeout) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.timeout = timeout != null && !timeout.isNegative() && !timeout.isZero() ? timeout : DEFAULT_TIMEOUT;
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public List<CandidateEvent> extract(ReportSource source) {
        Future<List<CandidateEvent>> future = executor.submit(() -> delegate.extract(source));
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            LOGGER.warn("Extraction of {} timed out after {}", source.fileName(), timeout);
            throw new TransientExtractionException("Extraction timed out after " + timeout.toSeconds() + "s", ex);
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ExtractionCancelledException("Extraction of " + source.fileName() + " was cancelled", ex);
        } catch (CancellationException ex) {
            throw new ExtractionCancelledException("Extraction of " + source.fileName() + " was cancelled", ex);
        } catch (ExecutionException ex) {
            throw unwrap(ex.getCause());
        }
    }

    private static ReportExtractionException unwrap(Throwable cause) {
        if (cause instanceof ReportExtractionException extractionException) {
            return extractionException;
        }
        return new ReportExtractionException("Extraction failed: " + cause.getMessage(), cause);
    }
}
