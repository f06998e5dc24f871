package dev.pekelund.carereport.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.pekelund.carereport.events.CandidateEvent;
import dev.pekelund.carereport.events.EventKind;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class TimeLimitedReportExtractorTest {

    private static final ReportSource SOURCE = new ReportSource("Bottle 4oz at 9:15 PM".getBytes(StandardCharsets.UTF_8),
        "report.txt", "text/plain", ReportFormat.TEXT, LocalDate.of(2024, 3, 4), ZoneOffset.UTC);

    private final ExecutorService executor = Executors.newCachedThreadPool();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void returnsDelegateResult() {
        CandidateEvent event = CandidateEvent.builder(EventKind.FEED, Instant.parse("2024-03-04T21:15:00Z")).build();
        TimeLimitedReportExtractor extractor = new TimeLimitedReportExtractor(source -> List.of(event), executor,
            Duration.ofSeconds(5));

        assertThat(extractor.extract(SOURCE)).containsExactly(event);
    }

    @Test
    void timeoutBecomesTransientFailureAndInterruptsTheDelegate() throws InterruptedException {
        CountDownLatch interrupted = new CountDownLatch(1);
        TimeLimitedReportExtractor extractor = new TimeLimitedReportExtractor(source -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException ex) {
                interrupted.countDown();
                Thread.currentThread().interrupt();
            }
            return List.of();
        }, executor, Duration.ofMillis(50));

        assertThatThrownBy(() -> extractor.extract(SOURCE))
            .isInstanceOf(TransientExtractionException.class)
            .hasMessageContaining("timed out");
        assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void propagatesExtractionFailuresUnchanged() {
        MalformedExtractionException failure = new MalformedExtractionException("not json");
        TimeLimitedReportExtractor extractor = new TimeLimitedReportExtractor(source -> {
            throw failure;
        }, executor, Duration.ofSeconds(5));

        assertThatThrownBy(() -> extractor.extract(SOURCE)).isSameAs(failure);
    }

    @Test
    void interruptingTheCallerCancelsExtraction() throws InterruptedException {
        CountDownLatch started = new CountDownLatch(1);
        AtomicBoolean cancelled = new AtomicBoolean();
        TimeLimitedReportExtractor extractor = new TimeLimitedReportExtractor(source -> {
            started.countDown();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            return List.of();
        }, executor, Duration.ofSeconds(30));

        Thread caller = new Thread(() -> {
            try {
                extractor.extract(SOURCE);
            } catch (ExtractionCancelledException ex) {
                cancelled.set(true);
            }
        });
        caller.start();
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        caller.interrupt();
        caller.join(5_000);

        assertThat(cancelled).isTrue();
    }

    @Test
    void fallsBackToDefaultTimeoutForNonPositiveValues() {
        TimeLimitedReportExtractor extractor = new TimeLimitedReportExtractor(source -> List.of(), executor,
            Duration.ZERO);

        assertThat(extractor.getTimeout()).isEqualTo(TimeLimitedReportExtractor.DEFAULT_TIMEOUT);
    }
}
