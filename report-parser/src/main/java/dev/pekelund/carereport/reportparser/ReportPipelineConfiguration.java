package dev.pekelund.carereport.reportparser;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.pekelund.carereport.carelog.CareLogStore;
import dev.pekelund.carereport.commit.CommitDispatcher;
import dev.pekelund.carereport.duplicates.DuplicateDetector;
import dev.pekelund.carereport.extraction.ReportExtractor;
import dev.pekelund.carereport.extraction.TimeLimitedReportExtractor;
import dev.pekelund.carereport.pending.PendingReportQueue;
import dev.pekelund.carereport.storage.FileSystemReportBlobStore;
import dev.pekelund.carereport.storage.GcsConfig;
import dev.pekelund.carereport.storage.ReportBlobStore;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;

/**
 * Wires the reconciliation pipeline. Extraction and history backends come from the profile specific
 * configurations, the pending report store from {@code care-report.storage.backend}.
 */
@Configuration
@EnableConfigurationProperties(CareReportProperties.class)
@Import(GcsConfig.class)
public class ReportPipelineConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReportPipelineConfiguration.class);

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService extractionExecutor(CareReportProperties properties) {
        int threads = Math.max(1, properties.getExtraction().getThreads());
        return new MdcPropagatingExecutorService(Executors.newFixedThreadPool(threads));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService ingestionExecutor() {
        return new MdcPropagatingExecutorService(Executors.newCachedThreadPool());
    }

    @Bean
    @Primary
    public TimeLimitedReportExtractor timeLimitedReportExtractor(
        @Qualifier("geminiReportExtractor") ReportExtractor geminiReportExtractor,
        @Qualifier("extractionExecutor") ExecutorService extractionExecutor, CareReportProperties properties) {
        return new TimeLimitedReportExtractor(geminiReportExtractor, extractionExecutor,
            properties.getExtraction().getTimeout());
    }

    @Bean
    public DuplicateDetector duplicateDetector(CareReportProperties properties) {
        CareReportProperties.Duplicates duplicates = properties.getDuplicates();
        return new DuplicateDetector(properties.getZone(), duplicates.getInstantTolerance(),
            duplicates.getDefaultSleepDuration());
    }

    @Bean
    public CommitDispatcher commitDispatcher(CareLogStore careLogStore) {
        return new CommitDispatcher(careLogStore);
    }

    @Bean
    @ConditionalOnProperty(value = "care-report.storage.backend", havingValue = "local", matchIfMissing = true)
    public ReportBlobStore fileSystemReportBlobStore(CareReportProperties properties) {
        Path directory = Path.of(properties.getStorage().getLocalDirectory()).toAbsolutePath();
        LOGGER.info("Pending reports are stored in local directory {}", directory);
        return new FileSystemReportBlobStore(directory);
    }

    @Bean
    public PendingReportQueue pendingReportQueue(ReportBlobStore reportBlobStore,
        TimeLimitedReportExtractor timeLimitedReportExtractor, Clock clock) {
        return new PendingReportQueue(reportBlobStore, timeLimitedReportExtractor, clock);
    }

    @Bean
    public ReviewSessionRegistry reviewSessionRegistry(CareReportProperties properties, Clock clock) {
        return new ReviewSessionRegistry(properties.getReview().getSessionTtl(), clock);
    }

    @Bean
    public ReportIngestionService reportIngestionService(TimeLimitedReportExtractor timeLimitedReportExtractor,
        DuplicateDetector duplicateDetector, CareLogStore careLogStore, CommitDispatcher commitDispatcher,
        PendingReportQueue pendingReportQueue, ReviewSessionRegistry reviewSessionRegistry,
        @Qualifier("ingestionExecutor") ExecutorService ingestionExecutor, CareReportProperties properties) {
        return new ReportIngestionService(timeLimitedReportExtractor, duplicateDetector, careLogStore,
            commitDispatcher, pendingReportQueue, reviewSessionRegistry, ingestionExecutor,
            properties.getHistory().getPadding(), properties.getHistory().getMaxWindow());
    }
}
