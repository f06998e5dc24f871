package dev.pekelund.carereport.reportparser;

import dev.pekelund.carereport.carelog.CareLogStore;
import dev.pekelund.carereport.extraction.TimeLimitedReportExtractor;
import dev.pekelund.carereport.reportparser.googleai.GeminiClient;
import dev.pekelund.carereport.storage.ReportBlobStore;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Emits diagnostic logging when the service boots so the deployed artifact and its backends can be
 * verified from the logs.
 */
@Component
public class ReportProcessorDiagnostics implements ApplicationRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReportProcessorDiagnostics.class);

    private final Environment environment;
    private final ObjectProvider<GeminiClient> geminiClientProvider;
    private final ObjectProvider<ReportBlobStore> blobStoreProvider;
    private final ObjectProvider<CareLogStore> careLogStoreProvider;
    private final ObjectProvider<TimeLimitedReportExtractor> extractorProvider;

    public ReportProcessorDiagnostics(Environment environment, ObjectProvider<GeminiClient> geminiClientProvider,
        ObjectProvider<ReportBlobStore> blobStoreProvider, ObjectProvider<CareLogStore> careLogStoreProvider,
        ObjectProvider<TimeLimitedReportExtractor> extractorProvider) {
        this.environment = environment;
        this.geminiClientProvider = geminiClientProvider;
        this.blobStoreProvider = blobStoreProvider;
        this.careLogStoreProvider = careLogStoreProvider;
        this.extractorProvider = extractorProvider;
    }

    @Override
    public void run(ApplicationArguments args) {
        LOGGER.info("Care report service diagnostics starting");
        LOGGER.info("Active Spring profiles: {}", Arrays.toString(environment.getActiveProfiles()));
        LOGGER.info("Resolved Google AI Gemini configuration - model: {}",
            environment.getProperty("google.ai.gemini.model", "(unset)"));

        GeminiClient geminiClient = geminiClientProvider.getIfAvailable();
        if (geminiClient != null) {
            LOGGER.info("Gemini client implementation: {} - default options: {}", geminiClient.getClass().getName(),
                geminiClient.getDefaultOptions());
        } else {
            LOGGER.info("Gemini client bean not available; skipping client diagnostics");
        }

        ReportBlobStore blobStore = blobStoreProvider.getIfAvailable();
        LOGGER.info("Pending reports stored in: {}", blobStore != null ? blobStore.describe() : "(no store)");

        CareLogStore careLogStore = careLogStoreProvider.getIfAvailable();
        LOGGER.info("Care history backend: {}", careLogStore != null ? careLogStore.getClass().getName() : "(none)");

        TimeLimitedReportExtractor extractor = extractorProvider.getIfAvailable();
        if (extractor != null) {
            LOGGER.info("Report extraction timeout: {}", extractor.getTimeout());
        }
    }
}
