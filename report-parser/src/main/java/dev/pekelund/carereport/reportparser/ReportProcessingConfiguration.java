package dev.pekelund.carereport.reportparser;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.FirestoreOptions;
import dev.pekelund.carereport.carelog.CareLogStore;
import dev.pekelund.carereport.reportparser.firestore.FirestoreCareLogStore;
import dev.pekelund.carereport.reportparser.googleai.GeminiClient;
import dev.pekelund.carereport.reportparser.googleai.GeminiEnvironment;
import dev.pekelund.carereport.reportparser.googleai.GeminiReportExtractor;
import dev.pekelund.carereport.reportparser.googleai.GeminiReportTextRecognizer;
import dev.pekelund.carereport.reportparser.googleai.GoogleAiGeminiChatOptions;
import io.micrometer.observation.ObservationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;
import org.springframework.core.env.Environment;
import org.springframework.util.StringUtils;

/**
 * Service configuration for the Cloud Run deployment: Gemini extraction and Firestore history.
 */
@Configuration
@Profile("!local-report-test")
public class ReportProcessingConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReportProcessingConfiguration.class);

    @Bean
    public GoogleAiGeminiChatOptions reportGeminiChatOptions(Environment environment) {
        return GeminiEnvironment.chatOptions(environment);
    }

    @Bean
    public GeminiClient geminiClient(Environment environment, GoogleAiGeminiChatOptions reportGeminiChatOptions,
        ObjectProvider<ObservationRegistry> observationRegistry) {
        return GeminiEnvironment.client(environment, reportGeminiChatOptions,
            observationRegistry.getIfAvailable(() -> ObservationRegistry.NOOP));
    }

    @Bean
    public GeminiReportTextRecognizer geminiReportTextRecognizer(GeminiClient geminiClient,
        GoogleAiGeminiChatOptions reportGeminiChatOptions) {
        return new GeminiReportTextRecognizer(geminiClient, reportGeminiChatOptions);
    }

    @Bean
    public GeminiReportExtractor geminiReportExtractor(GeminiClient geminiClient,
        GeminiReportTextRecognizer geminiReportTextRecognizer, ObjectMapper objectMapper,
        GoogleAiGeminiChatOptions reportGeminiChatOptions) {
        return new GeminiReportExtractor(geminiClient, geminiReportTextRecognizer, objectMapper,
            reportGeminiChatOptions);
    }

    @Bean
    public ReportProcessingSettings reportProcessingSettings() {
        return ReportProcessingSettings.fromEnvironment();
    }

    @Bean
    public Firestore firestore(ReportProcessingSettings reportProcessingSettings) {
        FirestoreOptions.Builder optionsBuilder = FirestoreOptions.getDefaultInstance().toBuilder();
        if (StringUtils.hasText(reportProcessingSettings.projectId())) {
            optionsBuilder.setProjectId(reportProcessingSettings.projectId());
        }
        Firestore firestore = optionsBuilder.build().getService();
        LOGGER.info("Initialized Firestore client for project '{}' (collections {})",
            firestore.getOptions().getProjectId(), reportProcessingSettings.collections());
        return firestore;
    }

    @Bean
    public CareLogStore careLogStore(Firestore firestore, ReportProcessingSettings reportProcessingSettings) {
        return new FirestoreCareLogStore(firestore, reportProcessingSettings.collections());
    }
}
