package dev.pekelund.carereport.reportparser.local;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.carereport.carelog.CareLogStore;
import dev.pekelund.carereport.carelog.InMemoryCareLogStore;
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

/**
 * Local profile: history lives in memory and Gemini is only called when an API key is present.
 */
@Configuration
@Profile("local-report-test")
public class LocalReportTestConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(LocalReportTestConfiguration.class);

    @Bean
    public GoogleAiGeminiChatOptions reportGeminiChatOptions(Environment environment) {
        return GeminiEnvironment.chatOptions(environment);
    }

    @Bean
    public GeminiClient geminiClient(Environment environment, GoogleAiGeminiChatOptions reportGeminiChatOptions,
        ObjectProvider<ObservationRegistry> observationRegistry) {
        if (!GeminiEnvironment.hasApiKey(environment)) {
            LOGGER.warn("{} is not set; uploads will be queued as pending reports",
                GeminiEnvironment.API_KEY_PROPERTY);
            return new DisabledGeminiClient(reportGeminiChatOptions);
        }
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
    public CareLogStore careLogStore() {
        return new InMemoryCareLogStore();
    }
}
