package dev.pekelund.carereport.reportparser.googleai;

import io.micrometer.observation.ObservationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

/**
 * Builds Gemini options and clients from {@code google.ai.gemini.*} properties and the
 * {@code AI_STUDIO_API_KEY} variable.
 */
public final class GeminiEnvironment {

    public static final String API_KEY_PROPERTY = "AI_STUDIO_API_KEY";
    public static final String DEFAULT_MODEL = "gemini-2.0-flash";

    private static final Logger LOGGER = LoggerFactory.getLogger(GeminiEnvironment.class);

    private GeminiEnvironment() {
        // Utility class
    }

    public static GoogleAiGeminiChatOptions chatOptions(Environment environment) {
        String modelName = environment.getProperty("google.ai.gemini.model", DEFAULT_MODEL);
        Double temperature = environment.getProperty("google.ai.gemini.temperature", Double.class);
        Double topP = environment.getProperty("google.ai.gemini.top-p", Double.class);
        Integer topK = environment.getProperty("google.ai.gemini.top-k", Integer.class);
        Integer maxOutputTokens = environment.getProperty("google.ai.gemini.max-output-tokens", Integer.class);
        LOGGER.info("Configured Google AI Gemini chat settings - model: {}, temperature: {}, topP: {}, topK: {}, maxOutputTokens: {}",
            modelName, temperature, topP, topK, maxOutputTokens);
        return GoogleAiGeminiChatOptions.builder()
            .model(modelName)
            .temperature(temperature)
            .topP(topP)
            .topK(topK)
            .maxOutputTokens(maxOutputTokens)
            .build();
    }

    public static boolean hasApiKey(Environment environment) {
        return StringUtils.hasText(environment.getProperty(API_KEY_PROPERTY));
    }

    /**
     * @throws IllegalStateException when no API key is configured
     */
    public static GoogleAiGeminiClient client(Environment environment, GoogleAiGeminiChatOptions chatOptions,
        ObservationRegistry observationRegistry) {

        String apiKey = environment.getProperty(API_KEY_PROPERTY);
        if (!StringUtils.hasText(apiKey)) {
            throw new IllegalStateException("Google AI Studio API key must be configured (" + API_KEY_PROPERTY + ")");
        }
        String baseUrl = environment.getProperty("google.ai.gemini.base-url", GoogleAiGeminiClient.DEFAULT_BASE_URL);
        RestClient restClient = RestClient.builder().baseUrl(baseUrl).build();
        GoogleAiGeminiClient client = new GoogleAiGeminiClient(restClient, apiKey, chatOptions, observationRegistry);
        LOGGER.info("Google AI Gemini client default options: {}", client.getDefaultOptions());
        return client;
    }
}
