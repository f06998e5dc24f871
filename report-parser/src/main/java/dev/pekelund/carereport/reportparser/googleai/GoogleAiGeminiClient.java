package dev.pekelund.carereport.reportparser.googleai;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

/**
 * Client that invokes Google AI Studio's Gemini API using an API key.
 *
 * <p>Failures surface as {@link GeminiClientException}. Connection problems, timeouts, HTTP 429 and
 * 5xx responses are transient; every other failure is not.</p>
 */
public class GoogleAiGeminiClient implements GeminiClient {

    public static final String DEFAULT_BASE_URL = "https://generativelanguage.googleapis.com/v1beta";

    private static final Logger LOGGER = LoggerFactory.getLogger(GoogleAiGeminiClient.class);

    private final RestClient restClient;
    private final String apiKey;
    private final GoogleAiGeminiChatOptions defaultOptions;
    private final ObservationRegistry observationRegistry;

    public GoogleAiGeminiClient(RestClient restClient, String apiKey, GoogleAiGeminiChatOptions defaultOptions,
        ObservationRegistry observationRegistry) {
        this.restClient = restClient;
        this.apiKey = apiKey;
        this.defaultOptions = defaultOptions != null ? defaultOptions : GoogleAiGeminiChatOptions.builder().build();
        this.observationRegistry = observationRegistry != null ? observationRegistry : ObservationRegistry.NOOP;
    }

    @Override
    public GoogleAiGeminiChatOptions getDefaultOptions() {
        return defaultOptions;
    }

    @Override
    public String generateContent(String prompt, GoogleAiGeminiChatOptions overrides) {
        return generateContent(prompt, null, overrides);
    }

    @Override
    public String generateContent(String prompt, InlineData inlineData, GoogleAiGeminiChatOptions overrides) {
        if (!StringUtils.hasText(prompt)) {
            throw new IllegalArgumentException("Prompt must not be empty");
        }
        GoogleAiGeminiChatOptions resolvedOptions = defaultOptions.merge(overrides);
        Observation observation = Observation.start("google.ai.gemini.call", observationRegistry)
            .highCardinalityKeyValue("model", Optional.ofNullable(resolvedOptions.getModel()).orElse("(unset)"))
            .lowCardinalityKeyValue("inline", String.valueOf(inlineData != null));
        try (Observation.Scope scope = observation.openScope()) {
            LOGGER.info("Calling Google AI Gemini model '{}' with prompt length {} and {} inline bytes",
                resolvedOptions.getModel(), prompt.length(), inlineData != null ? inlineData.data().length : 0);
            GenerateContentRequest request = buildRequest(prompt, inlineData, resolvedOptions);
            GenerateContentResponse response = executeRequest(resolvedOptions.getModel(), request);
            return extractContent(response);
        } catch (RuntimeException ex) {
            observation.error(ex);
            throw ex;
        } finally {
            observation.stop();
        }
    }

    private GenerateContentRequest buildRequest(String promptText, InlineData inlineData,
        GoogleAiGeminiChatOptions options) {
        List<GenerateContentRequest.Part> parts = new ArrayList<>();
        parts.add(new GenerateContentRequest.Part(promptText, null));
        if (inlineData != null) {
            parts.add(new GenerateContentRequest.Part(null, new GenerateContentRequest.Blob(inlineData.mimeType(),
                Base64.getEncoder().encodeToString(inlineData.data()))));
        }
        GenerateContentRequest.Content content = new GenerateContentRequest.Content("user", parts);
        GenerateContentRequest.GenerationConfig generationConfig = new GenerateContentRequest.GenerationConfig(
            options.getTemperature(), options.getTopP(), options.getTopK(), options.getMaxOutputTokens(),
            CollectionUtils.isEmpty(options.getStopSequences()) ? null : options.getStopSequences(),
            options.getResponseMimeType());
        return new GenerateContentRequest(List.of(content), generationConfig);
    }

    private GenerateContentResponse executeRequest(String model, GenerateContentRequest request) {
        String modelName = StringUtils.hasText(model) ? model : defaultOptions.getModel();
        if (!StringUtils.hasText(modelName)) {
            throw new IllegalStateException("Gemini model name must be configured");
        }
        try {
            return restClient.post()
                .uri(uriBuilder -> uriBuilder
                    .path("/models/{model}:generateContent")
                    .queryParam("key", apiKey)
                    .build(modelName))
                .body(request)
                .retrieve()
                .body(GenerateContentResponse.class);
        } catch (RestClientResponseException ex) {
            int status = ex.getStatusCode().value();
            boolean transientFailure = status == 429 || status >= 500;
            LOGGER.warn("Google AI Gemini returned HTTP {} (transient: {})", status, transientFailure);
            throw new GeminiClientException("Google AI Gemini request failed with HTTP " + status, ex,
                transientFailure);
        } catch (ResourceAccessException ex) {
            throw new GeminiClientException("Google AI Gemini could not be reached: " + ex.getMessage(), ex, true);
        } catch (RestClientException ex) {
            throw new GeminiClientException("Google AI Gemini request failed", ex, false);
        }
    }

    private String extractContent(GenerateContentResponse response) {
        if (response == null || CollectionUtils.isEmpty(response.candidates())) {
            throw new GeminiClientException("Gemini response did not contain any candidates", false);
        }
        return response.candidates().stream()
            .filter(candidate -> candidate != null && candidate.content() != null)
            .flatMap(candidate -> {
                List<GenerateContentResponse.Part> parts = candidate.content().parts();
                return parts != null ? parts.stream() : List.<GenerateContentResponse.Part>of().stream();
            })
            .map(GenerateContentResponse.Part::text)
            .filter(StringUtils::hasText)
            .findFirst()
            .orElseThrow(() -> new GeminiClientException("Gemini response did not contain any text parts", false));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private record GenerateContentRequest(List<Content> contents, GenerationConfig generationConfig) {

        private record Content(String role, List<Part> parts) {
        }

        @JsonInclude(JsonInclude.Include.NON_NULL)
        private record Part(String text, Blob inlineData) {
        }

        private record Blob(String mimeType, String data) {
        }

        @JsonInclude(JsonInclude.Include.NON_NULL)
        private record GenerationConfig(Double temperature, Double topP, Integer topK, Integer maxOutputTokens,
            List<String> stopSequences, String responseMimeType) {
        }
    }

    private record GenerateContentResponse(List<Candidate> candidates) {

        private record Candidate(Content content) {
        }

        private record Content(List<Part> parts) {
        }

        private record Part(String text) {
        }
    }
}
