package dev.pekelund.carereport.reportparser.local;

import dev.pekelund.carereport.reportparser.googleai.GeminiClient;
import dev.pekelund.carereport.reportparser.googleai.GeminiClientException;
import dev.pekelund.carereport.reportparser.googleai.GoogleAiGeminiChatOptions;

/**
 * Stand-in used locally when no API key is configured. Every call fails as a transient outage, so
 * uploads exercise the pending report queue.
 */
class DisabledGeminiClient implements GeminiClient {

    private final GoogleAiGeminiChatOptions defaultOptions;

    DisabledGeminiClient(GoogleAiGeminiChatOptions defaultOptions) {
        this.defaultOptions = defaultOptions;
    }

    @Override
    public GoogleAiGeminiChatOptions getDefaultOptions() {
        return defaultOptions;
    }

    @Override
    public String generateContent(String prompt, GoogleAiGeminiChatOptions overrides) {
        throw unavailable();
    }

    @Override
    public String generateContent(String prompt, InlineData inlineData, GoogleAiGeminiChatOptions overrides) {
        throw unavailable();
    }

    private static GeminiClientException unavailable() {
        return new GeminiClientException("Gemini is not configured for local runs (set AI_STUDIO_API_KEY)", true);
    }
}
