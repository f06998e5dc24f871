package dev.pekelund.carereport.reportparser.googleai;

/**
 * Minimal client interface for invoking Google AI Studio's Gemini API.
 */
public interface GeminiClient {

    /**
     * @return the default chat options configured for the client.
     */
    GoogleAiGeminiChatOptions getDefaultOptions();

    /**
     * Generates text using Gemini for the provided prompt and optional overrides.
     *
     * @param prompt the prompt to send to the model
     * @param overrides optional overrides for the default chat options; may be {@code null}
     * @return the generated text response from Gemini
     * @throws GeminiClientException when the call fails or the response holds no text
     */
    String generateContent(String prompt, GoogleAiGeminiChatOptions overrides);

    /**
     * Generates text for a prompt accompanied by binary data, such as a photographed report.
     *
     * @param inlineData bytes sent alongside the prompt with their MIME type
     */
    String generateContent(String prompt, InlineData inlineData, GoogleAiGeminiChatOptions overrides);

    /**
     * Binary content sent inline with a prompt.
     */
    record InlineData(String mimeType, byte[] data) {
    }
}
