package dev.pekelund.medinterp.reportservice.googleai;

/**
 * Text generation through Google AI Studio's Gemini API.
 */
public interface GeminiClient {

    GoogleAiGeminiChatOptions getDefaultOptions();

    /**
     * Sends a single-turn prompt and returns the first text part of the answer.
     *
     * @param prompt the prompt to send to the model
     * @param overrides options merged over the defaults; may be {@code null}
     * @throws IllegalStateException when the call fails or the answer has no text
     */
    String generateContent(String prompt, GoogleAiGeminiChatOptions overrides);
}
