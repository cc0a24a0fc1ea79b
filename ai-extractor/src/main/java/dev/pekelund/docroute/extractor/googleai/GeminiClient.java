package dev.pekelund.docroute.extractor.googleai;

/**
 * Text generation against Google AI Studio's Gemini API.
 */
public interface GeminiClient {

    GoogleAiGeminiChatOptions getDefaultOptions();

    /**
     * @param prompt    prompt text, must not be blank
     * @param overrides merged over the default options; may be {@code null}
     * @return the first non-empty text part of the reply
     * @throws GeminiClientException when the request fails or the reply carries no text
     */
    String generateContent(String prompt, GoogleAiGeminiChatOptions overrides);
}
