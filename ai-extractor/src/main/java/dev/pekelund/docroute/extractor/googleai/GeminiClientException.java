package dev.pekelund.docroute.extractor.googleai;

/**
 * Raised when a Gemini request cannot be completed or its reply has no usable text.
 */
public class GeminiClientException extends RuntimeException {

    public GeminiClientException(String message) {
        super(message);
    }

    public GeminiClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
