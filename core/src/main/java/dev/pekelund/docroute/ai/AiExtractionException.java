package dev.pekelund.docroute.ai;

/**
 * Signals that the AI extraction capability could not produce a usable response.
 */
public class AiExtractionException extends RuntimeException {

    public AiExtractionException(String message) {
        super(message);
    }

    public AiExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
