package dev.pekelund.docroute.source;

/**
 * Signals that a document or one of its pages could not be opened or read.
 */
public class DocumentSourceException extends RuntimeException {

    public DocumentSourceException(String message) {
        super(message);
    }

    public DocumentSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
