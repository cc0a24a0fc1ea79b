package dev.pekelund.docroute.routing;

/**
 * Thrown when the thread processing a document is interrupted. Outstanding AI calls are cancelled
 * before it is raised.
 */
public class PipelineCancelledException extends RuntimeException {

    public PipelineCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
