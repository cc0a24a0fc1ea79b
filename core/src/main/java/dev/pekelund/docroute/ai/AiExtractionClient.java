package dev.pekelund.docroute.ai;

import java.util.List;

/**
 * Boundary to the external AI extraction capability. Transport, authentication and prompting are
 * left to implementations.
 */
public interface AiExtractionClient {

    /**
     * Availability is a hint only: a call may still fail after this returned {@code true}.
     */
    boolean isAvailable();

    /**
     * @return whether the client accepts positioned words alongside the page text
     */
    default boolean supportsVision() {
        return false;
    }

    /**
     * Extracts tables and sections from a group of pages.
     *
     * @throws AiExtractionException when the capability cannot fulfil the call
     */
    AiExtractionResponse extract(List<PagePayload> pages);

    /**
     * @return a client that is never available
     */
    static AiExtractionClient disabled() {
        return DisabledAiExtractionClient.INSTANCE;
    }
}
