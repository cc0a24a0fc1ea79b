package dev.pekelund.docroute.ai;

import java.util.List;

/**
 * Client used when no AI capability is configured. It reports itself unavailable so every group is
 * handled by the local fallback.
 */
final class DisabledAiExtractionClient implements AiExtractionClient {

    static final DisabledAiExtractionClient INSTANCE = new DisabledAiExtractionClient();

    private DisabledAiExtractionClient() {
    }

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public AiExtractionResponse extract(List<PagePayload> pages) {
        throw new AiExtractionException("AI extraction is disabled");
    }
}
