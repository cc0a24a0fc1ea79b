package dev.pekelund.docroute.routing;

import dev.pekelund.docroute.ai.AiExtractionResponse;
import java.util.Objects;

/**
 * Result of one AI call for a page group: either a normalized response or the reason the call did not
 * produce one. A failure selects the local fallback.
 */
final class AiCallOutcome {

    enum FailureReason {
        UNAVAILABLE,
        TIMEOUT,
        CALL_FAILED,
        EMPTY_RESPONSE
    }

    private final AiExtractionResponse response;
    private final FailureReason reason;
    private final String detail;

    private AiCallOutcome(AiExtractionResponse response, FailureReason reason, String detail) {
        this.response = response;
        this.reason = reason;
        this.detail = detail;
    }

    static AiCallOutcome success(AiExtractionResponse response) {
        return new AiCallOutcome(Objects.requireNonNull(response, "response").normalized(), null, null);
    }

    static AiCallOutcome failure(FailureReason reason, String detail) {
        return new AiCallOutcome(null, Objects.requireNonNull(reason, "reason"), detail);
    }

    boolean isSuccess() {
        return response != null;
    }

    AiExtractionResponse response() {
        return response;
    }

    FailureReason reason() {
        return reason;
    }

    String describeFailure() {
        return detail != null && !detail.isBlank() ? reason.name() + ": " + detail : reason.name();
    }
}
