package dev.pekelund.docroute.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where the content of a batch came from.
 */
public enum ExtractionSource {
    AI("ai"),
    LOCAL_FALLBACK("local_fallback");

    private final String label;

    ExtractionSource(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
