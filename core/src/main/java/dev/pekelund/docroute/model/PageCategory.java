package dev.pekelund.docroute.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classification assigned to a page by the complexity analyzer.
 */
public enum PageCategory {
    NONE_OR_LOW_NUMBERS("none_or_low_numbers"),
    NUMERIC_TEXT("numeric_text"),
    PROBABLE_TABLE("probable_table");

    private final String label;

    PageCategory(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * @return {@code true} for categories that are routed to the AI in groups
     */
    public boolean isComplex() {
        return this == NUMERIC_TEXT || this == PROBABLE_TABLE;
    }
}
