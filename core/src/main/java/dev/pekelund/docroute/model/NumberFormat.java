package dev.pekelund.docroute.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Numeric literal families recognised in page text.
 */
public enum NumberFormat {
    CURRENCY("currency"),
    PERCENTAGE("percentage"),
    DECIMAL("decimal"),
    SCIENTIFIC_NOTATION("scientific_notation"),
    INTEGER("integer");

    private final String label;

    NumberFormat(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Resolves a label or constant name, ignoring case. Labels outside this set resolve to {@code null}
     * so that a reply using another number family keeps the rest of its content.
     */
    @JsonCreator
    public static NumberFormat fromLabel(String value) {
        if (value == null) {
            return null;
        }
        for (NumberFormat format : values()) {
            if (format.label.equalsIgnoreCase(value) || format.name().equalsIgnoreCase(value)) {
                return format;
            }
        }
        return null;
    }
}
