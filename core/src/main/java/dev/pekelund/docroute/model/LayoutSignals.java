package dev.pekelund.docroute.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Layout hints computed for a page.
 *
 * @param tableLikeness how strongly the page looks like a table, in {@code [0, 1]}
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record LayoutSignals(double tableLikeness) {

    public static final LayoutSignals NONE = new LayoutSignals(0.0);

    public LayoutSignals {
        tableLikeness = Math.max(0.0, Math.min(1.0, tableLikeness));
    }
}
