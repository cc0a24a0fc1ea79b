package dev.pekelund.docroute.ai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import dev.pekelund.docroute.model.Page;
import dev.pekelund.docroute.model.ProcessingSummary;
import dev.pekelund.docroute.model.Table;
import java.util.List;
import java.util.Objects;

/**
 * Response of the AI extraction capability. Every field may be missing; {@link #normalized()} fills
 * the defaults once so callers never patch the structure themselves.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record AiExtractionResponse(List<Table> tables, List<Page> pages, ProcessingSummary processingSummary) {

    static final double DEFAULT_QUALITY_SCORE = 0.6;

    public static AiExtractionResponse empty() {
        return new AiExtractionResponse(List.of(), List.of(), null);
    }

    /**
     * Returns a copy where tables and pages are non-null lists and a
     * summary is present, synthesized from the content when the response carried none.
     */
    public AiExtractionResponse normalized() {
        List<Table> resolvedTables = tables != null
            ? tables.stream().filter(Objects::nonNull).toList()
            : List.of();
        List<Page> resolvedPages = pages != null
            ? pages.stream().filter(Objects::nonNull).toList()
            : List.of();
        ProcessingSummary summary = processingSummary != null
            ? processingSummary
            : ProcessingSummary.of(resolvedTables, resolvedPages, DEFAULT_QUALITY_SCORE);
        return new AiExtractionResponse(resolvedTables, resolvedPages, summary);
    }

    /**
     * @return whether the response carries neither pages nor tables
     */
    public boolean isEmpty() {
        return (tables == null || tables.isEmpty()) && (pages == null || pages.isEmpty());
    }
}
