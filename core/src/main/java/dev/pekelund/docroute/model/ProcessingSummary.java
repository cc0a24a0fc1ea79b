package dev.pekelund.docroute.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

/**
 * Counters describing what an extraction step produced.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProcessingSummary(
    int tablesExtracted,
    int textSections,
    int numbersFound,
    double overallQualityScore,
    List<String> processingErrors
) {

    public ProcessingSummary {
        processingErrors = processingErrors != null ? List.copyOf(processingErrors) : List.of();
    }

    public static ProcessingSummary empty() {
        return new ProcessingSummary(0, 0, 0, 0.0, List.of());
    }

    /**
     * Counts tables, sections and numbers of the given content.
     */
    public static ProcessingSummary of(List<Table> tables, List<Page> pages, double qualityScore) {
        int sections = pages.stream().mapToInt(page -> page.sections().size()).sum();
        int numbers = pages.stream().mapToInt(Page::numberCount).sum();
        return new ProcessingSummary(tables.size(), sections, numbers, qualityScore, List.of());
    }
}
