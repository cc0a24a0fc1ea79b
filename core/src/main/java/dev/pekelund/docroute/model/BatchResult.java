package dev.pekelund.docroute.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

/**
 * Output of routing one page group, produced either by the AI or by the local fallback.
 *
 * @param group             the page group this batch covers
 * @param tables            tables extracted for the group
 * @param pages             pages extracted for the group
 * @param processingSummary counters for the batch
 * @param source            which path produced the batch
 * @param failureReason     why the AI path was abandoned, {@code null} when it was not
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BatchResult(
    PageGroup group,
    List<Table> tables,
    List<Page> pages,
    ProcessingSummary processingSummary,
    ExtractionSource source,
    String failureReason
) {

    public BatchResult {
        tables = tables != null ? List.copyOf(tables) : List.of();
        pages = pages != null ? List.copyOf(pages) : List.of();
        processingSummary = processingSummary != null ? processingSummary : ProcessingSummary.empty();
    }

    public boolean hasTables() {
        return !tables.isEmpty();
    }
}
