package dev.pekelund.docroute.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Per-page analysis outcome.
 *
 * @param pageIndex     0-based page index
 * @param numberCount   numbers recognised on the page
 * @param numberDensity numbers per 1000 characters
 * @param layoutSignals layout hints for the page
 * @param textRatio     characters per recognised number
 * @param category      resulting classification
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PageMetric(
    int pageIndex,
    int numberCount,
    double numberDensity,
    LayoutSignals layoutSignals,
    double textRatio,
    PageCategory category
) {
}
