package dev.pekelund.docroute.analysis;

/**
 * Classification and grouping thresholds of the page complexity analyzer.
 *
 * @param minNumbersPerPage     pages below this count and below the density are low-number pages
 * @param minNumberDensity      numbers per 1000 characters
 * @param minTableLikenessScore layout score from which a numeric page counts as a probable table
 * @param maxPagesPerGroup      largest number of pages in one group
 */
public record AnalyzerThresholds(
    int minNumbersPerPage,
    double minNumberDensity,
    double minTableLikenessScore,
    int maxPagesPerGroup
) {

    public AnalyzerThresholds {
        if (minNumbersPerPage < 0) {
            throw new IllegalArgumentException("minNumbersPerPage must not be negative");
        }
        if (minNumberDensity < 0) {
            throw new IllegalArgumentException("minNumberDensity must not be negative");
        }
        if (maxPagesPerGroup < 1) {
            throw new IllegalArgumentException("maxPagesPerGroup must be at least 1");
        }
    }

    public static AnalyzerThresholds defaults() {
        return new AnalyzerThresholds(3, 0.5, 0.6, 5);
    }
}
