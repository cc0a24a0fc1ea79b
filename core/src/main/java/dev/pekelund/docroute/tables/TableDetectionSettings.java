package dev.pekelund.docroute.tables;

/**
 * Acceptance thresholds and tolerances for geometric table detection.
 *
 * @param minRows    minimum number of non-empty rows
 * @param minCols    minimum number of column positions
 * @param xTolerance largest horizontal gap between two words of the same cell
 */
public record TableDetectionSettings(int minRows, int minCols, double xTolerance) {

    public static final int DEFAULT_MIN_ROWS = 3;
    public static final int DEFAULT_MIN_COLS = 2;
    public static final double DEFAULT_X_TOLERANCE = 6.0;

    public TableDetectionSettings {
        if (minRows < 1) {
            throw new IllegalArgumentException("minRows must be at least 1");
        }
        if (minCols < 1) {
            throw new IllegalArgumentException("minCols must be at least 1");
        }
        if (xTolerance < 0) {
            throw new IllegalArgumentException("xTolerance must not be negative");
        }
    }

    public static TableDetectionSettings defaults() {
        return new TableDetectionSettings(DEFAULT_MIN_ROWS, DEFAULT_MIN_COLS, DEFAULT_X_TOLERANCE);
    }

    public TableDetectionSettings withMinRows(int rows) {
        return new TableDetectionSettings(rows, minCols, xTolerance);
    }
}
