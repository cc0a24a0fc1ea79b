package dev.pekelund.docroute.analysis;

import dev.pekelund.docroute.model.LayoutSignals;
import dev.pekelund.docroute.source.PositionedWord;
import dev.pekelund.docroute.tables.TableDetectionSettings;
import dev.pekelund.docroute.tables.WordGrid;
import java.util.List;

/**
 * Scores table-likeness as the share of text rows that fill at least two aligned columns.
 */
public class ColumnAlignmentSignalProvider implements LayoutSignalProvider {

    private final double xTolerance;

    public ColumnAlignmentSignalProvider() {
        this(TableDetectionSettings.DEFAULT_X_TOLERANCE);
    }

    public ColumnAlignmentSignalProvider(double xTolerance) {
        this.xTolerance = xTolerance;
    }

    @Override
    public LayoutSignals signalsFor(int pageIndex, String text, List<PositionedWord> words) {
        if (words == null || words.isEmpty()) {
            return LayoutSignals.NONE;
        }
        WordGrid grid = WordGrid.build(words, xTolerance);
        if (grid.columnCount() < 2 || grid.rows().isEmpty()) {
            return LayoutSignals.NONE;
        }
        double aligned = grid.countRowsWithAtLeast(2);
        return new LayoutSignals(aligned / grid.rows().size());
    }

    @Override
    public boolean usesPositionedWords() {
        return true;
    }
}
