package dev.pekelund.docroute.tables;

import dev.pekelund.docroute.model.BoundingBox;
import dev.pekelund.docroute.model.Table;
import dev.pekelund.docroute.source.PositionedWord;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reconstructs a table from the positioned words of a page by clustering word coordinates into rows
 * and columns. Used when no other extraction produced tables.
 */
public class GeometricTableDetector {

    public static final String DETECTION_METHOD = "geometric_grid";

    private static final Logger LOGGER = LoggerFactory.getLogger(GeometricTableDetector.class);
    private static final double CONFIDENCE = 0.6;
    private static final int HEADER_ROW = 1;

    private final TableDetectionSettings settings;

    public GeometricTableDetector() {
        this(TableDetectionSettings.defaults());
    }

    public GeometricTableDetector(TableDetectionSettings settings) {
        this.settings = settings;
    }

    public TableDetectionSettings getSettings() {
        return settings;
    }

    /**
     * @param words      positioned words of one page
     * @param pageNumber 1-based page number
     * @return at most one table; empty when the words do not form an acceptable grid
     */
    public List<Table> detectTables(List<PositionedWord> words, int pageNumber) {
        if (words == null || words.isEmpty()) {
            return List.of();
        }

        WordGrid grid = WordGrid.build(words, settings.xTolerance());
        List<WordGrid.GridRow> rows = grid.rows();
        int columnCount = grid.columnCount();

        if (rows.size() < settings.minRows() || columnCount < settings.minCols()) {
            LOGGER.debug("Page {} rejected as table: {} rows, {} columns", pageNumber, rows.size(), columnCount);
            return List.of();
        }
        int populatedRows = grid.countRowsWithAtLeast(settings.minCols());
        if (populatedRows < Math.max(2, settings.minRows() - 1)) {
            LOGGER.debug("Page {} rejected as table: only {} rows fill {} columns", pageNumber, populatedRows,
                settings.minCols());
            return List.of();
        }

        LOGGER.debug("Page {} accepted as table with {} rows and {} columns", pageNumber, rows.size(), columnCount);
        return List.of(toTable(rows, columnCount, pageNumber));
    }

    private Table toTable(List<WordGrid.GridRow> rows, int columnCount, int pageNumber) {
        List<String> header = rows.get(0).values();
        List<Table.TableColumn> columns = new ArrayList<>(columnCount);
        for (int i = 0; i < columnCount; i++) {
            String label = header.get(i).isEmpty() ? "Column " + (i + 1) : header.get(i);
            columns.add(new Table.TableColumn(i + 1, label, false));
        }

        List<Table.TableRow> tableRows = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            List<String> values = rows.get(i).values();
            int rowIndex = i + 1;
            String label = values.get(0).isEmpty() ? "Row " + rowIndex : values.get(0);
            tableRows.add(new Table.TableRow(rowIndex, label, rowIndex == HEADER_ROW, values));
        }

        BoundingBox box = BoundingBox.union(rows.stream().map(WordGrid.GridRow::box).toList());
        return new Table(
            "p" + pageNumber + "_t1",
            "Page " + pageNumber + " Table 1",
            new Table.TableRegion(pageNumber, box, DETECTION_METHOD),
            new Table.HeaderInfo(List.of(HEADER_ROW), List.of(), HEADER_ROW + 1, 1),
            columns,
            tableRows,
            new Table.TableMetadata(DETECTION_METHOD, rows.size() * Math.max(1, columnCount), false, CONFIDENCE));
    }
}
