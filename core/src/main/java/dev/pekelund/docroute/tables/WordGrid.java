package dev.pekelund.docroute.tables;

import dev.pekelund.docroute.model.BoundingBox;
import dev.pekelund.docroute.source.PositionedWord;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Row and column structure recovered from positioned words by clustering their x coordinates.
 * <p>
 * Words on the same line are merged into cells when the gap between them is within the tolerance.
 * Cell left edges from all lines are clustered into column positions with twice that tolerance and
 * every cell is placed in its nearest column. Rows left without any text are dropped.
 */
public final class WordGrid {

    private final List<Double> columnPositions;
    private final List<GridRow> rows;

    private WordGrid(List<Double> columnPositions, List<GridRow> rows) {
        this.columnPositions = List.copyOf(columnPositions);
        this.rows = List.copyOf(rows);
    }

    public static WordGrid build(List<PositionedWord> words, double xTolerance) {
        if (words == null || words.isEmpty()) {
            return new WordGrid(List.of(), List.of());
        }

        Map<Integer, List<PositionedWord>> lines = new TreeMap<>();
        for (PositionedWord word : words) {
            lines.computeIfAbsent(word.lineId(), id -> new ArrayList<>()).add(word);
        }

        List<List<Cell>> cellLines = new ArrayList<>();
        List<Double> leftEdges = new ArrayList<>();
        for (List<PositionedWord> line : lines.values()) {
            line.sort(Comparator.comparingDouble(PositionedWord::x0));
            List<Cell> cells = mergeCells(line, xTolerance);
            cells.forEach(cell -> leftEdges.add(cell.box().x0()));
            cellLines.add(cells);
        }

        leftEdges.sort(Double::compare);
        List<Double> columns = clusterPositions(leftEdges, xTolerance * 2);

        List<GridRow> rows = new ArrayList<>();
        for (List<Cell> cells : cellLines) {
            String[] values = new String[columns.size()];
            Arrays.fill(values, "");
            for (Cell cell : cells) {
                int column = nearestIndex(columns, cell.box().x0());
                values[column] = (values[column] + " " + cell.text()).strip();
            }
            if (Arrays.stream(values).anyMatch(value -> !value.isEmpty())) {
                BoundingBox box = BoundingBox.union(cells.stream().map(Cell::box).toList());
                rows.add(new GridRow(List.of(values), box));
            }
        }
        return new WordGrid(columns, rows);
    }

    public List<Double> columnPositions() {
        return columnPositions;
    }

    public int columnCount() {
        return columnPositions.size();
    }

    public List<GridRow> rows() {
        return rows;
    }

    /**
     * @return the number of rows with at least {@code minCells} non-empty cells
     */
    public int countRowsWithAtLeast(int minCells) {
        return (int) rows.stream().filter(row -> row.filledCells() >= minCells).count();
    }

    private static List<Cell> mergeCells(List<PositionedWord> line, double xTolerance) {
        List<Cell> cells = new ArrayList<>();
        List<PositionedWord> current = new ArrayList<>();
        for (PositionedWord word : line) {
            if (!current.isEmpty() && word.x0() - current.get(current.size() - 1).x1() > xTolerance) {
                cells.add(Cell.of(current));
                current = new ArrayList<>();
            }
            current.add(word);
        }
        if (!current.isEmpty()) {
            cells.add(Cell.of(current));
        }
        return cells;
    }

    static List<Double> clusterPositions(List<Double> sortedValues, double tolerance) {
        List<List<Double>> clusters = new ArrayList<>();
        for (Double value : sortedValues) {
            if (!clusters.isEmpty()) {
                List<Double> last = clusters.get(clusters.size() - 1);
                if (Math.abs(value - last.get(last.size() - 1)) <= tolerance) {
                    last.add(value);
                    continue;
                }
            }
            List<Double> cluster = new ArrayList<>();
            cluster.add(value);
            clusters.add(cluster);
        }
        List<Double> representatives = new ArrayList<>(clusters.size());
        for (List<Double> cluster : clusters) {
            representatives.add(cluster.get(cluster.size() / 2));
        }
        return representatives;
    }

    static int nearestIndex(List<Double> positions, double x) {
        int best = 0;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (int i = 0; i < positions.size(); i++) {
            double distance = Math.abs(positions.get(i) - x);
            if (distance < bestDistance) {
                bestDistance = distance;
                best = i;
            }
        }
        return best;
    }

    /**
     * One line of the grid, with one value per column.
     */
    public record GridRow(List<String> values, BoundingBox box) {

        public int filledCells() {
            return (int) values.stream().filter(value -> !value.isEmpty()).count();
        }
    }

    private record Cell(String text, BoundingBox box) {

        static Cell of(List<PositionedWord> words) {
            StringBuilder text = new StringBuilder();
            for (PositionedWord word : words) {
                if (text.length() > 0) {
                    text.append(' ');
                }
                text.append(word.text());
            }
            return new Cell(text.toString(), BoundingBox.union(words.stream().map(PositionedWord::box).toList()));
        }
    }
}
