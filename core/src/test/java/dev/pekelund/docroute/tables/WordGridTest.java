package dev.pekelund.docroute.tables;

import static dev.pekelund.docroute.tables.GeometricTableDetectorTest.word;
import static org.assertj.core.api.Assertions.assertThat;

import dev.pekelund.docroute.source.PositionedWord;
import java.util.List;
import org.junit.jupiter.api.Test;

class WordGridTest {

    @Test
    void adjacentWordsMergeIntoOneCell() {
        List<PositionedWord> words = List.of(
            new PositionedWord(10, 100, 40, 110, "Net", 0),
            new PositionedWord(43, 100, 80, 110, "income", 0),
            new PositionedWord(150, 100, 180, 110, "42", 0));

        WordGrid grid = WordGrid.build(words, 6.0);

        assertThat(grid.columnCount()).isEqualTo(2);
        assertThat(grid.rows()).singleElement()
            .extracting(WordGrid.GridRow::values)
            .isEqualTo(List.of("Net income", "42"));
    }

    @Test
    void linesAreOrderedByLineIdAndWordsByPosition() {
        List<PositionedWord> words = List.of(
            word(120, 115, "B2", 1), word(10, 115, "A2", 1),
            word(120, 100, "B1", 0), word(10, 100, "A1", 0));

        WordGrid grid = WordGrid.build(words, 6.0);

        assertThat(grid.rows()).extracting(WordGrid.GridRow::values)
            .containsExactly(List.of("A1", "B1"), List.of("A2", "B2"));
    }

    @Test
    void slightlyShiftedLeftEdgesShareAColumn() {
        List<PositionedWord> words = List.of(
            word(10, 100, "A1", 0), word(120, 100, "B1", 0),
            word(14, 115, "A2", 1), word(125, 115, "B2", 1));

        WordGrid grid = WordGrid.build(words, 6.0);

        assertThat(grid.columnCount()).isEqualTo(2);
        assertThat(grid.countRowsWithAtLeast(2)).isEqualTo(2);
    }

    @Test
    void clusterRepresentativeIsUpperMedian() {
        List<Double> positions = WordGrid.clusterPositions(List.of(10.0, 11.0, 12.0, 13.0, 100.0), 2.0);

        assertThat(positions).containsExactly(12.0, 100.0);
    }

    @Test
    void nearestIndexPrefersFirstOnTies() {
        assertThat(WordGrid.nearestIndex(List.of(10.0, 20.0), 15.0)).isZero();
        assertThat(WordGrid.nearestIndex(List.of(10.0, 20.0), 19.0)).isEqualTo(1);
    }

    @Test
    void emptyInputBuildsEmptyGrid() {
        WordGrid grid = WordGrid.build(List.of(), 6.0);

        assertThat(grid.rows()).isEmpty();
        assertThat(grid.columnCount()).isZero();
    }
}
