package dev.pekelund.docroute.tables;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.pekelund.docroute.model.BoundingBox;
import dev.pekelund.docroute.model.Table;
import dev.pekelund.docroute.source.PositionedWord;
import java.util.List;
import org.junit.jupiter.api.Test;

class GeometricTableDetectorTest {

    private final GeometricTableDetector detector = new GeometricTableDetector(new TableDetectionSettings(2, 2, 6.0));

    @Test
    void twoAlignedLinesFormOneTable() {
        List<PositionedWord> words = List.of(
            word(10, 100, "Region", 0), word(120, 100, "Sales", 0),
            word(10, 115, "North", 1), word(120, 115, "1,200", 1));

        List<Table> tables = detector.detectTables(words, 4);

        assertThat(tables).hasSize(1);
        Table table = tables.get(0);
        assertThat(table.tableId()).isEqualTo("p4_t1");
        assertThat(table.name()).isEqualTo("Page 4 Table 1");
        assertThat(table.region().pageNumber()).isEqualTo(4);
        assertThat(table.region().detectionMethod()).isEqualTo(GeometricTableDetector.DETECTION_METHOD);
        assertThat(table.region().boundingBox()).isEqualTo(new BoundingBox(10, 100, 160, 125));
        assertThat(table.headerInfo().headerRows()).containsExactly(1);
        assertThat(table.headerInfo().dataStartRow()).isEqualTo(2);
        assertThat(table.headerInfo().dataStartCol()).isEqualTo(1);
        assertThat(table.columns()).extracting(Table.TableColumn::columnLabel).containsExactly("Region", "Sales");
        assertThat(table.rows()).extracting(Table.TableRow::rowLabel).containsExactly("Region", "North");
        assertThat(table.rows()).extracting(Table.TableRow::headerRow).containsExactly(true, false);
        assertThat(table.rows().get(1).cells()).containsExactly("North", "1,200");
        assertThat(table.metadata().cellCount()).isEqualTo(4);
        assertThat(table.metadata().confidence()).isEqualTo(0.6);
    }

    @Test
    void singleLineIsRejected() {
        List<PositionedWord> words = List.of(word(10, 100, "Region", 0), word(120, 100, "Sales", 0));

        assertThat(detector.detectTables(words, 1)).isEmpty();
    }

    @Test
    void singleColumnIsRejected() {
        List<PositionedWord> words = List.of(
            word(10, 100, "alpha", 0), word(10, 115, "beta", 1), word(10, 130, "gamma", 2));

        assertThat(detector.detectTables(words, 1)).isEmpty();
    }

    @Test
    void missingWordsYieldNoTables() {
        assertThat(detector.detectTables(null, 1)).isEmpty();
        assertThat(detector.detectTables(List.of(), 1)).isEmpty();
    }

    @Test
    void defaultSettingsRequireThreeRows() {
        GeometricTableDetector strict = new GeometricTableDetector();
        List<PositionedWord> twoRows = List.of(
            word(10, 100, "Region", 0), word(120, 100, "Sales", 0),
            word(10, 115, "North", 1), word(120, 115, "1,200", 1));

        assertThat(strict.detectTables(twoRows, 1)).isEmpty();
    }

    @Test
    void emptyHeaderCellsGetGeneratedLabels() {
        List<PositionedWord> words = List.of(
            word(120, 100, "2024", 0),
            word(10, 115, "North", 1), word(120, 115, "12", 1),
            word(10, 130, "South", 2), word(120, 130, "15", 2));

        Table table = detector.detectTables(words, 2).get(0);

        assertThat(table.columns()).extracting(Table.TableColumn::columnLabel).containsExactly("Column 1", "2024");
        assertThat(table.rows().get(0).rowLabel()).isEqualTo("Row 1");
    }

    @Test
    void settingsRejectInvalidValues() {
        assertThatThrownBy(() -> new TableDetectionSettings(0, 2, 6.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TableDetectionSettings(2, 2, -1.0)).isInstanceOf(IllegalArgumentException.class);
    }

    static PositionedWord word(double x0, double y0, String text, int lineId) {
        return new PositionedWord(x0, y0, x0 + 40, y0 + 10, text, lineId);
    }
}
