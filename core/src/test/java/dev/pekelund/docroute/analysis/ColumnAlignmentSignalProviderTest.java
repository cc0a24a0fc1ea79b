package dev.pekelund.docroute.analysis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import dev.pekelund.docroute.model.LayoutSignals;
import dev.pekelund.docroute.source.PositionedWord;
import java.util.List;
import org.junit.jupiter.api.Test;

class ColumnAlignmentSignalProviderTest {

    private final ColumnAlignmentSignalProvider provider = new ColumnAlignmentSignalProvider();

    @Test
    void scoresShareOfRowsFillingTwoColumns() {
        List<PositionedWord> words = List.of(
            word(10, 100, "Region", 0), word(120, 100, "Sales", 0),
            word(10, 115, "North", 1), word(120, 115, "12", 1),
            word(10, 130, "Notes follow", 2),
            word(10, 145, "South", 3), word(120, 145, "15", 3));

        LayoutSignals signals = provider.signalsFor(0, "", words);

        assertThat(signals.tableLikeness()).isEqualTo(0.75, within(1e-9));
    }

    @Test
    void singleColumnTextScoresZero() {
        List<PositionedWord> words = List.of(word(10, 100, "Plain", 0), word(10, 115, "prose", 1));

        assertThat(provider.signalsFor(0, "Plain prose", words)).isEqualTo(LayoutSignals.NONE);
    }

    @Test
    void missingWordsScoreZero() {
        assertThat(provider.signalsFor(0, "text", List.of())).isEqualTo(LayoutSignals.NONE);
        assertThat(provider.usesPositionedWords()).isTrue();
        assertThat(LayoutSignalProvider.none().usesPositionedWords()).isFalse();
    }

    private static PositionedWord word(double x0, double y0, String text, int lineId) {
        return new PositionedWord(x0, y0, x0 + 40, y0 + 10, text, lineId);
    }
}
