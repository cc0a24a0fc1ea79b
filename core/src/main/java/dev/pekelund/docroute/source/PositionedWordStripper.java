package dev.pekelund.docroute.source;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

/**
 * Text stripper that records a box for every word it writes, numbering the lines of the page as it
 * goes.
 */
class PositionedWordStripper extends PDFTextStripper {

    private final List<PositionedWord> words = new ArrayList<>();
    private int lineId;

    PositionedWordStripper() throws IOException {
        super();
        setSortByPosition(true);
    }

    /**
     * @param pageIndex 0-based page index
     */
    List<PositionedWord> extract(PDDocument document, int pageIndex) throws IOException {
        words.clear();
        lineId = 0;
        setStartPage(pageIndex + 1);
        setEndPage(pageIndex + 1);
        try (Writer sink = new StringWriter()) {
            writeText(document, sink);
        }
        return List.copyOf(words);
    }

    @Override
    protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
        List<TextPosition> current = new ArrayList<>();
        for (TextPosition position : textPositions) {
            String unicode = position.getUnicode();
            if (unicode == null || unicode.isBlank()) {
                addWord(current);
                current = new ArrayList<>();
            } else {
                current.add(position);
            }
        }
        addWord(current);
        super.writeString(text, textPositions);
    }

    @Override
    protected void writeLineSeparator() throws IOException {
        lineId++;
        super.writeLineSeparator();
    }

    private void addWord(List<TextPosition> positions) {
        if (positions.isEmpty()) {
            return;
        }
        StringBuilder text = new StringBuilder();
        double x0 = Double.MAX_VALUE;
        double x1 = -Double.MAX_VALUE;
        double top = Double.MAX_VALUE;
        double baseline = -Double.MAX_VALUE;
        for (TextPosition position : positions) {
            text.append(position.getUnicode());
            x0 = Math.min(x0, position.getXDirAdj());
            x1 = Math.max(x1, position.getXDirAdj() + position.getWidthDirAdj());
            top = Math.min(top, position.getYDirAdj() - position.getHeightDir());
            baseline = Math.max(baseline, position.getYDirAdj());
        }
        words.add(new PositionedWord(x0, top, x1, baseline, text.toString(), lineId));
    }
}
