package dev.pekelund.docroute.source;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Document source reading page text and word positions from a PDF through Apache PDFBox.
 * Instances are not thread-safe and must be closed.
 */
public class PdfBoxDocumentSource implements DocumentSource, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(PdfBoxDocumentSource.class);

    private final PDDocument document;
    private final String name;
    private final Map<Integer, String> textCache = new HashMap<>();
    private final Map<Integer, List<PositionedWord>> wordCache = new HashMap<>();

    public PdfBoxDocumentSource(PDDocument document, String name) {
        this.document = document;
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int getPageCount() {
        return document.getNumberOfPages();
    }

    @Override
    public String getPageText(int pageIndex) {
        checkIndex(pageIndex);
        return textCache.computeIfAbsent(pageIndex, this::readText);
    }

    @Override
    public List<PositionedWord> getPositionedWords(int pageIndex) {
        checkIndex(pageIndex);
        return wordCache.computeIfAbsent(pageIndex, this::readWords);
    }

    private String readText(int pageIndex) {
        try {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setStartPage(pageIndex + 1);
            stripper.setEndPage(pageIndex + 1);
            String text = stripper.getText(document);
            return text != null ? text : "";
        } catch (IOException ex) {
            throw new DocumentSourceException("Failed to read text of page " + (pageIndex + 1) + " in " + name, ex);
        }
    }

    private List<PositionedWord> readWords(int pageIndex) {
        try {
            List<PositionedWord> words = new PositionedWordStripper().extract(document, pageIndex);
            LOGGER.debug("Read {} positioned words from page {} of {}", words.size(), pageIndex + 1, name);
            return words;
        } catch (IOException ex) {
            throw new DocumentSourceException("Failed to read word positions of page " + (pageIndex + 1) + " in " + name,
                ex);
        }
    }

    private void checkIndex(int pageIndex) {
        if (pageIndex < 0 || pageIndex >= getPageCount()) {
            throw new DocumentSourceException("Page index " + pageIndex + " is outside the document " + name);
        }
    }

    @Override
    public void close() {
        try {
            document.close();
        } catch (IOException ex) {
            LOGGER.warn("Failed to close PDF document {}", name, ex);
        }
    }
}
