package dev.pekelund.docroute.source;

import java.io.IOException;
import java.nio.file.Path;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens PDF documents with Apache PDFBox.
 */
public class PdfBoxDocumentOpener implements DocumentOpener {

    private static final Logger LOGGER = LoggerFactory.getLogger(PdfBoxDocumentOpener.class);

    @Override
    public PdfBoxDocumentSource open(Path file) {
        if (file == null) {
            throw new DocumentSourceException("Cannot open a document without a path");
        }
        String name = file.getFileName() != null ? file.getFileName().toString() : file.toString();
        try {
            PDDocument document = PDDocument.load(file.toFile());
            LOGGER.info("Opened PDF {} with {} pages", name, document.getNumberOfPages());
            return new PdfBoxDocumentSource(document, name);
        } catch (IOException ex) {
            throw new DocumentSourceException("Failed to open PDF document " + name, ex);
        }
    }

    @Override
    public PdfBoxDocumentSource open(byte[] content, String name) {
        if (content == null || content.length == 0) {
            throw new DocumentSourceException("Cannot open an empty PDF document");
        }
        try {
            PDDocument document = PDDocument.load(content);
            LOGGER.info("Opened PDF {} ({} bytes) with {} pages", name, content.length, document.getNumberOfPages());
            return new PdfBoxDocumentSource(document, name);
        } catch (IOException ex) {
            throw new DocumentSourceException("Failed to open PDF document " + name, ex);
        }
    }
}
