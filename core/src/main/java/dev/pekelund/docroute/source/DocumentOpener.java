package dev.pekelund.docroute.source;

import java.nio.file.Path;

/**
 * Opens documents from files or raw bytes.
 */
public interface DocumentOpener {

    /**
     * @throws DocumentSourceException when the document cannot be opened
     */
    DocumentSource open(Path file);

    /**
     * @throws DocumentSourceException when the document cannot be opened
     */
    DocumentSource open(byte[] content, String name);
}
