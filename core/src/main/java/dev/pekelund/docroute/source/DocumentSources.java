package dev.pekelund.docroute.source;

import java.util.List;

/**
 * Factory methods for document sources.
 */
public final class DocumentSources {

    private DocumentSources() {
        // Utility class
    }

    /**
     * Minimal valid document used in place of a source that could not be opened: one page without
     * any text or words.
     */
    public static DocumentSource emptyDocument(String name) {
        return new InMemoryDocumentSource(name, List.of(InMemoryDocumentSource.SourcePage.ofText("")));
    }
}
