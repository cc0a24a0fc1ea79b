package dev.pekelund.docroute.source;

import java.util.List;

/**
 * Read access to a paginated document. Page indices are 0-based.
 */
public interface DocumentSource {

    /**
     * @return a display name for the document, typically the file name
     */
    String getName();

    int getPageCount();

    /**
     * @param pageIndex 0-based page index
     * @return the plain text of the page, never {@code null}
     * @throws DocumentSourceException when the page cannot be read
     */
    String getPageText(int pageIndex);

    /**
     * @param pageIndex 0-based page index
     * @return the positioned word tokens of the page, or an empty list when the source has none
     * @throws DocumentSourceException when the page cannot be read
     */
    List<PositionedWord> getPositionedWords(int pageIndex);
}
