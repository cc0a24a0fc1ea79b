package dev.pekelund.docroute.analysis;

import dev.pekelund.docroute.model.LayoutSignals;
import dev.pekelund.docroute.source.PositionedWord;
import java.util.List;

/**
 * Computes layout hints for a page. Implementations must be stateless.
 */
@FunctionalInterface
public interface LayoutSignalProvider {

    /**
     * @param pageIndex 0-based page index
     * @param text      page text
     * @param words     positioned words of the page, possibly empty
     */
    LayoutSignals signalsFor(int pageIndex, String text, List<PositionedWord> words);

    /**
     * @return whether the provider reads positioned words, so callers can skip loading them otherwise
     */
    default boolean usesPositionedWords() {
        return false;
    }

    /**
     * Provider that reports no layout signal; numeric pages then always classify as numeric text.
     */
    static LayoutSignalProvider none() {
        return (pageIndex, text, words) -> LayoutSignals.NONE;
    }
}
