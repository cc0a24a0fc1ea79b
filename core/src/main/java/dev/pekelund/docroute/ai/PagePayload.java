package dev.pekelund.docroute.ai;

import dev.pekelund.docroute.source.PositionedWord;
import java.util.List;

/**
 * Content of one page sent to the AI extraction capability.
 *
 * @param pageNumber 1-based page number
 * @param text       plain page text
 * @param words      positioned words, only filled when the client supports vision input
 */
public record PagePayload(int pageNumber, String text, List<PositionedWord> words) {

    public PagePayload {
        text = text != null ? text : "";
        words = words != null ? List.copyOf(words) : List.of();
    }
}
