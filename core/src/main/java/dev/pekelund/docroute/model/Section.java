package dev.pekelund.docroute.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

/**
 * A span of extracted text within a page together with the numbers found in it.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Section(
    String sectionId,
    String sectionType,
    String title,
    String content,
    int wordCount,
    boolean llmReady,
    List<NumberMatch> numbers
) {

    public static final String PARAGRAPH = "paragraph";

    public Section {
        sectionType = sectionType != null ? sectionType : PARAGRAPH;
        content = content != null ? content : "";
        numbers = numbers != null ? List.copyOf(numbers) : List.of();
    }

    /**
     * Builds the single paragraph section used for pages handled without the AI.
     *
     * @param pageNumber 1-based page number the section belongs to
     * @param content    text kept in the section
     * @param sourceText text the content was sliced from, used for the word count
     * @param numbers    numbers found in {@code sourceText}
     */
    public static Section paragraph(int pageNumber, String content, String sourceText, List<NumberMatch> numbers) {
        return new Section("p" + pageNumber + "_s1", PARAGRAPH, null, content, countWords(sourceText), true, numbers);
    }

    static int countWords(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.trim().split("\\s+").length;
    }
}
