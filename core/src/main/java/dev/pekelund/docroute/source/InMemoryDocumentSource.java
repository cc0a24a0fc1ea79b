package dev.pekelund.docroute.source;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Document source backed by page content already held in memory.
 */
public class InMemoryDocumentSource implements DocumentSource {

    private final String name;
    private final List<SourcePage> pages;

    public InMemoryDocumentSource(String name, List<SourcePage> pages) {
        this.name = name;
        this.pages = List.copyOf(Objects.requireNonNull(pages, "pages"));
    }

    /**
     * Creates a source whose pages carry text only.
     */
    public static InMemoryDocumentSource ofTexts(String name, List<String> pageTexts) {
        List<SourcePage> pages = new ArrayList<>(pageTexts.size());
        for (String text : pageTexts) {
            pages.add(SourcePage.ofText(text));
        }
        return new InMemoryDocumentSource(name, pages);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public int getPageCount() {
        return pages.size();
    }

    @Override
    public String getPageText(int pageIndex) {
        return page(pageIndex).text();
    }

    @Override
    public List<PositionedWord> getPositionedWords(int pageIndex) {
        return page(pageIndex).words();
    }

    private SourcePage page(int pageIndex) {
        if (pageIndex < 0 || pageIndex >= pages.size()) {
            throw new DocumentSourceException("Page index " + pageIndex + " is outside 0.." + (pages.size() - 1));
        }
        return pages.get(pageIndex);
    }

    /**
     * Content of one in-memory page.
     */
    public record SourcePage(String text, List<PositionedWord> words) {

        public SourcePage {
            text = text != null ? text : "";
            words = words != null ? List.copyOf(words) : List.of();
        }

        public static SourcePage ofText(String text) {
            return new SourcePage(text, List.of());
        }
    }
}
