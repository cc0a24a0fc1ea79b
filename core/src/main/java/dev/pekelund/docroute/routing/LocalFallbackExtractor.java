package dev.pekelund.docroute.routing;

import dev.pekelund.docroute.ai.PagePayload;
import dev.pekelund.docroute.model.BatchResult;
import dev.pekelund.docroute.model.ExtractionSource;
import dev.pekelund.docroute.model.NumberMatch;
import dev.pekelund.docroute.model.Page;
import dev.pekelund.docroute.model.PageGroup;
import dev.pekelund.docroute.model.ProcessingSummary;
import dev.pekelund.docroute.model.Section;
import dev.pekelund.docroute.numbers.NumberExtractor;
import java.util.ArrayList;
import java.util.List;

/**
 * Produces a batch from page text alone when the AI cannot: one paragraph section per page carrying
 * the numbers recognised in the page text. Never produces tables.
 */
public class LocalFallbackExtractor {

    static final int MAX_CONTENT_LENGTH = 2000;
    static final double QUALITY_SCORE = 0.5;

    private final NumberExtractor numberExtractor;

    public LocalFallbackExtractor(NumberExtractor numberExtractor) {
        this.numberExtractor = numberExtractor;
    }

    public BatchResult extract(PageGroup group, List<PagePayload> pages, String failureReason) {
        List<Page> extracted = new ArrayList<>(pages.size());
        int totalNumbers = 0;
        for (PagePayload payload : pages) {
            String text = payload.text();
            List<NumberMatch> numbers = numberExtractor.extract(text);
            totalNumbers += numbers.size();
            String content = text.length() > MAX_CONTENT_LENGTH ? text.substring(0, MAX_CONTENT_LENGTH) : text;
            extracted.add(new Page(payload.pageNumber(),
                List.of(Section.paragraph(payload.pageNumber(), content, text, numbers))));
        }
        ProcessingSummary summary = new ProcessingSummary(0, extracted.size(), totalNumbers, QUALITY_SCORE, List.of());
        return new BatchResult(group, List.of(), extracted, summary, ExtractionSource.LOCAL_FALLBACK, failureReason);
    }
}
