package dev.pekelund.docroute.analysis;

import dev.pekelund.docroute.model.LayoutSignals;
import dev.pekelund.docroute.model.PageCategory;
import dev.pekelund.docroute.model.PageGroup;
import dev.pekelund.docroute.model.PageMetric;
import dev.pekelund.docroute.numbers.NumberExtractor;
import dev.pekelund.docroute.source.DocumentSource;
import dev.pekelund.docroute.source.DocumentSourceException;
import dev.pekelund.docroute.source.PositionedWord;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies pages by numeric density and layout and groups consecutive numeric pages for AI
 * routing.
 */
public class PageComplexityAnalyzer {

    private static final Logger LOGGER = LoggerFactory.getLogger(PageComplexityAnalyzer.class);

    private final AnalyzerThresholds thresholds;
    private final NumberExtractor numberExtractor;
    private final LayoutSignalProvider layoutSignalProvider;

    public PageComplexityAnalyzer(AnalyzerThresholds thresholds) {
        this(thresholds, new NumberExtractor(), LayoutSignalProvider.none());
    }

    public PageComplexityAnalyzer(AnalyzerThresholds thresholds, NumberExtractor numberExtractor,
        LayoutSignalProvider layoutSignalProvider) {
        this.thresholds = thresholds != null ? thresholds : AnalyzerThresholds.defaults();
        this.numberExtractor = numberExtractor != null ? numberExtractor : new NumberExtractor();
        this.layoutSignalProvider = layoutSignalProvider != null ? layoutSignalProvider : LayoutSignalProvider.none();
    }

    public AnalyzerThresholds getThresholds() {
        return thresholds;
    }

    /**
     * Computes one metric per page, in page order.
     */
    public List<PageMetric> analyzePages(DocumentSource document) {
        int pageCount = document.getPageCount();
        List<PageMetric> metrics = new ArrayList<>(pageCount);
        for (int pageIndex = 0; pageIndex < pageCount; pageIndex++) {
            String text = readText(document, pageIndex);
            List<PositionedWord> words = layoutSignalProvider.usesPositionedWords()
                ? readWords(document, pageIndex)
                : List.of();
            metrics.add(analyzePage(pageIndex, text, words));
        }
        if (LOGGER.isDebugEnabled()) {
            metrics.forEach(metric -> LOGGER.debug("Page {} - {} numbers, density {}, category {}",
                metric.pageIndex() + 1, metric.numberCount(), String.format("%.2f", metric.numberDensity()),
                metric.category().label()));
        }
        return metrics;
    }

    PageMetric analyzePage(int pageIndex, String text, List<PositionedWord> words) {
        int numberCount = numberExtractor.count(text);
        int charCount = Math.max(text.length(), 1);
        double numberDensity = (double) numberCount / charCount * 1000.0;
        LayoutSignals signals = layoutSignalProvider.signalsFor(pageIndex, text, words);
        double textRatio = (double) charCount / Math.max(numberCount, 1);
        return new PageMetric(pageIndex, numberCount, numberDensity, signals, textRatio,
            categorize(numberCount, numberDensity, signals));
    }

    PageCategory categorize(int numberCount, double numberDensity, LayoutSignals signals) {
        if (numberCount < thresholds.minNumbersPerPage() && numberDensity < thresholds.minNumberDensity()) {
            return PageCategory.NONE_OR_LOW_NUMBERS;
        }
        if (signals.tableLikeness() >= thresholds.minTableLikenessScore()) {
            return PageCategory.PROBABLE_TABLE;
        }
        return PageCategory.NUMERIC_TEXT;
    }

    /**
     * Groups runs of consecutive complex pages. A page of another category, or a gap in the page
     * indices, closes the current run; each run is split into chunks of at most
     * {@code maxPagesPerGroup} pages. Groups are returned in page order.
     */
    public List<PageGroup> groupNumericPages(List<PageMetric> metrics) {
        List<PageGroup> groups = new ArrayList<>();
        List<Integer> run = new ArrayList<>();
        for (PageMetric metric : metrics) {
            if (metric.category() != null && metric.category().isComplex()) {
                if (!run.isEmpty() && metric.pageIndex() != run.get(run.size() - 1) + 1) {
                    flush(run, groups);
                }
                run.add(metric.pageIndex());
            } else {
                flush(run, groups);
            }
        }
        flush(run, groups);
        LOGGER.debug("Grouped complex pages into {}", groups);
        return groups;
    }

    private void flush(List<Integer> run, List<PageGroup> groups) {
        int max = thresholds.maxPagesPerGroup();
        for (int i = 0; i < run.size(); i += max) {
            List<Integer> chunk = run.subList(i, Math.min(i + max, run.size()));
            groups.add(new PageGroup(chunk.get(0), chunk.get(chunk.size() - 1)));
        }
        run.clear();
    }

    private String readText(DocumentSource document, int pageIndex) {
        try {
            String text = document.getPageText(pageIndex);
            return text != null ? text : "";
        } catch (DocumentSourceException ex) {
            LOGGER.warn("Could not read text of page {}; analysing it as empty - {}", pageIndex + 1, ex.getMessage());
            return "";
        }
    }

    private List<PositionedWord> readWords(DocumentSource document, int pageIndex) {
        try {
            List<PositionedWord> words = document.getPositionedWords(pageIndex);
            return words != null ? words : List.of();
        } catch (DocumentSourceException ex) {
            LOGGER.warn("Could not read word positions of page {} - {}", pageIndex + 1, ex.getMessage());
            return List.of();
        }
    }
}
