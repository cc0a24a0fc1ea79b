package dev.pekelund.docroute.pipeline;

import dev.pekelund.docroute.analysis.PageComplexityAnalyzer;
import dev.pekelund.docroute.model.BatchResult;
import dev.pekelund.docroute.model.DocumentMetadata;
import dev.pekelund.docroute.model.DocumentResult;
import dev.pekelund.docroute.model.ExtractionSource;
import dev.pekelund.docroute.model.Page;
import dev.pekelund.docroute.model.PageGroup;
import dev.pekelund.docroute.model.PageMetric;
import dev.pekelund.docroute.model.ProcessingSummary;
import dev.pekelund.docroute.model.Section;
import dev.pekelund.docroute.model.Table;
import dev.pekelund.docroute.reconstruct.ResultReconstructor;
import dev.pekelund.docroute.routing.AiFailoverRouter;
import dev.pekelund.docroute.source.DocumentOpener;
import dev.pekelund.docroute.source.DocumentSource;
import dev.pekelund.docroute.source.DocumentSourceException;
import dev.pekelund.docroute.source.DocumentSources;
import dev.pekelund.docroute.source.PositionedWord;
import dev.pekelund.docroute.support.PipelineMdc;
import dev.pekelund.docroute.tables.GeometricTableDetector;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one document through analysis, AI failover routing, fallback table detection and
 * reconstruction.
 * <p>
 * The pipeline always returns a result: a document that cannot be opened is replaced by an empty
 * one-page document, and AI or detection problems degrade to local output. The only exception that
 * escapes is {@link dev.pekelund.docroute.routing.PipelineCancelledException} when the caller's thread
 * is interrupted.
 */
public class DocumentFailoverPipeline {

    public static final String METHOD_ROUTING = "ai_failover_routing";
    public static final String METHOD_AI = "ai_extraction";
    public static final String METHOD_LOCAL_FALLBACK = "local_number_fallback";

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentFailoverPipeline.class);
    private static final double DEFAULT_QUALITY_SCORE = 0.5;

    private final PageComplexityAnalyzer analyzer;
    private final AiFailoverRouter router;
    private final GeometricTableDetector tableDetector;
    private final ResultReconstructor reconstructor;
    private final DocumentOpener documentOpener;

    public DocumentFailoverPipeline(PageComplexityAnalyzer analyzer, AiFailoverRouter router,
        GeometricTableDetector tableDetector, ResultReconstructor reconstructor, DocumentOpener documentOpener) {
        this.analyzer = analyzer;
        this.router = router;
        this.tableDetector = tableDetector;
        this.reconstructor = reconstructor;
        this.documentOpener = documentOpener;
    }

    /**
     * Opens the file with the configured opener and processes it. The document is closed afterwards.
     */
    public DocumentResult process(Path file) {
        String name = file != null && file.getFileName() != null ? file.getFileName().toString() : "document";
        DocumentSource source = openOrEmpty(() -> documentOpener.open(file), name);
        try {
            return process(source, name);
        } finally {
            closeQuietly(source);
        }
    }

    /**
     * Opens the bytes with the configured opener and processes them. The document is closed afterwards.
     */
    public DocumentResult process(byte[] content, String fileName) {
        String name = fileName != null ? fileName : "document";
        DocumentSource source = openOrEmpty(() -> documentOpener.open(content, name), name);
        try {
            return process(source, name);
        } finally {
            closeQuietly(source);
        }
    }

    public DocumentResult process(DocumentSource document, String fileName) {
        String filename = displayName(fileName != null ? fileName : document.getName());
        try (PipelineMdc.Context ignored = PipelineMdc.open(filename)) {
            int pageCount = document.getPageCount();
            LOGGER.info("Processing {} with {} pages", filename, pageCount);

            PipelineMdc.setStage("analyze");
            List<PageMetric> metrics = analyzer.analyzePages(document);
            List<PageGroup> groups = analyzer.groupNumericPages(metrics);
            LOGGER.info("Page analysis of {} produced {} groups: {}", filename, groups.size(), groups);

            PipelineMdc.setStage("route");
            List<BatchResult> batches = router.processGroups(document, groups);

            Set<Integer> groupedPages = new TreeSet<>();
            groups.forEach(group -> group.pageIndices().forEach(groupedPages::add));
            List<Page> codeOnlyPages = buildCodeOnlyPages(document, pageCount, groupedPages);

            int routedPages = batches.stream().mapToInt(batch -> batch.pages().size()).sum();
            if (routedPages == 0) {
                LOGGER.info("Routing produced no pages for {}; treating all {} pages as code-only", filename, pageCount);
                codeOnlyPages = buildCodeOnlyPages(document, pageCount, Set.of());
            }

            PipelineMdc.setStage("detect");
            List<Table> nativeTables = List.of();
            if (batches.stream().noneMatch(BatchResult::hasTables)) {
                nativeTables = detectNativeTables(document, metrics, groups, groupedPages);
            }

            PipelineMdc.setStage("reconstruct");
            DocumentResult merged = reconstructor.merge(batches, codeOnlyPages, nativeTables);

            DocumentResult result = merged
                .withDocumentMetadata(new DocumentMetadata(filename, pageCount, extractionMethods(batches, nativeTables)))
                .withProcessingSummary(summarize(merged, batches));
            LOGGER.info("Finished {}: {} pages, {} tables, {} numbers", filename, result.pages().size(),
                result.processingSummary().tablesExtracted(), result.processingSummary().numbersFound());
            return result;
        }
    }

    private List<Page> buildCodeOnlyPages(DocumentSource document, int pageCount, Set<Integer> groupedPages) {
        List<Page> pages = new ArrayList<>();
        for (int pageIndex = 0; pageIndex < pageCount; pageIndex++) {
            if (groupedPages.contains(pageIndex)) {
                continue;
            }
            String text = readText(document, pageIndex);
            int pageNumber = pageIndex + 1;
            pages.add(new Page(pageNumber, List.of(Section.paragraph(pageNumber, text, text, List.of()))));
        }
        return pages;
    }

    private List<Table> detectNativeTables(DocumentSource document, List<PageMetric> metrics, List<PageGroup> groups,
        Set<Integer> groupedPages) {
        List<Integer> targetPages = new ArrayList<>();
        if (!groups.isEmpty()) {
            targetPages.addAll(groupedPages);
        } else {
            metrics.stream()
                .filter(metric -> metric.numberCount() > 0)
                .forEach(metric -> targetPages.add(metric.pageIndex()));
        }

        List<Table> tables = new ArrayList<>();
        for (Integer pageIndex : targetPages) {
            List<PositionedWord> words = readWords(document, pageIndex);
            tables.addAll(tableDetector.detectTables(words, pageIndex + 1));
        }
        if (!tables.isEmpty()) {
            LOGGER.info("Geometric detection found {} tables on {} candidate pages", tables.size(), targetPages.size());
        }
        return tables;
    }

    private List<String> extractionMethods(List<BatchResult> batches, List<Table> nativeTables) {
        Set<String> methods = new LinkedHashSet<>();
        methods.add(METHOD_ROUTING);
        if (batches.stream().anyMatch(batch -> batch.source() == ExtractionSource.AI)) {
            methods.add(METHOD_AI);
        }
        if (batches.stream().anyMatch(batch -> batch.source() == ExtractionSource.LOCAL_FALLBACK)) {
            methods.add(METHOD_LOCAL_FALLBACK);
        }
        if (!nativeTables.isEmpty()) {
            methods.add(GeometricTableDetector.DETECTION_METHOD);
        }
        return List.copyOf(methods);
    }

    private ProcessingSummary summarize(DocumentResult merged, List<BatchResult> batches) {
        double quality = batches.stream()
            .mapToDouble(batch -> batch.processingSummary().overallQualityScore())
            .average()
            .orElse(DEFAULT_QUALITY_SCORE);
        return ProcessingSummary.of(merged.tableList(), merged.pages(), quality);
    }

    private DocumentSource openOrEmpty(Supplier<DocumentSource> opener, String name) {
        try {
            return opener.get();
        } catch (DocumentSourceException ex) {
            LOGGER.warn("Could not open {}; continuing with an empty one-page document", name, ex);
            return DocumentSources.emptyDocument(name);
        }
    }

    private String readText(DocumentSource document, int pageIndex) {
        try {
            String text = document.getPageText(pageIndex);
            return text != null ? text : "";
        } catch (DocumentSourceException ex) {
            LOGGER.warn("Could not read text of page {} - {}", pageIndex + 1, ex.getMessage());
            return "";
        }
    }

    private List<PositionedWord> readWords(DocumentSource document, int pageIndex) {
        try {
            List<PositionedWord> words = document.getPositionedWords(pageIndex);
            return words != null ? words : List.of();
        } catch (DocumentSourceException ex) {
            LOGGER.warn("Could not read word positions of page {}; skipping table detection - {}", pageIndex + 1,
                ex.getMessage());
            return List.of();
        }
    }

    private static String displayName(String name) {
        if (name == null || name.isBlank()) {
            return "document";
        }
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        return slash >= 0 ? name.substring(slash + 1) : name;
    }

    private static void closeQuietly(DocumentSource source) {
        if (source instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception ex) {
                LOGGER.warn("Failed to close document {}", source.getName(), ex);
            }
        }
    }
}
