package dev.pekelund.docroute.reconstruct;

import dev.pekelund.docroute.model.BatchResult;
import dev.pekelund.docroute.model.DocumentMetadata;
import dev.pekelund.docroute.model.DocumentResult;
import dev.pekelund.docroute.model.Page;
import dev.pekelund.docroute.model.ProcessingSummary;
import dev.pekelund.docroute.model.Table;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges routed batches, code-only pages and locally detected tables into one document.
 * <p>
 * Pages are keyed by page number and the first page inserted for a number wins: batch pages are
 * inserted before code-only pages, so a code-only page never replaces a page produced by routing.
 * Tables are not deduplicated.
 */
public class ResultReconstructor {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResultReconstructor.class);

    public DocumentResult merge(List<BatchResult> batchResults, List<Page> codeOnlyPages, List<Table> nativeTables) {
        Map<Integer, Page> pagesByNumber = new TreeMap<>();
        List<Table> batchTables = new ArrayList<>();
        for (BatchResult batch : batchResults) {
            for (Page page : batch.pages()) {
                Page existing = pagesByNumber.putIfAbsent(page.pageNumber(), page);
                if (existing != null) {
                    LOGGER.warn("Page {} was produced by more than one batch; keeping the first", page.pageNumber());
                }
            }
            batchTables.addAll(batch.tables());
        }
        if (codeOnlyPages != null) {
            for (Page page : codeOnlyPages) {
                pagesByNumber.putIfAbsent(page.pageNumber(), page);
            }
        }

        List<Table> tables = new ArrayList<>();
        if (nativeTables != null) {
            tables.addAll(nativeTables);
        }
        tables.addAll(batchTables);

        List<Page> orderedPages = List.copyOf(pagesByNumber.values());
        LOGGER.debug("Merged {} pages and {} tables ({} detected locally)", orderedPages.size(), tables.size(),
            tables.size() - batchTables.size());
        return new DocumentResult(
            DocumentMetadata.empty(),
            new DocumentResult.Tables(tables),
            new DocumentResult.TextContent(orderedPages),
            ProcessingSummary.of(tables, orderedPages, 0.0));
    }
}
