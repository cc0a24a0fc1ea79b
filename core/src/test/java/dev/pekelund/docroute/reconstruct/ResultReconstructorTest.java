package dev.pekelund.docroute.reconstruct;

import static dev.pekelund.docroute.ModelFixtures.page;
import static dev.pekelund.docroute.ModelFixtures.table;
import static org.assertj.core.api.Assertions.assertThat;

import dev.pekelund.docroute.model.BatchResult;
import dev.pekelund.docroute.model.DocumentResult;
import dev.pekelund.docroute.model.ExtractionSource;
import dev.pekelund.docroute.model.Page;
import dev.pekelund.docroute.model.PageGroup;
import dev.pekelund.docroute.model.Table;
import java.util.List;
import org.junit.jupiter.api.Test;

class ResultReconstructorTest {

    private final ResultReconstructor reconstructor = new ResultReconstructor();

    @Test
    void mergesPagesInNumberOrder() {
        BatchResult batch = aiBatch(List.of(page(2, "ai page")), List.of());

        DocumentResult result = reconstructor.merge(List.of(batch), List.of(page(3, "code"), page(1, "code")),
            List.of());

        assertThat(result.pages()).extracting(Page::pageNumber).containsExactly(1, 2, 3);
    }

    @Test
    void batchPageWinsOverCodeOnlyPage() {
        BatchResult batch = aiBatch(List.of(page(2, "ai page")), List.of());

        DocumentResult result = reconstructor.merge(List.of(batch), List.of(page(2, "code page")), List.of());

        assertThat(result.pages()).singleElement()
            .satisfies(page -> assertThat(page.sections().get(0).content()).isEqualTo("ai page"));
    }

    @Test
    void nativeTablesComeBeforeBatchTables() {
        Table aiTable = table("p1_t1", 1);
        Table nativeTable = table("p3_t1", 3);
        BatchResult batch = aiBatch(List.of(page(1, "ai")), List.of(aiTable));

        DocumentResult result = reconstructor.merge(List.of(batch), List.of(), List.of(nativeTable));

        assertThat(result.tableList()).containsExactly(nativeTable, aiTable);
        assertThat(result.processingSummary().tablesExtracted()).isEqualTo(2);
        assertThat(result.processingSummary().textSections()).isEqualTo(1);
    }

    @Test
    void firstBatchKeepsDuplicatePage() {
        BatchResult first = aiBatch(List.of(page(1, "first")), List.of());
        BatchResult second = aiBatch(List.of(page(1, "second")), List.of());

        DocumentResult result = reconstructor.merge(List.of(first, second), null, null);

        assertThat(result.pages()).singleElement()
            .satisfies(page -> assertThat(page.sections().get(0).content()).isEqualTo("first"));
    }

    @Test
    void emptyInputYieldsEmptyDocument() {
        DocumentResult result = reconstructor.merge(List.of(), List.of(), List.of());

        assertThat(result.pages()).isEmpty();
        assertThat(result.tableList()).isEmpty();
        assertThat(result.processingSummary().numbersFound()).isZero();
    }

    private static BatchResult aiBatch(List<Page> pages, List<Table> tables) {
        return new BatchResult(new PageGroup(0, 0), tables, pages, null, ExtractionSource.AI, null);
    }
}
