package dev.pekelund.docroute.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

/**
 * Reconstructed document: ordered unique pages, the combined table list and summary data.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DocumentResult(
    DocumentMetadata documentMetadata,
    Tables tables,
    TextContent textContent,
    ProcessingSummary processingSummary
) {

    public DocumentResult {
        documentMetadata = documentMetadata != null ? documentMetadata : DocumentMetadata.empty();
        tables = tables != null ? tables : new Tables(List.of());
        textContent = textContent != null ? textContent : new TextContent(List.of());
        processingSummary = processingSummary != null ? processingSummary : ProcessingSummary.empty();
    }

    public List<Page> pages() {
        return textContent.pages();
    }

    public List<Table> tableList() {
        return tables.tables();
    }

    public DocumentResult withDocumentMetadata(DocumentMetadata metadata) {
        return new DocumentResult(metadata, tables, textContent, processingSummary);
    }

    public DocumentResult withProcessingSummary(ProcessingSummary summary) {
        return new DocumentResult(documentMetadata, tables, textContent, summary);
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Tables(List<Table> tables) {

        public Tables {
            tables = tables != null ? List.copyOf(tables) : List.of();
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record TextContent(List<Page> pages) {

        public TextContent {
            pages = pages != null ? List.copyOf(pages) : List.of();
        }
    }
}
