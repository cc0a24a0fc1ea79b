package dev.pekelund.docroute.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

/**
 * A table extracted from one page, either by the AI or by local detection.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Table(
    String tableId,
    String name,
    TableRegion region,
    HeaderInfo headerInfo,
    List<TableColumn> columns,
    List<TableRow> rows,
    TableMetadata metadata
) {

    public Table {
        columns = columns != null ? List.copyOf(columns) : List.of();
        rows = rows != null ? List.copyOf(rows) : List.of();
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record TableRegion(int pageNumber, BoundingBox boundingBox, String detectionMethod) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record HeaderInfo(List<Integer> headerRows, List<Integer> headerColumns, int dataStartRow,
        int dataStartCol) {

        public HeaderInfo {
            headerRows = headerRows != null ? List.copyOf(headerRows) : List.of();
            headerColumns = headerColumns != null ? List.copyOf(headerColumns) : List.of();
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record TableColumn(int columnIndex, String columnLabel,
        @JsonProperty("is_header_column") boolean headerColumn) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record TableRow(int rowIndex, String rowLabel, @JsonProperty("is_header_row") boolean headerRow,
        List<String> cells) {

        public TableRow {
            cells = cells != null ? List.copyOf(cells) : List.of();
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record TableMetadata(String detectionMethod, int cellCount, boolean hasMergedCells, double confidence) {
    }
}
