package dev.pekelund.docroute.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.stream.IntStream;

/**
 * Inclusive, 0-based range of contiguous pages routed together.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PageGroup(int startPage, int endPage) {

    public PageGroup {
        if (startPage < 0 || endPage < startPage) {
            throw new IllegalArgumentException("Invalid page group (" + startPage + ", " + endPage + ")");
        }
    }

    public int size() {
        return endPage - startPage + 1;
    }

    public boolean contains(int pageIndex) {
        return pageIndex >= startPage && pageIndex <= endPage;
    }

    public IntStream pageIndices() {
        return IntStream.rangeClosed(startPage, endPage);
    }

    @Override
    public String toString() {
        return "(" + startPage + "," + endPage + ")";
    }
}
