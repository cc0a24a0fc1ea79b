package dev.pekelund.docroute.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

/**
 * One page of the reconstructed document, identified by its 1-based number.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Page(int pageNumber, List<Section> sections) {

    public Page {
        sections = sections != null ? List.copyOf(sections) : List.of();
    }

    public int numberCount() {
        return sections.stream().mapToInt(section -> section.numbers().size()).sum();
    }
}
