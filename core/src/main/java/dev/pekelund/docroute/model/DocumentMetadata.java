package dev.pekelund.docroute.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record DocumentMetadata(String filename, int totalPages, List<String> extractionMethods) {

    public DocumentMetadata {
        extractionMethods = extractionMethods != null ? List.copyOf(extractionMethods) : List.of();
    }

    public static DocumentMetadata empty() {
        return new DocumentMetadata(null, 0, List.of());
    }
}
