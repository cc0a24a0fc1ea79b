package dev.pekelund.docroute.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Location of a numeric match inside the text it was found in.
 *
 * @param lineNumber  1-based line of the match start
 * @param startOffset inclusive character offset
 * @param endOffset   exclusive character offset
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NumberPosition(int lineNumber, int startOffset, int endOffset) {
}
