package dev.pekelund.docroute.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * A numeric literal recognised in page text.
 *
 * @param value            parsed value, {@code 0.0} when the token could not be parsed
 * @param originalText     the matched substring
 * @param context          surrounding window drawn from the same text
 * @param format           pattern family that produced the match
 * @param unit             unit keyword found near the match, if any
 * @param currency         currency code for currency matches, if known
 * @param confidence       heuristic confidence in {@code [0, 1]}
 * @param extractionMethod how the match was produced
 * @param position         where the match sits in the source text
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NumberMatch(
    double value,
    String originalText,
    String context,
    NumberFormat format,
    String unit,
    String currency,
    double confidence,
    String extractionMethod,
    NumberPosition position
) {
}
