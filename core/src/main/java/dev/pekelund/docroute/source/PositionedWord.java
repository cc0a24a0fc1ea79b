package dev.pekelund.docroute.source;

import dev.pekelund.docroute.model.BoundingBox;

/**
 * A word token with its box in page coordinates and the identifier of the text line it belongs to.
 */
public record PositionedWord(double x0, double y0, double x1, double y1, String text, int lineId) {

    public PositionedWord {
        text = text != null ? text : "";
    }

    public BoundingBox box() {
        return new BoundingBox(x0, y0, x1, y1);
    }
}
