package dev.pekelund.docroute.model;

import java.util.Collection;

/**
 * Axis-aligned box in page coordinates.
 */
public record BoundingBox(double x0, double y0, double x1, double y1) {

    public static final BoundingBox EMPTY = new BoundingBox(0, 0, 0, 0);

    public BoundingBox union(BoundingBox other) {
        return new BoundingBox(Math.min(x0, other.x0), Math.min(y0, other.y0),
            Math.max(x1, other.x1), Math.max(y1, other.y1));
    }

    public static BoundingBox union(Collection<BoundingBox> boxes) {
        BoundingBox result = null;
        for (BoundingBox box : boxes) {
            result = result == null ? box : result.union(box);
        }
        return result != null ? result : EMPTY;
    }
}
