/* (C)2026 */
package com.ammann.interaction.model;

import java.util.List;

/**
 * Axis-aligned rectangle in the normalized image frame.
 *
 * @param x left edge
 * @param y top edge
 * @param width  horizontal extent
 * @param height vertical extent
 */
public record BoundingBox(double x, double y, double width, double height) {

    public double area() {
        return Math.max(0.0, width) * Math.max(0.0, height);
    }

    public double right() {
        return x + width;
    }

    public double bottom() {
        return y + height;
    }

    /**
     * Area shared with another box, 0 when they do not intersect.
     */
    public double intersectionArea(BoundingBox other) {
        double overlapWidth = Math.min(right(), other.right()) - Math.max(x, other.x);
        double overlapHeight = Math.min(bottom(), other.bottom()) - Math.max(y, other.y);
        if (overlapWidth <= 0.0 || overlapHeight <= 0.0) {
            return 0.0;
        }
        return overlapWidth * overlapHeight;
    }

    /**
     * Intersection over the smaller of the two areas (IoS).
     *
     * @return ratio in [0, 1]; 0 when the boxes do not intersect
     */
    public double overlapOnSmaller(BoundingBox other) {
        double intersection = intersectionArea(other);
        if (intersection <= 0.0) {
            return 0.0;
        }
        return intersection / Math.min(area(), other.area());
    }

    /** Wire form {@code [x, y, w, h]}. */
    public List<Double> toList() {
        return List.of(x, y, width, height);
    }

    public static BoundingBox fromList(List<Double> values) {
        if (values == null || values.size() != 4) {
            throw new IllegalArgumentException(
                    "Bounding box must have exactly 4 values [x, y, w, h], got " + values);
        }
        return new BoundingBox(values.get(0), values.get(1), values.get(2), values.get(3));
    }
}
