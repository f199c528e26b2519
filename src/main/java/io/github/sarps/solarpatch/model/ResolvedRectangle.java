package io.github.sarps.solarpatch.model;

import java.util.Objects;

/**
 * Absolute placement of one patch on a canvas, in canvas pixels, plus the patch's
 * region identifier.
 *
 * <p>The bounds are half-open: rows {@code y1 .. y2-1} and columns {@code x1 .. x2-1}
 * are covered, so {@code y2 - y1} is the patch height and {@code x2 - x1} the patch width.</p>
 *
 * <h3>Usage</h3>
 * <pre>{@code
 * ResolvedRectangle r = CoordinateTransformer.resolve(canvas.getFrame(), patch);
 * if (!r.isWithin(canvas.getSize())) {
 *     // reference frame or metadata mismatch, never clip
 * }
 * int rows = r.getHeight();   // == patch.getHeight()
 * }</pre>
 *
 * <p>Rectangles are derived data: they are recomputed per compositing run and never
 * persisted apart from the patch they came from, except through the exported registry.</p>
 *
 * @since 0.1.0
 */
public final class ResolvedRectangle {
    private final int y1;
    private final int y2;
    private final int x1;
    private final int x2;
    private final int regionId;

    /**
     * @param y1 first covered row
     * @param y2 one past the last covered row
     * @param x1 first covered column
     * @param x2 one past the last covered column
     * @param regionId region identifier of the patch
     */
    public ResolvedRectangle(int y1, int y2, int x1, int x2, int regionId) {
        this.y1 = y1;
        this.y2 = y2;
        this.x1 = x1;
        this.x2 = x2;
        this.regionId = regionId;
    }

    public int getY1() { return y1; }

    public int getY2() { return y2; }

    public int getX1() { return x1; }

    public int getX2() { return x2; }

    public int getRegionId() { return regionId; }

    /** @return {@code y2 - y1} */
    public int getHeight() { return y2 - y1; }

    /** @return {@code x2 - x1} */
    public int getWidth() { return x2 - x1; }

    /**
     * Whether every covered cell lies in {@code [0, size)} on both axes.
     *
     * @param size canvas side length
     */
    public boolean isWithin(int size) {
        return y1 >= 0 && x1 >= 0 && y2 <= size && x2 <= size && y1 <= y2 && x1 <= x2;
    }

    /**
     * Whether the two rectangles share at least one cell.
     */
    public boolean overlaps(ResolvedRectangle other) {
        return y1 < other.y2 && other.y1 < y2 && x1 < other.x2 && other.x1 < x2;
    }

    /**
     * @return {@code {y1, y2, x1, x2}}
     */
    public int[] toArray() {
        return new int[]{y1, y2, x1, x2};
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResolvedRectangle that)) return false;
        return y1 == that.y1 && y2 == that.y2 && x1 == that.x1 && x2 == that.x2 && regionId == that.regionId;
    }

    @Override
    public int hashCode() {
        return Objects.hash(y1, y2, x1, x2, regionId);
    }

    @Override
    public String toString() {
        return String.format("(y1=%d, y2=%d, x1=%d, x2=%d, region=%d)", y1, y2, x1, x2, regionId);
    }
}
