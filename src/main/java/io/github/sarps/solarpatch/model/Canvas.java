package io.github.sarps.solarpatch.model;

import java.util.Arrays;
import java.util.UUID;

/**
 * Square full-disk grid of category codes that patches are composited onto.
 *
 * <p>Cells hold a non-negative category code stored as a double, or {@link Double#NaN}
 * for "outside the disk / unobserved". A synthetic canvas starts as a disk of
 * {@code 1.0}; a real one can be wrapped with {@link #fromData(String, ReferenceFrame, double[][])}.</p>
 *
 * <h3>Ownership</h3>
 * <p>A canvas belongs to exactly one compositing session. It is never resized after
 * creation. Writers must hold {@link #getLock()}; readers that run after the session has
 * finished need no synchronization.</p>
 *
 * <p>Row index {@code 0} is the first stored row. Rendering code that displays the canvas
 * with the origin in the lower-left corner must flip it; the canvas itself never does.</p>
 *
 * @since 0.1.0
 */
public class Canvas {

    private final String canvasId;
    private final ReferenceFrame frame;
    private final int size;
    // row-major, size * size
    private final double[] data;
    private final Object lock = new Object();

    /**
     * Creates a canvas filled with {@code NaN}.
     *
     * @param canvasId identifier used in diagnostics, a random one is generated when null
     * @param frame reference frame, its size becomes the canvas side length
     */
    public Canvas(String canvasId, ReferenceFrame frame) {
        if (frame == null) {
            throw new IllegalArgumentException("Reference frame must not be null");
        }
        this.canvasId = canvasId != null ? canvasId : UUID.randomUUID().toString();
        this.frame = frame;
        this.size = frame.size();
        this.data = new double[size * size];
        Arrays.fill(this.data, Double.NaN);
    }

    /**
     * Wraps an existing grid, e.g. a real full-disk observation already turned into
     * category codes. The grid is copied.
     *
     * @param canvasId identifier used in diagnostics
     * @param frame reference frame of the grid
     * @param grid square grid whose side equals {@code frame.size()}
     * @return a new canvas holding a copy of the grid
     */
    public static Canvas fromData(String canvasId, ReferenceFrame frame, double[][] grid) {
        if (frame == null) {
            throw new IllegalArgumentException("Reference frame must not be null");
        }
        if (grid == null || grid.length != frame.size()) {
            throw new IllegalArgumentException(String.format(
                    "Grid must have %d rows, got %s", frame.size(), grid == null ? "null" : grid.length));
        }
        Canvas canvas = new Canvas(canvasId, frame);
        for (int row = 0; row < grid.length; row++) {
            if (grid[row] == null || grid[row].length != frame.size()) {
                throw new IllegalArgumentException(String.format(
                        "Grid row %d must have %d columns", row, frame.size()));
            }
            System.arraycopy(grid[row], 0, canvas.data, row * canvas.size, canvas.size);
        }
        return canvas;
    }

    public String getCanvasId() { return canvasId; }

    public ReferenceFrame getFrame() { return frame; }

    public int getSize() { return size; }

    /**
     * Monitor that every writer of this canvas synchronizes on.
     */
    public Object getLock() { return lock; }

    /**
     * @return the value at {@code (row, col)}, {@code NaN} when unset
     * @throws IndexOutOfBoundsException outside the canvas
     */
    public double get(int row, int col) {
        return data[index(row, col)];
    }

    /**
     * Sets one cell. Callers outside a session must hold {@link #getLock()}.
     */
    public void set(int row, int col, double value) {
        data[index(row, col)] = value;
    }

    /**
     * @return true if {@code (row, col)} lies on the canvas
     */
    public boolean contains(int row, int col) {
        return row >= 0 && row < size && col >= 0 && col < size;
    }

    /**
     * Counts cells equal to {@code value}; {@code NaN} counts unset cells.
     */
    public long countEqual(double value) {
        long count = 0;
        boolean nan = Double.isNaN(value);
        for (double v : data) {
            if (nan ? Double.isNaN(v) : v == value) {
                count++;
            }
        }
        return count;
    }

    /**
     * @return a row-major copy of the grid as {@code double[size][size]}
     */
    public double[][] copyData() {
        double[][] out = new double[size][size];
        for (int row = 0; row < size; row++) {
            System.arraycopy(data, row * size, out[row], 0, size);
        }
        return out;
    }

    /**
     * Cell-wise equality, treating {@code NaN} as equal to {@code NaN}.
     */
    public boolean sameContent(Canvas other) {
        return other != null && other.size == size && Arrays.equals(data, other.data);
    }

    private int index(int row, int col) {
        if (!contains(row, col)) {
            throw new IndexOutOfBoundsException(String.format(
                    "(%d, %d) outside canvas %s of size %d", row, col, canvasId, size));
        }
        return row * size + col;
    }

    @Override
    public String toString() {
        return String.format("Canvas[%s, %dx%d, crpix=(%.2f, %.2f)]",
                canvasId, size, size, frame.crpix1(), frame.crpix2());
    }
}
