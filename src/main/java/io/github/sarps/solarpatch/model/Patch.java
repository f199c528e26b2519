package io.github.sarps.solarpatch.model;

/**
 * One region of interest (a SHARP or SMARP patch) with its local bitmap of category codes.
 *
 * <p>Patches are read-only after creation: the bitmap is copied in and every accessor
 * that exposes it hands out a copy. The dimensions come from the bitmap shape.</p>
 *
 * <p>Codes are non-negative. A zero bitmap value is background; non-zero values are
 * foreground and compete for canvas cells with the max rule.</p>
 *
 * @since 0.1.0
 */
public final class Patch {

    private final int[][] bitmap;
    private final double crpix1;
    private final double crpix2;
    private final int regionId;
    private final int height;
    private final int width;

    /**
     * @param bitmap   rectangular, non-empty grid of category codes ({@code [row][col]})
     * @param crpix1   patch reference pixel along the first axis
     * @param crpix2   patch reference pixel along the second axis
     * @param regionId HARP or TARP number
     */
    public Patch(int[][] bitmap, double crpix1, double crpix2, int regionId) {
        if (bitmap == null || bitmap.length == 0 || bitmap[0] == null || bitmap[0].length == 0) {
            throw new IllegalArgumentException("Patch " + regionId + " has an empty bitmap");
        }
        if (!Double.isFinite(crpix1) || !Double.isFinite(crpix2)) {
            throw new IllegalArgumentException(String.format(
                    "Patch %d has a non-finite reference pixel (%s, %s)", regionId, crpix1, crpix2));
        }
        this.height = bitmap.length;
        this.width = bitmap[0].length;
        this.bitmap = new int[height][];
        for (int row = 0; row < height; row++) {
            if (bitmap[row] == null || bitmap[row].length != width) {
                throw new IllegalArgumentException(String.format(
                        "Patch %d bitmap is ragged at row %d (expected %d columns)", regionId, row, width));
            }
            for (int col = 0; col < width; col++) {
                if (bitmap[row][col] < 0) {
                    throw new IllegalArgumentException(String.format(
                            "Patch %d has negative category code %d at (%d, %d)", regionId, bitmap[row][col], row, col));
                }
            }
            this.bitmap[row] = bitmap[row].clone();
        }
        this.crpix1 = crpix1;
        this.crpix2 = crpix2;
        this.regionId = regionId;
    }

    /**
     * Returns a patch with the same placement and identifier but a different bitmap,
     * used after recoding.
     */
    public Patch withBitmap(int[][] newBitmap) {
        return new Patch(newBitmap, crpix1, crpix2, regionId);
    }

    public int get(int row, int col) { return bitmap[row][col]; }

    public int[][] getBitmap() {
        int[][] copy = new int[height][];
        for (int row = 0; row < height; row++) {
            copy[row] = bitmap[row].clone();
        }
        return copy;
    }

    public double getCrpix1() { return crpix1; }

    public double getCrpix2() { return crpix2; }

    public int getRegionId() { return regionId; }

    public int getHeight() { return height; }

    public int getWidth() { return width; }

    @Override
    public String toString() {
        return String.format("Patch[region=%d, %dx%d, crpix=(%.2f, %.2f)]", regionId, height, width, crpix1, crpix2);
    }
}
