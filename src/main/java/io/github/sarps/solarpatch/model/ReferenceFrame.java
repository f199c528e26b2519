package io.github.sarps.solarpatch.model;

/**
 * Placement metadata of a canvas: its reference-pixel offsets and its side length.
 *
 * <p>Every patch composited onto a canvas must be resolved against that canvas's own
 * frame. Two frames are interchangeable only when all three values match exactly.</p>
 *
 * @param crpix1 reference-pixel offset along the first image axis ({@code CRPIX1})
 * @param crpix2 reference-pixel offset along the second image axis ({@code CRPIX2})
 * @param size   canvas side length in pixels
 */
public record ReferenceFrame(double crpix1, double crpix2, int size) {

    public ReferenceFrame {
        if (size <= 0) {
            throw new IllegalArgumentException("Canvas size must be positive, got " + size);
        }
        if (!Double.isFinite(crpix1) || !Double.isFinite(crpix2)) {
            throw new IllegalArgumentException(
                    String.format("Reference pixel must be finite, got (%s, %s)", crpix1, crpix2));
        }
    }
}
