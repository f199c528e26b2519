package io.github.sarps.solarpatch.utilities;

import io.github.sarps.solarpatch.exception.GeometryException;
import io.github.sarps.solarpatch.model.Canvas;
import io.github.sarps.solarpatch.model.Patch;
import io.github.sarps.solarpatch.model.ReferenceFrame;
import io.github.sarps.solarpatch.model.ResolvedRectangle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps a patch's reference-pixel metadata onto absolute canvas rectangles.
 *
 * <p>For a canvas of side {@code S} with reference pixel {@code (CRPIX1_c, CRPIX2_c)} and
 * a patch with reference pixel {@code (CRPIX1_p, CRPIX2_p)} and bitmap shape {@code (H, W)}:</p>
 * <pre>
 * y1 = rint(S - CRPIX2_c - CRPIX2_p)    y2 = y1 + H
 * x1 = rint(S - CRPIX1_c - CRPIX1_p)    x2 = x1 + W
 * </pre>
 * <p>{@link Math#rint(double)} rounds half to even, so half-pixel offsets do not drift
 * consistently in one direction. The subtraction from {@code S} accounts for the
 * observation frame's vertical axis being flipped relative to canvas storage.</p>
 *
 * <p>Resolution never clamps. Use {@link #requireWithin(Canvas, ResolvedRectangle)} to turn
 * an out-of-canvas rectangle into a {@link GeometryException}.</p>
 *
 * @since 0.1.0
 */
public class CoordinateTransformer {
    private static final Logger logger = LoggerFactory.getLogger(CoordinateTransformer.class);

    private CoordinateTransformer() {
    }

    /**
     * Computes the canvas rectangle of one patch.
     *
     * @param canvasFrame reference frame of the canvas the patch will be merged into
     * @param patch the patch
     * @return the rectangle, possibly outside the canvas
     */
    public static ResolvedRectangle resolve(ReferenceFrame canvasFrame, Patch patch) {
        if (canvasFrame == null || patch == null) {
            throw new IllegalArgumentException("Canvas frame and patch must not be null");
        }
        int size = canvasFrame.size();
        int y1 = toPixel(size - canvasFrame.crpix2() - patch.getCrpix2(), patch);
        int x1 = toPixel(size - canvasFrame.crpix1() - patch.getCrpix1(), patch);

        ResolvedRectangle rectangle = new ResolvedRectangle(
                y1, y1 + patch.getHeight(), x1, x1 + patch.getWidth(), patch.getRegionId());
        logger.debug("Resolved patch {} to {}", patch.getRegionId(), rectangle);
        return rectangle;
    }

    /**
     * Rounds half to even and narrows to an int pixel index.
     */
    static int toPixel(double value, Patch patch) {
        double rounded = Math.rint(value);
        if (!Double.isFinite(rounded) || rounded > Integer.MAX_VALUE / 2.0 || rounded < Integer.MIN_VALUE / 2.0) {
            throw new GeometryException("Patch origin is not representable as a pixel index: " + value,
                    null, patch.getRegionId(), null);
        }
        return (int) rounded;
    }

    /**
     * Checks that {@code rectangle} lies entirely on {@code canvas}.
     *
     * @throws GeometryException if any covered cell falls outside {@code [0, size)}
     */
    public static void requireWithin(Canvas canvas, ResolvedRectangle rectangle) {
        if (!rectangle.isWithin(canvas.getSize())) {
            logger.error("Rectangle {} lies outside canvas {} of size {}",
                    rectangle, canvas.getCanvasId(), canvas.getSize());
            throw new GeometryException(
                    "Resolved rectangle lies outside [0, " + canvas.getSize() + ")",
                    canvas.getCanvasId(), rectangle.getRegionId(), rectangle);
        }
    }
}
