package io.github.sarps.solarpatch.service;

import io.github.sarps.solarpatch.exception.GeometryException;
import io.github.sarps.solarpatch.model.Canvas;
import io.github.sarps.solarpatch.model.Patch;
import io.github.sarps.solarpatch.model.RecodeReport;
import io.github.sarps.solarpatch.model.ResolvedRectangle;
import io.github.sarps.solarpatch.utilities.CoordinateTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges patch bitmaps into one canvas with the max rule.
 *
 * <p>For every foreground (non-zero) patch pixel the canvas cell becomes
 * {@code max(current, patch value)}, with {@code NaN} lower than any code. Background
 * pixels never write. The rule is commutative and associative, so the final value of a
 * cell is the largest foreground value of all patches covering it, whatever the order in
 * which they arrive.</p>
 *
 * <h3>Thread Safety</h3>
 * <p>Each merge holds the canvas lock ({@link Canvas#getLock()}) for its whole rectangle,
 * so several threads may merge into the same canvas. Merges are cheap compared to
 * rectangle resolution and recoding, which run outside the lock.</p>
 *
 * @since 0.1.0
 */
public class PatchCompositor {
    private static final Logger logger = LoggerFactory.getLogger(PatchCompositor.class);

    private final Canvas canvas;

    public PatchCompositor(Canvas canvas) {
        if (canvas == null) {
            throw new IllegalArgumentException("Canvas must not be null");
        }
        this.canvas = canvas;
    }

    /**
     * Resolves {@code patch} against this canvas and merges it.
     *
     * @return number of canvas cells whose value changed
     * @throws GeometryException if the patch does not fit on the canvas
     */
    public int composite(Patch patch) {
        ResolvedRectangle rectangle = CoordinateTransformer.resolve(canvas.getFrame(), patch);
        return merge(new PreparedPatch(patch, rectangle, canvas.getFrame(), RecodeReport.empty()));
    }

    /**
     * Merges a prepared patch.
     *
     * @return number of canvas cells whose value changed
     * @throws GeometryException if the patch was resolved against another reference frame,
     *         its rectangle leaves the canvas, or its bitmap shape disagrees with the rectangle
     */
    public int merge(PreparedPatch prepared) {
        Patch patch = prepared.patch();
        ResolvedRectangle rectangle = prepared.rectangle();

        if (!canvas.getFrame().equals(prepared.frame())) {
            logger.error("Patch {} was resolved against {} but canvas {} uses {}",
                    patch.getRegionId(), prepared.frame(), canvas.getCanvasId(), canvas.getFrame());
            throw new GeometryException("Patch resolved against a different reference frame " + prepared.frame(),
                    canvas.getCanvasId(), patch.getRegionId(), rectangle);
        }
        if (rectangle.getHeight() != patch.getHeight() || rectangle.getWidth() != patch.getWidth()) {
            logger.error("Patch {} is {}x{} but its rectangle is {}x{}", patch.getRegionId(),
                    patch.getHeight(), patch.getWidth(), rectangle.getHeight(), rectangle.getWidth());
            throw new GeometryException(String.format("Bitmap shape %dx%d does not match rectangle",
                    patch.getHeight(), patch.getWidth()), canvas.getCanvasId(), patch.getRegionId(), rectangle);
        }
        CoordinateTransformer.requireWithin(canvas, rectangle);

        int changed = 0;
        synchronized (canvas.getLock()) {
            for (int row = 0; row < patch.getHeight(); row++) {
                int canvasRow = rectangle.getY1() + row;
                for (int col = 0; col < patch.getWidth(); col++) {
                    int value = patch.get(row, col);
                    if (value == 0) {
                        continue;
                    }
                    int canvasCol = rectangle.getX1() + col;
                    double current = canvas.get(canvasRow, canvasCol);
                    // NaN compares false, so it loses to any code
                    if (!(current >= value)) {
                        canvas.set(canvasRow, canvasCol, value);
                        changed++;
                    }
                }
            }
        }

        logger.debug("Merged patch {} into canvas {} at {}: {} cells changed",
                patch.getRegionId(), canvas.getCanvasId(), rectangle, changed);
        return changed;
    }

    public Canvas getCanvas() {
        return canvas;
    }
}
