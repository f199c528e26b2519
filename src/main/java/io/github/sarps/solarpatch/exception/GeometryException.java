package io.github.sarps.solarpatch.exception;

import io.github.sarps.solarpatch.model.ResolvedRectangle;

/**
 * Thrown when a patch cannot be placed on its canvas: the resolved rectangle leaves the
 * canvas, the bitmap shape disagrees with the rectangle, or the patch was resolved
 * against a different reference frame than the canvas it is merged into.
 *
 * <p>An out-of-bounds patch usually means a reference-frame mismatch that affects the
 * other patches of the session too, so the whole session is aborted.</p>
 *
 * @since 0.1.0
 */
public class GeometryException extends SolarPatchException {

    private final String canvasId;
    private final int regionId;
    private final ResolvedRectangle rectangle;

    /**
     * Constructs a new geometry exception.
     *
     * @param message the detail message
     * @param canvasId id of the canvas being composited
     * @param regionId region identifier of the offending patch
     * @param rectangle the offending rectangle, may be null when none was resolved
     */
    public GeometryException(String message, String canvasId, int regionId, ResolvedRectangle rectangle) {
        super(String.format("%s [canvas=%s, region=%d, rectangle=%s]", message, canvasId, regionId, rectangle));
        this.canvasId = canvasId;
        this.regionId = regionId;
        this.rectangle = rectangle;
    }

    public String getCanvasId() { return canvasId; }

    public int getRegionId() { return regionId; }

    public ResolvedRectangle getRectangle() { return rectangle; }
}
