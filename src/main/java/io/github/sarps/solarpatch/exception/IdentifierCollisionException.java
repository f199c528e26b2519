package io.github.sarps.solarpatch.exception;

/**
 * Thrown when two patches of one session report the same region identifier.
 * It is ambiguous which patch's box is authoritative, so nothing is merged silently.
 *
 * @since 0.1.0
 */
public class IdentifierCollisionException extends SolarPatchException {

    private final String canvasId;
    private final int regionId;

    /**
     * Constructs a new collision exception.
     *
     * @param canvasId id of the canvas being composited
     * @param regionId the duplicated region identifier
     */
    public IdentifierCollisionException(String canvasId, int regionId) {
        super(String.format("Region identifier %d reported by more than one patch [canvas=%s]", regionId, canvasId));
        this.canvasId = canvasId;
        this.regionId = regionId;
    }

    public String getCanvasId() { return canvasId; }

    public int getRegionId() { return regionId; }
}
