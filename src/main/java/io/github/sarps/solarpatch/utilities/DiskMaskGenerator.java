package io.github.sarps.solarpatch.utilities;

import io.github.sarps.solarpatch.model.Canvas;
import io.github.sarps.solarpatch.model.FullDiskKeys;
import io.github.sarps.solarpatch.model.ReferenceFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the synthetic baseline canvas used when no real full-disk observation is supplied.
 *
 * <p>Cell {@code (row, col)} is {@code 1.0} when
 * {@code (col - CRPIX2)^2 + (row - CRPIX1)^2 < radius^2} with
 * {@code radius = RSUN_OBS / CDELT1}, and {@code NaN} otherwise. The comparison is strict,
 * so cells exactly on the radius are outside the disk.</p>
 *
 * <p>Pure function of its inputs: no I/O and no shared state.</p>
 *
 * @since 0.1.0
 */
public class DiskMaskGenerator {
    private static final Logger logger = LoggerFactory.getLogger(DiskMaskGenerator.class);

    /** Value of every on-disk cell of a synthetic canvas. */
    public static final double DISK_VALUE = 1.0;

    private DiskMaskGenerator() {
    }

    /**
     * Generates a synthetic disk canvas with a random id.
     *
     * @see #generate(String, FullDiskKeys, int)
     */
    public static Canvas generate(FullDiskKeys keys, int size) {
        return generate(null, keys, size);
    }

    /**
     * Generates a synthetic disk canvas.
     *
     * @param canvasId id for diagnostics, random when null
     * @param keys full-disk keywords of the observation
     * @param size canvas side length (instrument image size)
     * @return a new {@code size x size} canvas holding the disk mask
     * @throws io.github.sarps.solarpatch.exception.ConfigurationException if {@code CDELT1} is zero or not finite
     */
    public static Canvas generate(String canvasId, FullDiskKeys keys, int size) {
        if (keys == null) {
            throw new IllegalArgumentException("Full-disk keys must not be null");
        }
        double radius = keys.radiusPixels();
        double radiusSquared = radius * radius;
        ReferenceFrame frame = keys.referenceFrame(size);
        Canvas canvas = new Canvas(canvasId, frame);

        long onDisk = 0;
        for (int row = 0; row < size; row++) {
            double dy = row - keys.crpix1();
            double dySquared = dy * dy;
            if (dySquared >= radiusSquared) {
                continue;
            }
            for (int col = 0; col < size; col++) {
                double dx = col - keys.crpix2();
                if (dx * dx + dySquared < radiusSquared) {
                    canvas.set(row, col, DISK_VALUE);
                    onDisk++;
                }
            }
        }

        logger.debug("Generated synthetic disk {}: size={}, centre=({}, {}), radius={} px, {} cells on disk",
                canvas.getCanvasId(), size, keys.crpix1(), keys.crpix2(), radius, onDisk);
        return canvas;
    }
}
