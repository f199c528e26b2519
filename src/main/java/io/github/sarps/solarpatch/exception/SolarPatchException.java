package io.github.sarps.solarpatch.exception;

/**
 * Base class for the fatal errors raised while compositing patches onto a canvas.
 *
 * <p>All subclasses are unchecked so they propagate out of worker threads unchanged.
 * Once one is thrown mid-session the canvas is in an undefined state and must be
 * discarded by the caller.</p>
 *
 * @since 0.1.0
 */
public class SolarPatchException extends RuntimeException {

    /**
     * Constructs a new exception with the specified detail message.
     *
     * @param message the detail message
     */
    public SolarPatchException(String message) {
        super(message);
    }

    /**
     * Constructs a new exception with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause the cause
     */
    public SolarPatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
