package io.github.sarps.solarpatch.exception;

/**
 * Thrown when metadata or configuration needed to build a session is missing or unusable,
 * e.g. a zero {@code CDELT1} that makes the disk radius undefined, a configuration file
 * without an instrument section, or an observation date no instrument covers.
 *
 * <p>This is a data-quality problem, not a transient one; callers should not retry.</p>
 *
 * @since 0.1.0
 */
public class ConfigurationException extends SolarPatchException {

    /**
     * Constructs a new configuration exception with the specified detail message.
     *
     * @param message the detail message
     */
    public ConfigurationException(String message) {
        super(message);
    }

    /**
     * Constructs a new configuration exception with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause the cause
     */
    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
