package io.github.sarps.solarpatch.instrument;

/**
 * Role of an instrument in harmonization: the primary instrument's category vocabulary
 * is the common one, secondary instruments are recoded into it.
 */
public enum InstrumentRole {
    PRIMARY,
    SECONDARY;

    /**
     * Case-insensitive lookup used when reading configuration.
     *
     * @throws IllegalArgumentException for an unknown role name
     */
    public static InstrumentRole fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Instrument role must not be null");
        }
        return valueOf(value.trim().toUpperCase());
    }
}
