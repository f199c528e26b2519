package io.github.sarps.solarpatch.instrument;

import io.github.sarps.solarpatch.model.Canvas;
import io.github.sarps.solarpatch.model.FullDiskKeys;
import io.github.sarps.solarpatch.utilities.BitmapRecoder;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Instrument-specific behaviour needed to composite one instrument's patches.
 *
 * <p>There are exactly two variants, {@link PrimaryInstrumentProvider} and
 * {@link SecondaryInstrumentProvider}; {@link InstrumentRegistry} picks one for an
 * observation date. Implementations are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 * @see InstrumentRegistry
 */
public interface InstrumentProvider {

    /**
     * @return the configuration this provider was built from
     */
    InstrumentProfile profile();

    /**
     * @return lookup key of the instrument, e.g. {@code hmi}
     */
    default String name() {
        return profile().name();
    }

    default InstrumentRole role() {
        return profile().role();
    }

    /**
     * Whether the instrument observed at {@code date}.
     */
    default boolean covers(LocalDateTime date) {
        return profile().covers(date, LocalDateTime.now());
    }

    /**
     * Recoder translating this instrument's codes into the primary vocabulary.
     *
     * @return the recoder, or empty when the instrument already uses the primary vocabulary
     */
    Optional<BitmapRecoder> recoder();

    /**
     * Builds the synthetic disk canvas for one observation at this instrument's image size.
     *
     * @param keys full-disk keywords of the observation
     * @return a new canvas owned by the caller
     */
    Canvas createCanvas(FullDiskKeys keys);

    /**
     * Legend label for a primary-vocabulary code.
     *
     * @return the label, or the code itself when the configuration names none
     */
    default String categoryLabel(int code) {
        return profile().categoryLabels().getOrDefault(code, Integer.toString(code));
    }
}
