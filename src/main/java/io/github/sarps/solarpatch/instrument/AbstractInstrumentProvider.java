package io.github.sarps.solarpatch.instrument;

import io.github.sarps.solarpatch.model.Canvas;
import io.github.sarps.solarpatch.model.FullDiskKeys;
import io.github.sarps.solarpatch.utilities.DiskMaskGenerator;

/**
 * Shared state and canvas construction of both provider variants.
 */
abstract class AbstractInstrumentProvider implements InstrumentProvider {

    private final InstrumentProfile profile;

    AbstractInstrumentProvider(InstrumentProfile profile, InstrumentRole expectedRole) {
        if (profile == null) {
            throw new IllegalArgumentException("Instrument profile must not be null");
        }
        if (profile.role() != expectedRole) {
            throw new IllegalArgumentException(String.format("Instrument %s is configured as %s, expected %s",
                    profile.name(), profile.role(), expectedRole));
        }
        this.profile = profile;
    }

    @Override
    public InstrumentProfile profile() {
        return profile;
    }

    @Override
    public Canvas createCanvas(FullDiskKeys keys) {
        String canvasId = keys.tObs() != null
                ? profile.name() + "@" + keys.tObs()
                : null;
        return DiskMaskGenerator.generate(canvasId, keys, profile.imageSize());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + profile.displayName() + ", " + profile.imageSize() + " px]";
    }
}
