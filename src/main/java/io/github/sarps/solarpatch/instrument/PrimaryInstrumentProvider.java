package io.github.sarps.solarpatch.instrument;

import io.github.sarps.solarpatch.utilities.BitmapRecoder;

import java.util.Optional;

/**
 * Provider for the instrument whose category codes are the common vocabulary
 * (HMI with SHARP patches). Its bitmaps are composited as delivered.
 */
public class PrimaryInstrumentProvider extends AbstractInstrumentProvider {

    public PrimaryInstrumentProvider(InstrumentProfile profile) {
        super(profile, InstrumentRole.PRIMARY);
    }

    @Override
    public Optional<BitmapRecoder> recoder() {
        return Optional.empty();
    }
}
