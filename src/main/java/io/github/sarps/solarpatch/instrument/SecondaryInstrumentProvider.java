package io.github.sarps.solarpatch.instrument;

import io.github.sarps.solarpatch.model.RecodeTable;
import io.github.sarps.solarpatch.utilities.BitmapRecoder;

import java.util.Optional;

/**
 * Provider for an instrument with its own category vocabulary (MDI with SMARP patches).
 * Every bitmap is recoded into the primary vocabulary before compositing.
 */
public class SecondaryInstrumentProvider extends AbstractInstrumentProvider {

    private final BitmapRecoder recoder;

    /**
     * @param profile instrument configuration, must have the secondary role
     * @param recodeTable translation into the primary vocabulary
     */
    public SecondaryInstrumentProvider(InstrumentProfile profile, RecodeTable recodeTable) {
        super(profile, InstrumentRole.SECONDARY);
        this.recoder = new BitmapRecoder(recodeTable);
    }

    @Override
    public Optional<BitmapRecoder> recoder() {
        return Optional.of(recoder);
    }
}
