package io.github.sarps.solarpatch.service;

import io.github.sarps.solarpatch.instrument.InstrumentProvider;
import io.github.sarps.solarpatch.model.Canvas;
import io.github.sarps.solarpatch.model.RecodeReport;
import io.github.sarps.solarpatch.model.ResolvedRectangle;

import java.time.LocalDateTime;
import java.util.List;

/**
 * What a compositing session hands to the rendering layer.
 *
 * @param provider          instrument whose patches were composited
 * @param canvas            the composited canvas
 * @param boxes             registered rectangles in insertion order
 * @param recodeReport      codes the recoder did not cover, summed over all patches
 * @param requestedDate     observation date the caller asked for, may be null
 * @param observedDate      date of the full-disk record actually used, may be null
 * @param dateSubstituted   true when the two dates differ
 */
public record CompositeResult(
        InstrumentProvider provider,
        Canvas canvas,
        List<ResolvedRectangle> boxes,
        RecodeReport recodeReport,
        LocalDateTime requestedDate,
        LocalDateTime observedDate,
        boolean dateSubstituted) {

    public CompositeResult {
        boxes = List.copyOf(boxes);
    }
}
