package io.github.sarps.solarpatch.service;

import io.github.sarps.solarpatch.model.Patch;
import io.github.sarps.solarpatch.model.RecodeReport;
import io.github.sarps.solarpatch.model.ReferenceFrame;
import io.github.sarps.solarpatch.model.ResolvedRectangle;

/**
 * A patch that is ready to be merged: its bitmap is in the primary vocabulary and its
 * rectangle has been resolved against {@code frame}.
 *
 * @param patch     the (possibly recoded) patch
 * @param rectangle canvas rectangle of the patch
 * @param frame     reference frame the rectangle was resolved against
 * @param report    codes the recoder did not cover, empty for primary patches
 */
public record PreparedPatch(Patch patch, ResolvedRectangle rectangle, ReferenceFrame frame, RecodeReport report) {
}
