package io.github.sarps.solarpatch.model;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Codes that no recode group claimed, with the number of pixels carrying each.
 * An empty report means the recode table covered every pixel.
 *
 * @since 0.1.0
 */
public final class RecodeReport {

    private static final RecodeReport EMPTY = new RecodeReport(Map.of());

    private final Map<Integer, Long> uncovered;

    public RecodeReport(Map<Integer, Long> uncovered) {
        this.uncovered = Collections.unmodifiableMap(new TreeMap<>(uncovered));
    }

    public static RecodeReport empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return uncovered.isEmpty();
    }

    /** Uncovered code to pixel count, sorted by code. */
    public Map<Integer, Long> getUncovered() {
        return uncovered;
    }

    /**
     * @return a report holding the counts of both reports summed per code
     */
    public RecodeReport merge(RecodeReport other) {
        if (other == null || other.isEmpty()) return this;
        if (isEmpty()) return other;
        Map<Integer, Long> merged = new TreeMap<>(uncovered);
        other.uncovered.forEach((code, count) -> merged.merge(code, count, Long::sum));
        return new RecodeReport(merged);
    }

    @Override
    public String toString() {
        return "RecodeReport" + uncovered;
    }
}
