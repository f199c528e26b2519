package io.github.sarps.solarpatch.instrument;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable description of one instrument family, read from configuration.
 *
 * @param name            lookup key, e.g. {@code hmi}
 * @param displayName     name shown to users, e.g. {@code HMI}
 * @param role            primary or secondary vocabulary
 * @param fullDiskSeries  archive series of the full-disk magnetogram
 * @param patchSeries     archive series of the patches
 * @param regionKeyword   keyword naming the region identifier ({@code HARPNUM}, {@code TARPNUM})
 * @param imageSize       canvas side length in pixels
 * @param coverageStart   first observation the instrument covers
 * @param coverageEnd     last observation it covers, null while still observing
 * @param categoryLabels  primary-vocabulary code to legend label
 */
public record InstrumentProfile(
        String name,
        String displayName,
        InstrumentRole role,
        String fullDiskSeries,
        String patchSeries,
        String regionKeyword,
        int imageSize,
        LocalDateTime coverageStart,
        LocalDateTime coverageEnd,
        Map<Integer, String> categoryLabels) {

    public InstrumentProfile {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Instrument name must not be empty");
        }
        if (role == null) {
            throw new IllegalArgumentException("Instrument " + name + " has no role");
        }
        if (imageSize <= 0) {
            throw new IllegalArgumentException("Instrument " + name + " image size must be positive, got " + imageSize);
        }
        if (coverageStart == null) {
            throw new IllegalArgumentException("Instrument " + name + " has no coverage start");
        }
        if (coverageEnd != null && coverageEnd.isBefore(coverageStart)) {
            throw new IllegalArgumentException("Instrument " + name + " coverage ends before it starts");
        }
        categoryLabels = categoryLabels == null
                ? Map.of()
                : Collections.unmodifiableMap(new TreeMap<>(categoryLabels));
    }

    /**
     * Whether an observation at {@code date} falls in this instrument's coverage.
     * An open-ended coverage runs up to {@code now}.
     */
    public boolean covers(LocalDateTime date, LocalDateTime now) {
        if (date == null || date.isBefore(coverageStart)) {
            return false;
        }
        LocalDateTime end = coverageEnd != null ? coverageEnd : now;
        return !date.isAfter(end);
    }
}
