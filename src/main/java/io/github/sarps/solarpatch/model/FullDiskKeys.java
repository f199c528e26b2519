package io.github.sarps.solarpatch.model;

import io.github.sarps.solarpatch.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Full-disk image keywords delivered by the metadata layer for one observation.
 *
 * <p>{@code CRPIX1}/{@code CRPIX2} anchor the disk centre, {@code RSUN_OBS} is the
 * observed solar radius in arcseconds and {@code CDELT1} the plate scale in arcseconds
 * per pixel, so {@code RSUN_OBS / CDELT1} is the disk radius in pixels.
 * {@code T_OBS} is optional and only used to report the observation date.</p>
 *
 * @param crpix1  reference pixel along the first axis
 * @param crpix2  reference pixel along the second axis
 * @param rsunObs observed solar radius (arcsec)
 * @param cdelt1  plate scale (arcsec / pixel)
 * @param tObs    observation time as reported by the archive, may be null
 */
public record FullDiskKeys(double crpix1, double crpix2, double rsunObs, double cdelt1, String tObs) {

    /** Keywords that must be present to build a synthetic disk. */
    public static final List<String> REQUIRED_KEYS = List.of("RSUN_OBS", "CDELT1", "CRPIX1", "CRPIX2");

    public FullDiskKeys(double crpix1, double crpix2, double rsunObs, double cdelt1) {
        this(crpix1, crpix2, rsunObs, cdelt1, null);
    }

    /**
     * Builds the keys from a keyword map as returned by an archive query.
     * Values may be numbers, numeric strings or single-row lists (the first element is used).
     *
     * @param keywords keyword name to value
     * @return parsed keys
     * @throws ConfigurationException if a required keyword is missing or not numeric
     */
    public static FullDiskKeys fromMap(Map<String, ?> keywords) {
        if (keywords == null) {
            throw new ConfigurationException("No full-disk keywords supplied");
        }
        List<String> missing = new ArrayList<>();
        for (String key : REQUIRED_KEYS) {
            if (firstValue(keywords.get(key)) == null) {
                missing.add(key);
            }
        }
        if (!missing.isEmpty()) {
            throw new ConfigurationException("Missing full-disk keywords: " + missing);
        }
        Object tObs = firstValue(keywords.get("T_OBS"));
        return new FullDiskKeys(
                number(keywords, "CRPIX1"),
                number(keywords, "CRPIX2"),
                number(keywords, "RSUN_OBS"),
                number(keywords, "CDELT1"),
                tObs != null ? tObs.toString() : null);
    }

    /**
     * Disk radius in pixels.
     *
     * @throws ConfigurationException if {@code CDELT1} is zero or not finite
     */
    public double radiusPixels() {
        if (cdelt1 == 0.0 || !Double.isFinite(cdelt1)) {
            throw new ConfigurationException("CDELT1 must be finite and non-zero to compute the disk radius, got " + cdelt1);
        }
        if (!Double.isFinite(rsunObs)) {
            throw new ConfigurationException("RSUN_OBS must be finite, got " + rsunObs);
        }
        return rsunObs / cdelt1;
    }

    /**
     * Reference frame of a canvas built from these keys.
     *
     * @param size canvas side length
     */
    public ReferenceFrame referenceFrame(int size) {
        return new ReferenceFrame(crpix1, crpix2, size);
    }

    private static Object firstValue(Object value) {
        if (value instanceof List<?> list) {
            return list.isEmpty() ? null : list.get(0);
        }
        return value;
    }

    private static double number(Map<String, ?> keywords, String key) {
        Object v = firstValue(keywords.get(key));
        if (v instanceof Number n) return n.doubleValue();
        try {
            return Double.parseDouble(v.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Keyword " + key + " is not numeric: " + v, e);
        }
    }
}
