package io.github.sarps.solarpatch.utilities;

import io.github.sarps.solarpatch.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsing and formatting of archive observation dates ({@code yyyy.MM.dd_HH:mm:ss}).
 *
 * <p>{@code T_OBS} values carry a time-scale suffix such as {@code _TAI} and may carry
 * fractional seconds; both are dropped.</p>
 */
public class ObservationDates {
    private static final Logger logger = LoggerFactory.getLogger(ObservationDates.class);

    public static final String ARCHIVE_DATE_PATTERN = "yyyy.MM.dd_HH:mm:ss";
    public static final DateTimeFormatter ARCHIVE_FORMAT = DateTimeFormatter.ofPattern(ARCHIVE_DATE_PATTERN);

    // 2010.07.14_11:00:08.30_TAI -> 2010.07.14_11:00:08
    private static final Pattern ARCHIVE_DATE = Pattern.compile(
            "^(\\d{4}\\.\\d{2}\\.\\d{2}_\\d{2}:\\d{2}:\\d{2})(?:\\.\\d+)?(?:_[A-Za-z]+)?$");

    private ObservationDates() {
    }

    /**
     * Parses an archive date, also accepting ISO-8601 local date-times.
     *
     * @throws ConfigurationException if the value matches neither format
     */
    public static LocalDateTime parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Observation date is empty");
        }
        String trimmed = value.trim();
        Matcher matcher = ARCHIVE_DATE.matcher(trimmed);
        try {
            if (matcher.matches()) {
                return LocalDateTime.parse(matcher.group(1), ARCHIVE_FORMAT);
            }
            return LocalDateTime.parse(trimmed);
        } catch (DateTimeParseException e) {
            throw new ConfigurationException("Unrecognised observation date: " + value, e);
        }
    }

    public static String format(LocalDateTime dateTime) {
        return dateTime.format(ARCHIVE_FORMAT);
    }

    /**
     * Whether the archive returned an observation from a different time than requested.
     * A warning is logged when it did.
     *
     * @param requested the date the caller asked for
     * @param observed the date of the full-disk record actually retrieved, may be null
     */
    public static boolean isSubstituted(LocalDateTime requested, LocalDateTime observed) {
        if (requested == null || observed == null || requested.equals(observed)) {
            return false;
        }
        logger.warn("Requested observation {} but the retrieved full-disk record is from {}",
                format(requested), format(observed));
        return true;
    }
}
