package org.exifrenamer.controller;

import static org.exifrenamer.model.util.Constants.SENTINEL_TIMESTAMP;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.List;
import java.util.Optional;
import org.exifrenamer.model.CanonicalTimestamp;

/**
 * Turns the many ways cameras and editors write a capture time into a
 * {@link CanonicalTimestamp}.
 *
 * <p>The fields are taken as written; nothing is converted between time
 * zones, and a trailing {@code Z} is accepted but ignored.  This class does
 * no I/O and never throws; anything it cannot read is simply "no timestamp".
 */
public final class DateTimeNormalizer {

    private static final DateTimeFormatter CANONICAL =
        DateTimeFormatter.ofPattern("uuuuMMdd_HHmmss");

    private static final int MAX_YEAR = 9999;

    // Tried in order; the first one that parses wins.
    private static final List<DateTimeFormatter> PATTERNS = List.of(
        strict("uuuu:MM:dd HH:mm:ss"),
        strict("uuuu-MM-dd HH:mm:ss"),
        strict("uuuu/MM/dd HH:mm:ss"),
        withFraction("uuuu:MM:dd HH:mm:ss"),
        withFraction("uuuu-MM-dd HH:mm:ss"),
        withFraction("uuuu/MM/dd HH:mm:ss"),
        strict("uuuu-MM-dd'T'HH:mm:ss"),
        strict("uuuu-MM-dd'T'HH:mm:ss'Z'"),
        strict("uuuu:MM:dd HH:mm"),
        strict("uuuu-MM-dd HH:mm"),
        strict("uuuu/MM/dd HH:mm")
    );

    private DateTimeNormalizer() {
        // utility class
    }

    private static DateTimeFormatter strict(final String pattern) {
        return DateTimeFormatter.ofPattern(pattern)
            .withResolverStyle(ResolverStyle.STRICT);
    }

    private static DateTimeFormatter withFraction(final String pattern) {
        return new DateTimeFormatterBuilder()
            .appendPattern(pattern)
            .appendFraction(ChronoField.NANO_OF_SECOND, 1, 9, true)
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT);
    }

    /**
     * @param raw a date/time as found in metadata; may be null
     * @return the canonical form, or empty if the text is blank, is the
     *         all-zero placeholder, or matches none of the known layouts
     */
    public static Optional<CanonicalTimestamp> normalize(final String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String text = raw.trim();
        if (text.isEmpty() || SENTINEL_TIMESTAMP.equals(text)) {
            return Optional.empty();
        }
        for (DateTimeFormatter pattern : PATTERNS) {
            LocalDateTime parsed;
            try {
                parsed = LocalDateTime.parse(text, pattern);
            } catch (DateTimeParseException ignored) {
                continue;
            }
            if (parsed.getYear() < 0 || parsed.getYear() > MAX_YEAR) {
                return Optional.empty();
            }
            return Optional.of(CanonicalTimestamp.of(CANONICAL.format(parsed)));
        }
        return Optional.empty();
    }

    /**
     * @param raw a date/time as found in metadata; may be null
     * @return true if {@link #normalize(String)} would produce a timestamp
     */
    public static boolean isUsable(final String raw) {
        return normalize(raw).isPresent();
    }
}
