package org.exifrenamer.model;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A capture time in the fixed form {@code YYYYMMDD_HHMMSS}.
 *
 * <p>The fields are the camera's local wall-clock values, copied from the
 * metadata without any time zone conversion.  An instance can only exist in
 * that exact shape.
 */
public final class CanonicalTimestamp implements Comparable<CanonicalTimestamp> {

    private static final Pattern SHAPE = Pattern.compile("\\d{8}_\\d{6}");

    private final String value;

    private CanonicalTimestamp(final String value) {
        this.value = value;
    }

    /**
     * @param value text expected to be in {@code YYYYMMDD_HHMMSS} form
     * @return the timestamp
     * @throws IllegalArgumentException if the text has any other shape
     */
    public static CanonicalTimestamp of(final String value) {
        Objects.requireNonNull(value, "value");
        if (!SHAPE.matcher(value).matches()) {
            throw new IllegalArgumentException(
                "not a canonical timestamp: \"" + value + "\""
            );
        }
        return new CanonicalTimestamp(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(CanonicalTimestamp other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof CanonicalTimestamp)) {
            return false;
        }
        return value.equals(((CanonicalTimestamp) other).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
