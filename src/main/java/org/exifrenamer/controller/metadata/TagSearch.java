package org.exifrenamer.controller.metadata;

import static org.exifrenamer.model.util.Constants.SENTINEL_TIMESTAMP;

import com.drew.metadata.StringValue;
import java.util.List;
import org.exifrenamer.controller.util.StringUtils;

/**
 * The tag search shared by the structured access paths.
 *
 * <p>Timestamps are chosen by name priority: {@code DateTimeOriginal}, then
 * {@code DateTime}, {@code DateTimeDigitized}, {@code CreateDate},
 * {@code ModifyDate}.  Within one name, the first occurrence in enumeration
 * order with a non-empty, non-placeholder value wins.  In the same pass the
 * camera is taken from {@code Model}, or from {@code Make} when there is no
 * usable Model; spaces are removed from it.
 */
public final class TagSearch {

    public static final String DATE_TIME_ORIGINAL = "DateTimeOriginal";
    public static final String DATE_TIME = "DateTime";
    public static final String DATE_TIME_DIGITIZED = "DateTimeDigitized";
    public static final String CREATE_DATE = "CreateDate";
    public static final String MODIFY_DATE = "ModifyDate";
    public static final String MODEL = "Model";
    public static final String MAKE = "Make";

    public static final List<String> TIMESTAMP_PRIORITY = List.of(
        DATE_TIME_ORIGINAL,
        DATE_TIME,
        DATE_TIME_DIGITIZED,
        CREATE_DATE,
        MODIFY_DATE
    );

    private TagSearch() {
        // utility class
    }

    /**
     * Decode a tag value into trimmed text.  Bytes are read as UTF-8, with
     * invalid sequences dropped.
     *
     * @param value the value as the decoder provided it; may be null
     * @return the text, never null
     */
    public static String asText(final Object value) {
        if (value == null) {
            return "";
        }
        String text;
        if (value instanceof byte[]) {
            text = StringUtils.decodeUtf8Lenient((byte[]) value);
        } else if (value instanceof StringValue) {
            text = StringUtils.decodeUtf8Lenient(((StringValue) value).getBytes());
        } else {
            text = String.valueOf(value);
        }
        return StringUtils.trimPadding(text);
    }

    static boolean isUsableTimestampText(final String text) {
        return !text.isEmpty() && !SENTINEL_TIMESTAMP.equals(text);
    }

    /**
     * @param entries the tags, in the order the access path enumerates them
     * @return the chosen raw timestamp and camera text; either may be null
     */
    public static TagScan search(final Iterable<TagEntry> entries) {
        String[] best = new String[TIMESTAMP_PRIORITY.size()];
        String model = null;
        String make = null;

        for (TagEntry entry : entries) {
            String name = entry.name();
            if (name == null) {
                continue;
            }
            int rank = TIMESTAMP_PRIORITY.indexOf(name);
            if (rank >= 0) {
                if (best[rank] == null) {
                    String text = asText(entry.value());
                    if (isUsableTimestampText(text)) {
                        best[rank] = text;
                    }
                }
            } else if (MODEL.equals(name)) {
                if (model == null) {
                    String text = StringUtils.removeSpaces(asText(entry.value()));
                    if (!text.isEmpty()) {
                        model = text;
                    }
                }
            } else if (MAKE.equals(name)) {
                if (make == null) {
                    String text = StringUtils.removeSpaces(asText(entry.value()));
                    if (!text.isEmpty()) {
                        make = text;
                    }
                }
            }
        }

        String timestamp = null;
        for (String candidate : best) {
            if (candidate != null) {
                timestamp = candidate;
                break;
            }
        }
        return new TagScan(timestamp, (model != null) ? model : make);
    }
}
