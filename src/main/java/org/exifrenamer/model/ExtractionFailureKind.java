package org.exifrenamer.model;

import static org.exifrenamer.model.util.Constants.*;

/**
 * Why a file did not yield a usable capture time.
 */
public enum ExtractionFailureKind {
    /** The container is recognized, but cannot be decoded in this runtime. */
    UNSUPPORTED_CONTAINER(NO_DECODER_PREFIX),
    /** The file exists, but could not be read or decoded at all. */
    DECODE_OR_READ_ERROR(READ_ERROR_PREFIX),
    /** The file decoded, but no stage found a valid timestamp. */
    NO_USABLE_TIMESTAMP(NO_TIMESTAMP_PREFIX);

    private final String displayPrefix;

    ExtractionFailureKind(final String displayPrefix) {
        this.displayPrefix = displayPrefix;
    }

    /**
     * The marker the preview puts in front of the unchanged file name, so a
     * failed file stands out.  It is never used for an actual rename.
     *
     * @return the display prefix, e.g. {@code NOEXIF_}
     */
    public String getDisplayPrefix() {
        return displayPrefix;
    }
}
