package org.exifrenamer.model.util;

import java.util.List;

public class Constants {

    private Constants() {
        // constants holder
    }

    public static final String APPLICATION_NAME = "ExifRenamer";
    public static final String VERSION_NUMBER = "1.0.0";

    public static final String LOGGING_PROPERTIES = "/logging.properties";
    public static final String DEBUG_PROPERTY = "exifrenamer.debug";
    public static final String LOG_FILENAME = "exifrenamer.log";

    public static final String WORKER_THREAD_LABEL = "ExifRenamer Worker";

    // EXIF writers emit this when the camera clock was never set.
    public static final String SENTINEL_TIMESTAMP = "0000:00:00 00:00:00";

    public static final String DEFAULT_CAMERA_MODEL = "Unknown";

    public static final int DEFAULT_AUTO_SCAN_LIMIT = 500;

    public static final List<String> DEFAULT_IMAGE_EXTENSIONS = List.of(
        ".jpg",
        ".jpeg",
        ".png",
        ".gif",
        ".bmp",
        ".tiff",
        ".webp",
        ".cr2",
        ".nef",
        ".arw",
        ".dng",
        ".orf",
        ".rw2",
        ".pef",
        ".heic",
        ".heif"
    );

    // Still-image containers that need an optional decoder at runtime.
    public static final List<String> DEFAULT_GATED_EXTENSIONS = List.of(
        ".heic",
        ".heif"
    );

    public static final String NO_DECODER_PREFIX = "NOHEIC_";
    public static final String READ_ERROR_PREFIX = "ERROR_";
    public static final String NO_TIMESTAMP_PREFIX = "NOEXIF_";
}
