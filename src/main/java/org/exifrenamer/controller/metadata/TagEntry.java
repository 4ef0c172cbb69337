package org.exifrenamer.controller.metadata;

/**
 * One tag as enumerated by an access path: the standard EXIF/XMP name it
 * corresponds to (for example {@code DateTimeOriginal}), and its value as the
 * decoder handed it over, which may be text, raw bytes, or something else.
 */
public record TagEntry(String name, Object value) {}
