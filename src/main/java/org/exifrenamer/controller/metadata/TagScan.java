package org.exifrenamer.controller.metadata;

/**
 * What one stage found: the raw timestamp text it chose and the camera text.
 * Either may be null.
 */
public record TagScan(String rawTimestamp, String cameraModel) {

    private static final TagScan EMPTY = new TagScan(null, null);

    public static TagScan empty() {
        return EMPTY;
    }

    public boolean hasTimestamp() {
        return rawTimestamp != null;
    }

    public boolean hasCameraModel() {
        return cameraModel != null;
    }
}
