package org.exifrenamer.model;

import java.util.Objects;

/**
 * The result of extracting capture time and camera identity from one file.
 *
 * <p>Exactly one of two shapes:
 * <ul>
 *   <li>success: a canonical timestamp, a camera model and the derived base
 *       name {@code "{timestamp}_{camera}"}</li>
 *   <li>failure: an {@link ExtractionFailureKind}, plus whatever camera text
 *       was seen along the way (informational only)</li>
 * </ul>
 *
 * <p>A success is only ever built from a validly formatted timestamp; there
 * is no partial success.
 */
public final class ExtractionOutcome {

    private final SourceFile source;
    private final CanonicalTimestamp timestamp;
    private final String cameraModel;
    private final ExtractionFailureKind failureKind;

    private ExtractionOutcome(
        final SourceFile source,
        final CanonicalTimestamp timestamp,
        final String cameraModel,
        final ExtractionFailureKind failureKind
    ) {
        this.source = Objects.requireNonNull(source, "source");
        this.timestamp = timestamp;
        this.cameraModel = cameraModel;
        this.failureKind = failureKind;
    }

    public static ExtractionOutcome success(
        final SourceFile source,
        final CanonicalTimestamp timestamp,
        final String cameraModel
    ) {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(cameraModel, "cameraModel");
        return new ExtractionOutcome(source, timestamp, cameraModel, null);
    }

    public static ExtractionOutcome failure(
        final SourceFile source,
        final ExtractionFailureKind kind
    ) {
        return failure(source, kind, null);
    }

    public static ExtractionOutcome failure(
        final SourceFile source,
        final ExtractionFailureKind kind,
        final String cameraModel
    ) {
        Objects.requireNonNull(kind, "kind");
        return new ExtractionOutcome(source, null, cameraModel, kind);
    }

    public SourceFile getSource() {
        return source;
    }

    public boolean isSuccess() {
        return failureKind == null;
    }

    /**
     * @return the capture time; null unless {@link #isSuccess()}
     */
    public CanonicalTimestamp getTimestamp() {
        return timestamp;
    }

    /**
     * @return the camera model (spaces removed); on failure this is whatever
     *         was discovered before giving up, and may be null
     */
    public String getCameraModel() {
        return cameraModel;
    }

    /**
     * @return why extraction failed; null if {@link #isSuccess()}
     */
    public ExtractionFailureKind getFailureKind() {
        return failureKind;
    }

    /**
     * @return {@code "{timestamp}_{camera}"}; null unless {@link #isSuccess()}
     */
    public String getBaseName() {
        if (!isSuccess()) {
            return null;
        }
        return timestamp.getValue() + "_" + cameraModel;
    }

    /**
     * The name shown in a preview for a file that failed, e.g.
     * {@code NOEXIF_IMG_0001.JPG}.  For a success, the planned name comes from
     * the planner instead, so this returns null.
     *
     * @return the marker name for a failed file, or null on success
     */
    public String getFailureDisplayName() {
        if (isSuccess()) {
            return null;
        }
        return failureKind.getDisplayPrefix() + source.getFileName();
    }

    @Override
    public String toString() {
        if (isSuccess()) {
            return "ExtractionOutcome [" + source.getFileName() + " -> " +
                getBaseName() + "]";
        }
        return "ExtractionOutcome [" + source.getFileName() + ": " +
            failureKind + "]";
    }
}
