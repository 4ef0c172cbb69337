package org.exifrenamer.controller.metadata;

/**
 * Thrown by an {@link ExtractionStrategy} that could not decode the file
 * through its own access path.  The extraction engine treats it as "try the
 * next stage", never as a batch failure.
 */
public class MetadataReadException extends Exception {

    private static final long serialVersionUID = 1L;

    public MetadataReadException(final String message) {
        super(message);
    }

    public MetadataReadException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
