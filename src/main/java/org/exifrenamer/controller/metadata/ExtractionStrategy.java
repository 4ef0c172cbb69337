package org.exifrenamer.controller.metadata;

/**
 * One stage of the extraction fallback chain: a way of reaching the tags of a
 * file.  Stages are tried in order until one yields a timestamp that
 * normalizes.
 */
public interface ExtractionStrategy {

    /**
     * @return a short name for logging
     */
    String getName();

    /**
     * @param context the file being examined
     * @return what this access path found; {@link TagScan#empty()} if the
     *         file decoded but carried nothing useful
     * @throws MetadataReadException if this access path could not decode the file
     */
    TagScan scan(ImageContext context) throws MetadataReadException;
}
