package org.exifrenamer.controller.metadata;

/**
 * Stage 2: the decoded image's standard EXIF tag dictionary (and XMP dates),
 * through the general-purpose reader.
 */
public class ExifDirectoryStrategy implements ExtractionStrategy {

    @Override
    public String getName() {
        return "exif-directories";
    }

    @Override
    public TagScan scan(final ImageContext context) throws MetadataReadException {
        return TagSearch.search(ExifEntries.byTagNumber(context.getMetadata()));
    }
}
