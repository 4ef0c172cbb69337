package org.exifrenamer.controller.metadata;

/**
 * Stage 4: every directory the decoder produced, including maker notes and
 * vendor-specific ones, searched by tag name instead of tag number.
 */
public class DirectorySweepStrategy implements ExtractionStrategy {

    @Override
    public String getName() {
        return "directory-sweep";
    }

    @Override
    public TagScan scan(final ImageContext context) throws MetadataReadException {
        return TagSearch.search(ExifEntries.byTagName(context.getMetadata()));
    }
}
