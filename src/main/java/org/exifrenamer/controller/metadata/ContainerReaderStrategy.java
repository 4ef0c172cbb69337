package org.exifrenamer.controller.metadata;

import com.drew.imaging.ImageProcessingException;
import com.drew.imaging.jpeg.JpegMetadataReader;
import com.drew.imaging.png.PngMetadataReader;
import com.drew.imaging.tiff.TiffMetadataReader;
import com.drew.metadata.Metadata;
import java.io.File;
import java.io.IOException;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Stage 3: the older, container-specific readers, chosen by file extension
 * rather than by sniffing the content.  They still get through some files
 * whose leading bytes confuse content detection.
 */
public class ContainerReaderStrategy implements ExtractionStrategy {

    @FunctionalInterface
    interface ContainerReader {
        Metadata read(File file) throws ImageProcessingException, IOException;
    }

    private static final Map<String, ContainerReader> READERS = new HashMap<>();

    static {
        ContainerReader jpeg = JpegMetadataReader::readMetadata;
        ContainerReader tiff = TiffMetadataReader::readMetadata;
        ContainerReader png = PngMetadataReader::readMetadata;

        READERS.put(".jpg", jpeg);
        READERS.put(".jpeg", jpeg);
        READERS.put(".png", png);
        // Camera raw formats are TIFF-structured.
        for (String ext : new String[] {
            ".tiff", ".dng", ".nef", ".cr2", ".arw", ".orf", ".rw2", ".pef",
        }) {
            READERS.put(ext, tiff);
        }
    }

    static Set<String> supportedExtensions() {
        return Collections.unmodifiableSet(READERS.keySet());
    }

    @Override
    public String getName() {
        return "container-reader";
    }

    @Override
    public TagScan scan(final ImageContext context) throws MetadataReadException {
        ContainerReader reader = READERS.get(context.getMatchExtension());
        if (reader == null) {
            throw new MetadataReadException(
                "no container reader for \"" + context.getMatchExtension() + "\""
            );
        }
        Metadata metadata;
        try {
            metadata = reader.read(context.getPath().toFile());
        } catch (ImageProcessingException | IOException e) {
            throw new MetadataReadException(
                "container reader failed on " + context.getPath(),
                e
            );
        }
        return TagSearch.search(ExifEntries.byTagNumber(metadata));
    }
}
