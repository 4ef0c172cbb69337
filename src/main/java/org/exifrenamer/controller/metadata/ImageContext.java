package org.exifrenamer.controller.metadata;

import com.drew.imaging.ImageMetadataReader;
import com.drew.imaging.ImageProcessingException;
import com.drew.metadata.Metadata;
import java.io.IOException;
import java.nio.file.Path;
import java.util.logging.Logger;
import org.exifrenamer.model.SourceFile;

/**
 * The file under extraction, shared by all stages.  The general-purpose
 * decode is done at most once per file; both its result and its failure are
 * remembered, so later stages that use it do not decode again.
 */
public class ImageContext {

    private static final Logger logger = Logger.getLogger(
        ImageContext.class.getName()
    );

    private final SourceFile source;

    private boolean decoded = false;
    private Metadata metadata = null;
    private Exception decodeFailure = null;

    public ImageContext(final SourceFile source) {
        this.source = source;
    }

    public SourceFile getSource() {
        return source;
    }

    public Path getPath() {
        return source.getPath();
    }

    public String getMatchExtension() {
        return source.getMatchExtension();
    }

    /**
     * @return the metadata as decoded by the general-purpose reader, which
     *         detects the container from the file's content
     * @throws MetadataReadException if the file could not be decoded
     */
    public Metadata getMetadata() throws MetadataReadException {
        if (!decoded) {
            decoded = true;
            try {
                metadata = ImageMetadataReader.readMetadata(getPath().toFile());
            } catch (ImageProcessingException | IOException e) {
                logger.fine("could not decode " + getPath() + ": " + e.getMessage());
                decodeFailure = e;
            }
        }
        if (metadata == null) {
            throw new MetadataReadException(
                "unable to decode " + getPath(),
                decodeFailure
            );
        }
        return metadata;
    }
}
