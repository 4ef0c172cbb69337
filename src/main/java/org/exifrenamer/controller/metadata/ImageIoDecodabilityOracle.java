package org.exifrenamer.controller.metadata;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;
import javax.imageio.ImageIO;

/**
 * Treats a container as decodable when an Image I/O reader plugin is
 * registered for its suffix.  Optional codecs (HEIF, for example) register
 * themselves that way when they are on the classpath.
 */
public class ImageIoDecodabilityOracle implements DecodabilityOracle {

    private static final Logger logger = Logger.getLogger(
        ImageIoDecodabilityOracle.class.getName()
    );

    private final Map<String, Boolean> answers = new ConcurrentHashMap<>();

    @Override
    public boolean canDecode(final String extension) {
        if (extension == null) {
            return false;
        }
        return answers.computeIfAbsent(extension, ImageIoDecodabilityOracle::probe);
    }

    private static boolean probe(final String extension) {
        String suffix = extension.startsWith(".")
            ? extension.substring(1)
            : extension;
        boolean available = ImageIO.getImageReadersBySuffix(suffix).hasNext();
        if (!available) {
            logger.info("no decoder installed for " + extension + " files");
        }
        return available;
    }
}
