package org.exifrenamer.controller;

import java.util.List;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.exifrenamer.controller.metadata.ContainerReaderStrategy;
import org.exifrenamer.controller.metadata.DecodabilityOracle;
import org.exifrenamer.controller.metadata.DirectorySweepStrategy;
import org.exifrenamer.controller.metadata.ExifDirectoryStrategy;
import org.exifrenamer.controller.metadata.ExtractionStrategy;
import org.exifrenamer.controller.metadata.ImageContext;
import org.exifrenamer.controller.metadata.ImageIoDecodabilityOracle;
import org.exifrenamer.controller.metadata.JpegExifScanner;
import org.exifrenamer.controller.metadata.MetadataReadException;
import org.exifrenamer.controller.metadata.TagScan;
import org.exifrenamer.controller.util.FileUtilities;
import org.exifrenamer.controller.util.StringUtils;
import org.exifrenamer.model.CanonicalTimestamp;
import org.exifrenamer.model.ExtractionFailureKind;
import org.exifrenamer.model.ExtractionOutcome;
import org.exifrenamer.model.SourceFile;
import org.exifrenamer.model.UserPreferences;

/**
 * Pulls a capture time and camera model out of one image file.
 *
 * <p>The stages are tried in order, each only if the ones before it found no
 * timestamp that normalizes:
 * <ol>
 *   <li>containers needing an optional decoder are refused up front if the
 *       {@link DecodabilityOracle} says it is missing</li>
 *   <li>the standard EXIF tag dictionary</li>
 *   <li>the container-specific reader</li>
 *   <li>a sweep of every decoded directory by tag name</li>
 *   <li>a manual walk of the JPEG segments and the TIFF header</li>
 * </ol>
 * Camera text found by an earlier stage is carried forward when a later
 * stage supplies the timestamp but no camera.
 *
 * <p>{@link #extract(SourceFile)} never throws: every problem becomes a
 * failed {@link ExtractionOutcome}.
 */
public class MetadataExtractor {

    private static final Logger logger = Logger.getLogger(
        MetadataExtractor.class.getName()
    );

    private final UserPreferences prefs;
    private final DecodabilityOracle oracle;
    private final List<ExtractionStrategy> strategies;

    public MetadataExtractor(
        final UserPreferences prefs,
        final DecodabilityOracle oracle,
        final List<ExtractionStrategy> strategies
    ) {
        this.prefs = prefs;
        this.oracle = oracle;
        this.strategies = List.copyOf(strategies);
    }

    public MetadataExtractor(
        final UserPreferences prefs,
        final DecodabilityOracle oracle
    ) {
        this(prefs, oracle, defaultStrategies());
    }

    public MetadataExtractor(final UserPreferences prefs) {
        this(prefs, new ImageIoDecodabilityOracle());
    }

    /**
     * @return the standard fallback chain, in the order it is tried
     */
    public static List<ExtractionStrategy> defaultStrategies() {
        return List.of(
            new ExifDirectoryStrategy(),
            new ContainerReaderStrategy(),
            new DirectorySweepStrategy(),
            new JpegExifScanner()
        );
    }

    /**
     * @param file the image to examine
     * @return the outcome; never null
     */
    public ExtractionOutcome extract(final SourceFile file) {
        try {
            return tryExtract(file);
        } catch (RuntimeException e) {
            logger.log(
                Level.WARNING,
                "unexpected failure extracting metadata from " + file.getPath(),
                e
            );
            return ExtractionOutcome.failure(
                file,
                ExtractionFailureKind.DECODE_OR_READ_ERROR
            );
        }
    }

    private ExtractionOutcome tryExtract(final SourceFile file) {
        String extension = file.getMatchExtension();
        if (prefs.isGatedExtension(extension) && !oracle.canDecode(extension)) {
            logger.fine("no decoder for " + file.getFileName());
            return ExtractionOutcome.failure(
                file,
                ExtractionFailureKind.UNSUPPORTED_CONTAINER
            );
        }

        if (
            !FileUtilities.isReadableFile(file.getPath()) ||
            FileUtilities.sizeOf(file.getPath()) == 0L
        ) {
            logger.fine("unreadable or empty file: " + file.getPath());
            return ExtractionOutcome.failure(
                file,
                ExtractionFailureKind.DECODE_OR_READ_ERROR
            );
        }

        ImageContext context = new ImageContext(file);
        String camera = null;
        boolean anyStageDecoded = false;

        for (ExtractionStrategy strategy : strategies) {
            TagScan scan;
            try {
                scan = strategy.scan(context);
            } catch (MetadataReadException mre) {
                logger.finer(
                    strategy.getName() + " could not read " + file.getFileName() +
                        ": " + mre.getMessage()
                );
                continue;
            } catch (RuntimeException re) {
                logger.log(
                    Level.FINER,
                    strategy.getName() + " failed on " + file.getFileName(),
                    re
                );
                continue;
            }
            anyStageDecoded = true;

            if (camera == null && scan.hasCameraModel()) {
                camera = scan.cameraModel();
            }
            if (!scan.hasTimestamp()) {
                continue;
            }
            Optional<CanonicalTimestamp> timestamp =
                DateTimeNormalizer.normalize(scan.rawTimestamp());
            if (timestamp.isEmpty()) {
                logger.finer(
                    strategy.getName() + " found unreadable timestamp \"" +
                        scan.rawTimestamp() + "\" in " + file.getFileName()
                );
                continue;
            }

            String model = StringUtils.sanitiseForFileName(
                scan.hasCameraModel() ? scan.cameraModel() : camera
            );
            if (model.isEmpty()) {
                model = prefs.getDefaultCameraModel();
            }
            logger.finer(
                strategy.getName() + " found " + timestamp.get() + " / " + model +
                    " in " + file.getFileName()
            );
            return ExtractionOutcome.success(file, timestamp.get(), model);
        }

        ExtractionFailureKind kind = anyStageDecoded
            ? ExtractionFailureKind.NO_USABLE_TIMESTAMP
            : ExtractionFailureKind.DECODE_OR_READ_ERROR;
        logger.fine(kind + ": " + file.getFileName());
        return ExtractionOutcome.failure(file, kind, camera);
    }
}
