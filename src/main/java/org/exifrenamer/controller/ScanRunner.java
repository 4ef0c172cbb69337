package org.exifrenamer.controller;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.exifrenamer.model.CancellationToken;
import org.exifrenamer.model.ExtractionOutcome;
import org.exifrenamer.model.ProgressUpdater;
import org.exifrenamer.model.ScanReport;
import org.exifrenamer.model.SourceFile;

/**
 * Extracts metadata from each file in turn, in listing order, reporting
 * progress after every file.
 */
public class ScanRunner {

    private static final Logger logger = Logger.getLogger(
        ScanRunner.class.getName()
    );

    private final List<SourceFile> files;
    private final MetadataExtractor extractor;
    private ProgressUpdater updater = null;
    private CancellationToken token = new CancellationToken();

    public ScanRunner(
        final List<SourceFile> files,
        final MetadataExtractor extractor
    ) {
        this.files = List.copyOf(files);
        this.extractor = extractor;
    }

    public void setUpdater(final ProgressUpdater updater) {
        this.updater = updater;
    }

    public void setCancellationToken(final CancellationToken token) {
        this.token = (token == null) ? new CancellationToken() : token;
    }

    /**
     * Scan every file, on the calling thread.
     *
     * @return one outcome per file processed, in listing order
     */
    public ScanReport execute() {
        int total = files.size();
        List<ExtractionOutcome> outcomes = new ArrayList<>(total);
        boolean cancelled = false;

        for (SourceFile file : files) {
            if (token.isCancelled()) {
                cancelled = true;
                logger.info(
                    "scan cancelled after " + outcomes.size() + " of " + total + " files"
                );
                break;
            }
            outcomes.add(extractor.extract(file));
            reportProgress(outcomes.size(), total);
        }

        ScanReport report = new ScanReport(outcomes, cancelled);
        logger.info(
            "scanned " + outcomes.size() + " file(s): " + report.successCount() +
                " with a capture time, " + report.failureCount() + " without"
        );
        return report;
    }

    private void reportProgress(final int done, final int total) {
        if (updater == null) {
            return;
        }
        try {
            updater.setProgress(done, total);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "scan progress listener failed", e);
        }
    }
}
