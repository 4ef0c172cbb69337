package org.exifrenamer.controller;

import static org.exifrenamer.model.util.Constants.*;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.exifrenamer.model.BatchListener;
import org.exifrenamer.model.BatchState;
import org.exifrenamer.model.CancellationToken;
import org.exifrenamer.model.ExtractionOutcome;
import org.exifrenamer.model.RenamePlan;
import org.exifrenamer.model.RenameReport;
import org.exifrenamer.model.ScanReport;
import org.exifrenamer.model.SourceFile;
import org.exifrenamer.model.UserPreferences;

/**
 * Drives one folder selection through its scan and rename phases.
 *
 * <pre>
 *   IDLE -- scan --&gt; SCANNING --&gt; SCAN_COMPLETE -- rename --&gt; RENAMING --&gt; RENAME_DONE
 * </pre>
 *
 * Each phase runs on a single background worker, one file at a time, in
 * listing order; the calling thread never waits on file I/O.  A scan may be
 * repeated; a rename happens at most once per folder selection.  Selecting
 * a folder again starts over from IDLE.
 */
public class BatchSession {

    private static final Logger logger = Logger.getLogger(
        BatchSession.class.getName()
    );

    private final UserPreferences prefs;
    private final MetadataExtractor extractor;
    private final BatchListener listener;

    private final ExecutorService worker = Executors.newSingleThreadExecutor(
        r -> {
            Thread t = new Thread(r, WORKER_THREAD_LABEL);
            t.setDaemon(true);
            return t;
        }
    );

    private BatchState state = BatchState.IDLE;
    private boolean renameCompleted = false;
    private Path folder = null;
    private List<SourceFile> files = Collections.emptyList();
    private List<ExtractionOutcome> outcomes = Collections.emptyList();
    private CancellationToken token = new CancellationToken();

    public BatchSession(
        final UserPreferences prefs,
        final MetadataExtractor extractor,
        final BatchListener listener
    ) {
        this.prefs = prefs;
        this.extractor = extractor;
        this.listener = (listener == null) ? new BatchListener() {} : listener;
    }

    public BatchSession(final UserPreferences prefs, final BatchListener listener) {
        this(prefs, new MetadataExtractor(prefs), listener);
    }

    public synchronized BatchState getState() {
        return state;
    }

    public synchronized Path getFolder() {
        return folder;
    }

    public synchronized List<SourceFile> getFiles() {
        return files;
    }

    /**
     * @return the outcomes of the latest completed scan, in listing order
     */
    public synchronized List<ExtractionOutcome> getOutcomes() {
        return outcomes;
    }

    /**
     * @return the names a rename would use if the folder does not change,
     *         derived from the latest scan
     */
    public synchronized List<RenamePlan> getPreviewPlans() {
        return FilenamePlanner.planBatch(outcomes);
    }

    private void requireNoPhaseRunning(final String request) {
        if (state == BatchState.SCANNING || state == BatchState.RENAMING) {
            throw new IllegalStateException(
                "cannot " + request + " while " + state
            );
        }
    }

    /**
     * Select a folder, discarding everything known about the previous one.
     *
     * @param newFolder the folder whose images to process
     * @return the image files found, in processing order
     * @throws IOException if the folder cannot be listed
     */
    public synchronized List<SourceFile> selectFolder(final Path newFolder)
        throws IOException
    {
        requireNoPhaseRunning("select a folder");
        List<SourceFile> found = FolderScanner.listImages(newFolder, prefs);

        folder = newFolder;
        files = List.copyOf(found);
        outcomes = Collections.emptyList();
        renameCompleted = false;
        state = BatchState.IDLE;
        logger.info("selected folder " + newFolder);
        return files;
    }

    /**
     * Start extracting metadata from every selected file.
     *
     * @return completes with the scan report once every file is processed
     * @throws IllegalStateException if a phase is running or nothing is selected
     */
    public synchronized Future<ScanReport> startScan() {
        requireNoPhaseRunning("scan");
        if (files.isEmpty()) {
            throw new IllegalStateException("no image files selected");
        }

        final List<SourceFile> toScan = files;
        final CancellationToken scanToken = new CancellationToken();
        token = scanToken;
        state = BatchState.SCANNING;
        logger.info("scanning " + toScan.size() + " file(s)");

        CompletableFuture<ScanReport> result = new CompletableFuture<>();
        worker.execute(() -> {
            ScanReport report;
            try {
                ScanRunner runner = new ScanRunner(toScan, extractor);
                runner.setUpdater(listener::scanProgress);
                runner.setCancellationToken(scanToken);
                report = runner.execute();
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "scan worker failed", e);
                report = new ScanReport(Collections.emptyList(), true);
            }
            final ScanReport finished = report;
            finishScan(finished);
            notifyQuietly(() -> listener.scanFinished(finished));
            result.complete(finished);
        });
        return result;
    }

    private synchronized void finishScan(final ScanReport report) {
        if (report.cancelled()) {
            outcomes = Collections.emptyList();
        } else {
            outcomes = report.outcomes();
        }
        if (renameCompleted) {
            state = BatchState.RENAME_DONE;
        } else if (report.cancelled()) {
            state = BatchState.IDLE;
        } else {
            state = BatchState.SCAN_COMPLETE;
        }
    }

    /**
     * Start renaming every file the latest scan found a capture time for.
     *
     * @return completes with the rename report once every file is processed
     * @throws RenameAlreadyCompletedException if this selection was already renamed
     * @throws IllegalStateException if no scan has completed, or it found
     *         nothing to rename
     */
    public synchronized Future<RenameReport> startRename() {
        if (renameCompleted) {
            throw new RenameAlreadyCompletedException(
                "files in " + folder + " have already been renamed; select the folder again"
            );
        }
        if (state != BatchState.SCAN_COMPLETE) {
            throw new IllegalStateException("cannot rename while " + state);
        }
        final List<RenamePlan> plans = FilenamePlanner.planBatch(outcomes);
        if (plans.isEmpty()) {
            throw new IllegalStateException("no file has a usable capture time");
        }

        final CancellationToken renameToken = new CancellationToken();
        token = renameToken;
        state = BatchState.RENAMING;
        renameCompleted = true;
        logger.info("renaming " + plans.size() + " file(s)");

        CompletableFuture<RenameReport> result = new CompletableFuture<>();
        worker.execute(() -> {
            RenameReport report;
            try {
                RenameRunner runner = new RenameRunner(plans);
                runner.setUpdater(listener::renameProgress);
                runner.setCancellationToken(renameToken);
                report = runner.execute();
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "rename worker failed", e);
                report = new RenameReport(0, 0, new ArrayList<>(), true);
            }
            final RenameReport finished = report;
            finishRename();
            notifyQuietly(() -> listener.renameFinished(finished));
            result.complete(finished);
        });
        return result;
    }

    private synchronized void finishRename() {
        state = BatchState.RENAME_DONE;
    }

    /**
     * Ask the running phase to stop before its next file.
     */
    public synchronized void cancel() {
        token.cancel();
    }

    private static void notifyQuietly(final Runnable notification) {
        try {
            notification.run();
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "batch listener failed", e);
        }
    }

    /**
     * Stop the worker.  A phase in progress is interrupted between files.
     */
    public void shutDown() {
        token.cancel();
        worker.shutdownNow();
    }
}
