package org.exifrenamer.controller;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.exifrenamer.model.CancellationToken;
import org.exifrenamer.model.ProgressUpdater;
import org.exifrenamer.model.RenameOutcome;
import org.exifrenamer.model.RenamePlan;
import org.exifrenamer.model.RenameReport;

/**
 * Executes a list of rename plans strictly in order, one file at a time.
 *
 * <p>A failed file is recorded and the next one is attempted; nothing short
 * of cancellation stops the batch.  Progress is reported after every file.
 */
public class RenameRunner {

    private static final Logger logger = Logger.getLogger(
        RenameRunner.class.getName()
    );

    private final List<RenamePlan> plans;
    private ProgressUpdater updater = null;
    private CancellationToken token = new CancellationToken();

    public RenameRunner(final List<RenamePlan> plans) {
        this.plans = List.copyOf(plans);
    }

    /**
     * Set the progress updater for this RenameRunner.
     *
     * @param updater a ProgressUpdater to be informed of our progress
     */
    public void setUpdater(final ProgressUpdater updater) {
        this.updater = updater;
    }

    public void setCancellationToken(final CancellationToken token) {
        this.token = (token == null) ? new CancellationToken() : token;
    }

    /**
     * Rename every planned file, on the calling thread.
     *
     * @return totals and per-file outcomes, in plan order
     */
    public RenameReport execute() {
        int total = plans.size();
        logger.log(Level.FINE, () -> "have " + total + " files to rename");

        Set<String> claimed = new HashSet<>();
        List<RenameOutcome> outcomes = new ArrayList<>(total);
        int successes = 0;
        int failures = 0;
        boolean cancelled = false;

        for (RenamePlan plan : plans) {
            if (token.isCancelled()) {
                cancelled = true;
                logger.info(
                    "rename cancelled after " + outcomes.size() + " of " + total + " files"
                );
                break;
            }
            RenameOutcome outcome = new FileRenamer(plan, claimed).call();
            outcomes.add(outcome);
            if (outcome.success()) {
                successes++;
            } else {
                failures++;
            }
            reportProgress(outcomes.size(), total);
        }

        logger.info(
            "renamed " + successes + " file(s), " + failures + " failure(s)"
        );
        return new RenameReport(successes, failures, outcomes, cancelled);
    }

    private void reportProgress(final int done, final int total) {
        if (updater == null) {
            return;
        }
        try {
            updater.setProgress(done, total);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "rename progress listener failed", e);
        }
    }
}
