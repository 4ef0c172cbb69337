package org.exifrenamer.model;

/**
 * Receives per-file progress from a worker.
 */
public interface ProgressUpdater {

    /**
     * Called after each file completes, whatever its outcome.
     *
     * @param current the number of files processed so far (1-based)
     * @param total the number of files in the phase
     */
    void setProgress(int current, int total);
}
