package org.exifrenamer.model;

/**
 * Cooperative stop signal.  Workers check it between files; a file that is
 * already being processed always finishes.
 */
public final class CancellationToken {

    private volatile boolean cancelled = false;

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
