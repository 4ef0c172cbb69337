package org.exifrenamer.view;

import java.io.PrintStream;
import org.exifrenamer.model.BatchListener;
import org.exifrenamer.model.RenameReport;
import org.exifrenamer.model.ScanReport;

/**
 * Prints batch progress to a terminal, one line per phase, rewritten in place.
 */
public class ConsoleBatchListener implements BatchListener {

    private final PrintStream out;

    public ConsoleBatchListener(final PrintStream out) {
        this.out = out;
    }

    private void progress(final String label, final int current, final int total) {
        int percentage = (total == 0) ? 100 : (current * 100) / total;
        out.print("\r" + label + ": " + current + "/" + total + " (" + percentage + "%)");
        if (current >= total) {
            out.println();
        }
        out.flush();
    }

    @Override
    public void scanProgress(final int current, final int total) {
        progress("Analyzing", current, total);
    }

    @Override
    public void scanFinished(final ScanReport report) {
        if (report.cancelled()) {
            out.println();
            out.println("Scan cancelled.");
        }
    }

    @Override
    public void renameProgress(final int current, final int total) {
        progress("Renaming", current, total);
    }

    @Override
    public void renameFinished(final RenameReport report) {
        if (report.cancelled()) {
            out.println();
            out.println("Rename cancelled.");
        }
    }
}
