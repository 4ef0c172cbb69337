package org.exifrenamer.view;

import java.io.PrintStream;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.exifrenamer.controller.FilenamePlanner;
import org.exifrenamer.model.ExtractionOutcome;
import org.exifrenamer.model.RenameOutcome;
import org.exifrenamer.model.RenameReport;

/**
 * Renders scan and rename results as plain text tables.
 */
public class ResultsPrinter {

    private static final String READ_FAILED = "(unreadable)";
    private static final String ROW_FORMAT = "%-40s %-16s %-20s %s%n";

    private final PrintStream out;

    public ResultsPrinter(final PrintStream out) {
        this.out = out;
    }

    /**
     * One row per file, in scan order: the old name, capture time, camera and
     * the name the file would get.  Failed files show a marker name instead.
     */
    public void printPreview(final List<ExtractionOutcome> outcomes) {
        out.printf(ROW_FORMAT, "Original name", "Taken", "Camera", "New name");
        Set<String> claimed = new HashSet<>();
        for (ExtractionOutcome outcome : outcomes) {
            String oldName = outcome.getSource().getFileName();
            if (outcome.isSuccess()) {
                String newName = FilenamePlanner.planPreview(
                    outcome.getBaseName(),
                    outcome.getSource().getExtension(),
                    claimed
                );
                claimed.add(newName);
                out.printf(
                    ROW_FORMAT,
                    oldName,
                    outcome.getTimestamp(),
                    outcome.getCameraModel(),
                    newName
                );
            } else {
                out.printf(
                    ROW_FORMAT,
                    oldName,
                    READ_FAILED,
                    READ_FAILED,
                    outcome.getFailureDisplayName()
                );
            }
        }
        long successes = outcomes.stream().filter(ExtractionOutcome::isSuccess).count();
        out.println(
            successes + " of " + outcomes.size() + " file(s) can be renamed"
        );
    }

    public void printRenameReport(final RenameReport report) {
        for (RenameOutcome outcome : report.outcomes()) {
            if (!outcome.success()) {
                out.println(
                    "FAILED " + outcome.source().getFileName() + ": " + outcome.error()
                );
            }
        }
        out.println(
            "Renamed " + report.successCount() + " file(s), " +
                report.failureCount() + " failure(s)"
        );
    }
}
