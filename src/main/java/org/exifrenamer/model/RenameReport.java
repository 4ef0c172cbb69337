package org.exifrenamer.model;

import java.util.List;

/**
 * Totals and per-file outcomes of a rename phase, in plan order.
 */
public record RenameReport(
    int successCount,
    int failureCount,
    List<RenameOutcome> outcomes,
    boolean cancelled
) {
    public RenameReport {
        outcomes = List.copyOf(outcomes);
    }

    public int processedCount() {
        return outcomes.size();
    }
}
