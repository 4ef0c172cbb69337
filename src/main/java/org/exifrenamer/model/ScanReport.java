package org.exifrenamer.model;

import java.util.List;

/**
 * Outcomes of a scan phase, one per file, in listing order.
 */
public record ScanReport(List<ExtractionOutcome> outcomes, boolean cancelled) {
    public ScanReport {
        outcomes = List.copyOf(outcomes);
    }

    public long successCount() {
        return outcomes.stream().filter(ExtractionOutcome::isSuccess).count();
    }

    public long failureCount() {
        return outcomes.size() - successCount();
    }
}
