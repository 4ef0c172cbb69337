package org.exifrenamer.model;

/**
 * Where a folder selection is in its scan/rename life cycle.
 */
public enum BatchState {
    IDLE,
    SCANNING,
    SCAN_COMPLETE,
    RENAMING,
    /** Terminal for the current folder selection. */
    RENAME_DONE,
}
