package org.exifrenamer.model;

/**
 * The events a {@code BatchSession} publishes to its host.  Callbacks arrive
 * on the worker thread; a UI host has to hop to its own thread itself.
 */
public interface BatchListener {

    default void scanProgress(int current, int total) {}

    default void scanFinished(ScanReport report) {}

    default void renameProgress(int current, int total) {}

    default void renameFinished(RenameReport report) {}
}
