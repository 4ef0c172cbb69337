package org.exifrenamer.controller;

/**
 * Thrown when a rename is requested for a folder selection that has already
 * been renamed.  A batch is renamed at most once; select the folder again to
 * start over.
 */
public class RenameAlreadyCompletedException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public RenameAlreadyCompletedException(final String message) {
        super(message);
    }
}
