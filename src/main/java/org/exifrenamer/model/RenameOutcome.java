package org.exifrenamer.model;

import java.nio.file.Path;

/**
 * What happened to one planned file.  The target may differ from the plan,
 * if the folder changed between preview and rename.
 *
 * @param source the file as it was before the rename
 * @param target the path actually used (or attempted); null if no name could be chosen
 * @param success whether the file now lives at {@code target}
 * @param error a description of the failure; null on success
 */
public record RenameOutcome(
    Path source,
    Path target,
    boolean success,
    String error
) {
    public static RenameOutcome succeeded(final Path source, final Path target) {
        return new RenameOutcome(source, target, true, null);
    }

    public static RenameOutcome failed(
        final Path source,
        final Path target,
        final String error
    ) {
        return new RenameOutcome(source, target, false, error);
    }
}
