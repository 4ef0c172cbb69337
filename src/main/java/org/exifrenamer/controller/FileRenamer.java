package org.exifrenamer.controller;

import static org.exifrenamer.controller.util.FileUtilities.safePath;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.exifrenamer.controller.util.FileUtilities;
import org.exifrenamer.model.RenameOutcome;
import org.exifrenamer.model.RenamePlan;

/**
 * Carries out one {@link RenamePlan}.
 *
 * <p>The target name is chosen again at the moment of the rename, against
 * both the names claimed so far in this run and the files actually in the
 * folder.  The plan's own target name is only what the preview showed.
 */
public class FileRenamer implements Callable<RenameOutcome> {

    static final Logger logger = Logger.getLogger(FileRenamer.class.getName());

    private final RenamePlan plan;
    private final Set<String> claimed;

    /**
     * @param plan the rename to carry out
     * @param claimed the names taken so far in this run; the chosen name is
     *        added to it.  Only the single rename worker may touch it.
     */
    public FileRenamer(final RenamePlan plan, final Set<String> claimed) {
        this.plan = plan;
        this.claimed = claimed;
    }

    private RenameOutcome failAndLog(
        final Path source,
        final Path dest,
        final String message,
        final Throwable t
    ) {
        String detail = message + "\n  source=" + safePath(source) +
            "\n  dest=" + safePath(dest);
        if (t == null) {
            logger.warning(detail);
        } else {
            logger.log(Level.WARNING, detail, t);
        }
        return RenameOutcome.failed(source, dest, message);
    }

    private static String describe(final IOException ioe) {
        if (ioe instanceof NoSuchFileException) {
            return "source no longer exists";
        }
        if (ioe instanceof FileAlreadyExistsException) {
            return "destination already exists";
        }
        if (ioe instanceof AccessDeniedException) {
            return "access denied";
        }
        String message = ioe.getMessage();
        return (message == null) ? ioe.getClass().getSimpleName() : message;
    }

    private RenameOutcome tryToRename() {
        Path source = plan.source();
        if (Files.notExists(source)) {
            return failAndLog(source, null, "source no longer exists", null);
        }

        Path directory = plan.directory();
        Path fileName = source.getFileName();
        String currentName = (fileName == null) ? null : fileName.toString();
        String name = FilenamePlanner.planActual(
            plan.baseName(),
            plan.extension(),
            directory,
            claimed,
            currentName
        );
        claimed.add(name);
        if (name.equals(currentName)) {
            logger.info("nothing to be done to " + source);
            return RenameOutcome.succeeded(source, source);
        }
        if (!name.equals(plan.targetName())) {
            logger.info(
                "folder changed since preview; using " + name + " instead of " +
                    plan.targetName()
            );
        }

        Path dest = directory.resolve(name);
        try {
            Path actual = FileUtilities.renameInPlace(source, dest);
            logger.fine("renamed:\n  " + source + "\n  " + actual);
            return RenameOutcome.succeeded(source, actual);
        } catch (IOException ioe) {
            return failAndLog(source, dest, describe(ioe), ioe);
        }
    }

    /**
     * Attempt the rename.
     *
     * @return the outcome; never null, never thrown
     */
    @Override
    public RenameOutcome call() {
        try {
            return tryToRename();
        } catch (RuntimeException e) {
            return failAndLog(
                plan.source(),
                null,
                "unexpected runtime exception during rename: " + e,
                e
            );
        }
    }
}
