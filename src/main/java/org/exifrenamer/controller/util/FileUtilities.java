package org.exifrenamer.controller.util;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

public class FileUtilities {

    private static final Logger logger = Logger.getLogger(
        FileUtilities.class.getName()
    );

    private FileUtilities() {
        // utility class
    }

    /**
     * Returns a safe string representation of a Path, handling null gracefully.
     *
     * @param p the path to convert (may be null)
     * @return the path as a string, or "&lt;null&gt;" if the path is null
     */
    public static String safePath(Path p) {
        return (p == null) ? "<null>" : p.toString();
    }

    /**
     * Rename a file within its own directory, never replacing an existing file.
     *
     * <p>Unlike a general move, this refuses any destination outside the
     * source's directory, so the operation stays a plain rename on the same
     * file store.
     *
     * @param srcFile
     *    the file to be renamed
     * @param destFile
     *    the new path; must be in the same directory as {@code srcFile}
     * @return
     *    the path the file now has
     * @throws IOException
     *    if the source is gone, the destination exists, or the rename fails
     *    for any other reason
     */
    public static Path renameInPlace(final Path srcFile, final Path destFile)
        throws IOException
    {
        Path srcDir = srcFile.toAbsolutePath().getParent();
        Path destDir = destFile.toAbsolutePath().getParent();
        if (srcDir == null || !srcDir.equals(destDir)) {
            throw new IOException(
                "will not move across directories: " +
                    safePath(srcFile) +
                    " -> " +
                    safePath(destFile)
            );
        }
        if (Files.notExists(srcFile)) {
            throw new NoSuchFileException(
                srcFile.toString(),
                null,
                "source no longer exists"
            );
        }
        if (Files.exists(destFile)) {
            throw new FileAlreadyExistsException(destFile.toString());
        }
        try {
            return Files.move(srcFile, destFile);
        } catch (AccessDeniedException ade) {
            logger.warning(
                "Could not rename file \"" + srcFile + "\"; access denied"
            );
            throw ade;
        }
    }

    /**
     * @param file the file to check
     * @return true if the file is a regular file we can read
     */
    public static boolean isReadableFile(final Path file) {
        return (file != null) && Files.isRegularFile(file) && Files.isReadable(file);
    }

    /**
     * Get the size of a file, treating an unreadable file as empty.
     *
     * @param file the file to check
     * @return its size in bytes, or zero if it cannot be determined
     */
    public static long sizeOf(final Path file) {
        try {
            return Files.size(file);
        } catch (IOException ioe) {
            logger.log(Level.FINE, "could not get size of " + safePath(file), ioe);
            return 0L;
        }
    }

    /**
     * List the regular files directly inside a directory (no recursion).
     *
     * @param dir the directory to list
     * @return the files, in no particular order
     * @throws IOException if the directory cannot be read
     */
    public static List<Path> listRegularFiles(final Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            throw new IOException("not a directory: " + safePath(dir));
        }
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> contents = Files.newDirectoryStream(dir)) {
            for (Path p : contents) {
                if (Files.isRegularFile(p)) {
                    files.add(p);
                }
            }
        }
        return files;
    }
}
