package org.exifrenamer.controller;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import org.exifrenamer.controller.util.FileUtilities;
import org.exifrenamer.controller.util.StringUtils;
import org.exifrenamer.model.SourceFile;
import org.exifrenamer.model.UserPreferences;

/**
 * Finds the image files directly inside a folder.
 */
public final class FolderScanner {

    private static final Logger logger = Logger.getLogger(
        FolderScanner.class.getName()
    );

    private FolderScanner() {
        // utility class
    }

    /**
     * @param folder the folder to list; subfolders are not entered
     * @param prefs supplies the image extensions to pick up
     * @return the image files, sorted by path (case-sensitive)
     * @throws IOException if {@code folder} is not a readable directory
     */
    public static List<SourceFile> listImages(
        final Path folder,
        final UserPreferences prefs
    ) throws IOException {
        List<Path> paths = new ArrayList<>();
        for (Path file : FileUtilities.listRegularFiles(folder)) {
            Path name = file.getFileName();
            if (name != null && prefs.isImageExtension(StringUtils.getExtension(name.toString()))) {
                paths.add(file.toAbsolutePath().normalize());
            }
        }
        paths.sort((a, b) -> a.toString().compareTo(b.toString()));

        List<SourceFile> files = new ArrayList<>(paths.size());
        for (Path path : paths) {
            files.add(new SourceFile(path));
        }
        logger.info("found " + files.size() + " image file(s) in " + folder);
        return files;
    }
}
