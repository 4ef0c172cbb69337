package org.exifrenamer.controller;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;
import org.exifrenamer.model.ExtractionOutcome;
import org.exifrenamer.model.RenamePlan;

/**
 * Chooses unique file names of the form {@code {base}{ext}},
 * {@code {base}_1{ext}}, {@code {base}_2{ext}}, ...
 *
 * <p>The set of names already taken is owned by the caller and passed in;
 * the planner never keeps state of its own.  Callers add the returned name
 * to their set before planning the next file.
 */
public final class FilenamePlanner {

    private static final Logger logger = Logger.getLogger(
        FilenamePlanner.class.getName()
    );

    private FilenamePlanner() {
        // utility class
    }

    static String candidate(
        final String baseName,
        final String extension,
        final int index
    ) {
        if (index == 0) {
            return baseName + extension;
        }
        return baseName + "_" + index + extension;
    }

    /**
     * Preview mode: unique among {@code claimed}, without looking at the disk.
     *
     * @param baseName the derived base name, e.g. {@code 20210430_090000_Canon}
     * @param extension the extension to keep, with its dot, e.g. {@code .jpg}
     * @param claimed the names already taken in this batch; not modified
     * @return the first candidate name not in {@code claimed}
     */
    public static String planPreview(
        final String baseName,
        final String extension,
        final Set<String> claimed
    ) {
        int index = 0;
        String name = candidate(baseName, extension, index);
        while (claimed.contains(name)) {
            index++;
            name = candidate(baseName, extension, index);
        }
        return name;
    }

    /**
     * Execution mode: like {@link #planPreview}, but a candidate is also
     * rejected if a file of that name already exists in {@code directory}.
     * The folder may have changed since the preview was made.
     *
     * @param baseName the derived base name
     * @param extension the extension to keep, with its dot
     * @param directory the folder the file will be renamed in
     * @param claimed the names already taken in this run; not modified
     * @return the first candidate name that is neither claimed nor on disk
     */
    public static String planActual(
        final String baseName,
        final String extension,
        final Path directory,
        final Set<String> claimed
    ) {
        return planActual(baseName, extension, directory, claimed, null);
    }

    /**
     * Execution mode for a file that is itself in {@code directory}: its own
     * current name does not count as taken on disk, so a file that already
     * carries one of the candidate names keeps it.
     *
     * @param baseName the derived base name
     * @param extension the extension to keep, with its dot
     * @param directory the folder the file will be renamed in
     * @param claimed the names already taken in this run; not modified
     * @param ownName the file's current name, or null
     * @return the first candidate name that is neither claimed nor on disk
     */
    public static String planActual(
        final String baseName,
        final String extension,
        final Path directory,
        final Set<String> claimed,
        final String ownName
    ) {
        int index = 0;
        String name = candidate(baseName, extension, index);
        while (
            claimed.contains(name) ||
            (!name.equals(ownName) && Files.exists(directory.resolve(name)))
        ) {
            logger.finer("name taken: " + name);
            index++;
            name = candidate(baseName, extension, index);
        }
        return name;
    }

    /**
     * Plan a preview for a whole scan: one {@link RenamePlan} for each
     * successful outcome, in order, with names unique within the batch.
     *
     * @param outcomes the scan outcomes, in listing order
     * @param claimed the caller's set of taken names; each planned name is added
     * @return the plans; failed outcomes get none
     */
    public static List<RenamePlan> planBatch(
        final List<ExtractionOutcome> outcomes,
        final Set<String> claimed
    ) {
        List<RenamePlan> plans = new ArrayList<>();
        for (ExtractionOutcome outcome : outcomes) {
            if (!outcome.isSuccess()) {
                continue;
            }
            String baseName = outcome.getBaseName();
            String extension = outcome.getSource().getExtension();
            String target = planPreview(baseName, extension, claimed);
            claimed.add(target);
            plans.add(
                new RenamePlan(
                    outcome.getSource().getPath(),
                    target,
                    baseName,
                    extension
                )
            );
        }
        return plans;
    }

    /**
     * @param outcomes the scan outcomes, in listing order
     * @return the plans, planned against a fresh set of names
     */
    public static List<RenamePlan> planBatch(final List<ExtractionOutcome> outcomes) {
        return planBatch(outcomes, new HashSet<>());
    }
}
