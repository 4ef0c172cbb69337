package org.exifrenamer.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A planned rename: which file, the name it should get, and the base name and
 * extension the name was derived from.  The target name is unique among the
 * names claimed in the batch at planning time; the executor re-checks it
 * against the disk.
 */
public record RenamePlan(
    Path source,
    String targetName,
    String baseName,
    String extension
) {
    public RenamePlan {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(targetName, "targetName");
        Objects.requireNonNull(baseName, "baseName");
        Objects.requireNonNull(extension, "extension");
    }

    public Path directory() {
        Path parent = source.toAbsolutePath().getParent();
        if (parent == null) {
            throw new IllegalStateException("no parent directory: " + source);
        }
        return parent;
    }
}
