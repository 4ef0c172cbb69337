package org.exifrenamer.model;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import org.exifrenamer.controller.util.StringUtils;

/**
 * An image file found in the selected folder.
 *
 * <p>Immutable once discovered.  The extension keeps the case it has on disk,
 * because that is what goes into the new file name; matching against known
 * containers uses {@link #getMatchExtension()}.
 */
public final class SourceFile {

    private final Path path;
    private final String baseName;
    private final String extension;

    public SourceFile(final Path path) {
        Objects.requireNonNull(path, "path");
        this.path = path.toAbsolutePath().normalize();
        Path fileName = this.path.getFileName();
        String name = (fileName == null) ? "" : fileName.toString();
        this.baseName = StringUtils.getBaseName(name);
        this.extension = StringUtils.getExtension(name);
    }

    public Path getPath() {
        return path;
    }

    public Path getDirectory() {
        return path.getParent();
    }

    /**
     * @return the full file name, e.g. {@code IMG_0001.JPG}
     */
    public String getFileName() {
        return baseName + extension;
    }

    /**
     * @return the file name without its extension, e.g. {@code IMG_0001}
     */
    public String getBaseName() {
        return baseName;
    }

    /**
     * @return the extension including the leading dot, in its original case;
     *         empty if the file has none
     */
    public String getExtension() {
        return extension;
    }

    public String getMatchExtension() {
        return extension.toLowerCase(Locale.ROOT);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof SourceFile)) {
            return false;
        }
        return path.equals(((SourceFile) other).path);
    }

    @Override
    public int hashCode() {
        return path.hashCode();
    }

    @Override
    public String toString() {
        return "SourceFile [" + path + "]";
    }
}
