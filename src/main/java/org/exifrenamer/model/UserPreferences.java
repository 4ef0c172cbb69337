package org.exifrenamer.model;

import static org.exifrenamer.model.util.Constants.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import org.exifrenamer.controller.util.StringUtils;

/**
 * Settings for one run of the application.  They live only in memory;
 * nothing is read from or written to a configuration file.
 */
public class UserPreferences {

    private static final UserPreferences INSTANCE = new UserPreferences();

    private final java.beans.PropertyChangeSupport pcs =
        new java.beans.PropertyChangeSupport(this);

    public void addPropertyChangeListener(
        java.beans.PropertyChangeListener listener
    ) {
        pcs.addPropertyChangeListener(listener);
    }

    public void removePropertyChangeListener(
        java.beans.PropertyChangeListener listener
    ) {
        pcs.removePropertyChangeListener(listener);
    }

    private final List<String> imageExtensions;
    private final List<String> gatedExtensions;
    private String defaultCameraModel;
    private int autoScanLimit;

    /**
     * UserPreferences constructor which uses the defaults from
     * {@link org.exifrenamer.model.util.Constants}
     */
    public UserPreferences() {
        imageExtensions = new ArrayList<>(DEFAULT_IMAGE_EXTENSIONS);
        gatedExtensions = new ArrayList<>(DEFAULT_GATED_EXTENSIONS);
        defaultCameraModel = DEFAULT_CAMERA_MODEL;
        autoScanLimit = DEFAULT_AUTO_SCAN_LIMIT;
    }

    /**
     * @return the singleton UserPreferences instance for this application
     */
    public static UserPreferences getInstance() {
        return INSTANCE;
    }

    private static String normalizeExtension(final String extension) {
        String ext = extension.trim().toLowerCase(Locale.ROOT);
        if (!ext.isEmpty() && ext.charAt(0) != '.') {
            ext = "." + ext;
        }
        return ext;
    }

    private static void replaceExtensions(
        final List<String> target,
        final List<String> extensions
    ) {
        target.clear();
        for (String ext : extensions) {
            if (ext == null || ext.isBlank()) {
                continue;
            }
            String normalized = normalizeExtension(ext);
            if (!target.contains(normalized)) {
                target.add(normalized);
            }
        }
    }

    /**
     * @return the extensions (lower case, with leading dot) that are picked
     *         up when a folder is selected
     */
    public List<String> getImageExtensions() {
        return Collections.unmodifiableList(imageExtensions);
    }

    public void setImageExtensions(final List<String> extensions) {
        List<String> old = new ArrayList<>(imageExtensions);
        replaceExtensions(imageExtensions, extensions);
        pcs.firePropertyChange("imageExtensions", old, getImageExtensions());
    }

    public boolean isImageExtension(final String extension) {
        return (extension != null) &&
            imageExtensions.contains(normalizeExtension(extension));
    }

    /**
     * @return the extensions of containers that need an optional decoder;
     *         the extraction engine asks the decodability oracle about these
     */
    public List<String> getGatedExtensions() {
        return Collections.unmodifiableList(gatedExtensions);
    }

    public void setGatedExtensions(final List<String> extensions) {
        List<String> old = new ArrayList<>(gatedExtensions);
        replaceExtensions(gatedExtensions, extensions);
        pcs.firePropertyChange("gatedExtensions", old, getGatedExtensions());
    }

    public boolean isGatedExtension(final String extension) {
        return (extension != null) &&
            gatedExtensions.contains(normalizeExtension(extension));
    }

    /**
     * @return the camera text used when neither Model nor Make is present
     */
    public String getDefaultCameraModel() {
        return defaultCameraModel;
    }

    public void setDefaultCameraModel(final String defaultCameraModel) {
        String old = this.defaultCameraModel;
        String value = StringUtils.sanitiseForFileName(
            StringUtils.removeSpaces(defaultCameraModel)
        );
        this.defaultCameraModel = value.isEmpty() ? DEFAULT_CAMERA_MODEL : value;
        pcs.firePropertyChange(
            "defaultCameraModel",
            old,
            this.defaultCameraModel
        );
    }

    /**
     * @return the largest folder that is scanned automatically once selected
     */
    public int getAutoScanLimit() {
        return autoScanLimit;
    }

    public void setAutoScanLimit(final int autoScanLimit) {
        int old = this.autoScanLimit;
        this.autoScanLimit = Math.max(0, autoScanLimit);
        pcs.firePropertyChange("autoScanLimit", old, this.autoScanLimit);
    }

    @Override
    public String toString() {
        return (
            "UserPreferences\n [imageExtensions=" +
            imageExtensions +
            ",\n  gatedExtensions=" +
            gatedExtensions +
            ",\n  defaultCameraModel=" +
            defaultCameraModel +
            ",\n  autoScanLimit=" +
            autoScanLimit +
            "]"
        );
    }
}
