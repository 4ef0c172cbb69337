package org.exifrenamer.controller.metadata;

import static org.exifrenamer.controller.metadata.TagSearch.*;

import com.drew.metadata.Directory;
import com.drew.metadata.Metadata;
import com.drew.metadata.Tag;
import com.drew.metadata.exif.ExifDirectoryBase;
import com.drew.metadata.xmp.XmpDirectory;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Flattens decoded metadata into {@link TagEntry} lists, by tag number or by
 * tag name.
 */
final class ExifEntries {

    private static final Map<Integer, String> EXIF_TAG_NAMES = Map.of(
        ExifDirectoryBase.TAG_DATETIME_ORIGINAL, DATE_TIME_ORIGINAL,
        ExifDirectoryBase.TAG_DATETIME, DATE_TIME,
        ExifDirectoryBase.TAG_DATETIME_DIGITIZED, DATE_TIME_DIGITIZED,
        ExifDirectoryBase.TAG_MODEL, MODEL,
        ExifDirectoryBase.TAG_MAKE, MAKE
    );

    private static final Map<String, String> XMP_PROPERTY_NAMES = Map.of(
        "xmp:CreateDate", CREATE_DATE,
        "xmp:ModifyDate", MODIFY_DATE
    );

    // Names as the decoder reports them, in any directory type.
    private static final Map<String, String> DISPLAY_TAG_NAMES = Map.of(
        "Date/Time Original", DATE_TIME_ORIGINAL,
        "Date/Time", DATE_TIME,
        "Date/Time Digitized", DATE_TIME_DIGITIZED,
        "Create Date", CREATE_DATE,
        "Modify Date", MODIFY_DATE,
        "Model", MODEL,
        "Make", MAKE
    );

    private ExifEntries() {
        // utility class
    }

    /**
     * Entries from the EXIF directories, matched by tag number, plus the XMP
     * creation and modification dates.
     */
    static List<TagEntry> byTagNumber(final Metadata metadata) {
        List<TagEntry> entries = new ArrayList<>();
        for (Directory directory : metadata.getDirectories()) {
            if (directory instanceof ExifDirectoryBase) {
                for (Tag tag : directory.getTags()) {
                    String name = EXIF_TAG_NAMES.get(tag.getTagType());
                    if (name != null) {
                        entries.add(
                            new TagEntry(name, directory.getObject(tag.getTagType()))
                        );
                    }
                }
            } else if (directory instanceof XmpDirectory) {
                Map<String, String> properties =
                    ((XmpDirectory) directory).getXmpProperties();
                for (Map.Entry<String, String> property : properties.entrySet()) {
                    String name = XMP_PROPERTY_NAMES.get(property.getKey());
                    if (name != null) {
                        entries.add(new TagEntry(name, property.getValue()));
                    }
                }
            }
        }
        return entries;
    }

    /**
     * Entries from every directory, whatever its type, matched by the tag's
     * reported name.
     */
    static List<TagEntry> byTagName(final Metadata metadata) {
        List<TagEntry> entries = new ArrayList<>();
        for (Directory directory : metadata.getDirectories()) {
            for (Tag tag : directory.getTags()) {
                String name = DISPLAY_TAG_NAMES.get(tag.getTagName());
                if (name != null) {
                    entries.add(
                        new TagEntry(name, directory.getObject(tag.getTagType()))
                    );
                }
            }
        }
        return entries;
    }
}
