package org.exifrenamer.controller.metadata;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.logging.Logger;
import org.exifrenamer.controller.DateTimeNormalizer;
import org.exifrenamer.controller.util.StringUtils;

/**
 * Reads the first Image File Directory of a TIFF-structured block and picks
 * out the capture time and camera.
 *
 * <p>Entries are scanned linearly in stored order: the first of DateTime
 * (306), DateTimeOriginal (36867) or DateTimeDigitized (36868) that
 * normalizes wins, with no priority between them.  Model (272) is preferred
 * over Make (271).  A field whose value lies outside the block is skipped;
 * the scan carries on with the next entry.
 */
public final class TiffIfdParser {

    private static final Logger logger = Logger.getLogger(
        TiffIfdParser.class.getName()
    );

    static final int TIFF_MAGIC = 42;

    static final int TAG_MAKE = 271;
    static final int TAG_MODEL = 272;
    static final int TAG_DATE_TIME = 306;
    static final int TAG_DATE_TIME_ORIGINAL = 36867;
    static final int TAG_DATE_TIME_DIGITIZED = 36868;

    private static final int HEADER_SIZE = 8;
    private static final int ENTRY_SIZE = 12;
    private static final int INLINE_VALUE_SIZE = 4;

    private TiffIfdParser() {
        // utility class
    }

    /**
     * Size in bytes of one value of the given TIFF field type.  Unknown types
     * are counted as single bytes.
     */
    static int typeSize(final int type) {
        switch (type) {
            case 3: // SHORT
            case 8: // SSHORT
                return 2;
            case 4: // LONG
            case 9: // SLONG
            case 11: // FLOAT
                return 4;
            case 5: // RATIONAL
            case 10: // SRATIONAL
            case 12: // DOUBLE
                return 8;
            default: // BYTE, ASCII, SBYTE, UNDEFINED
                return 1;
        }
    }

    /**
     * @param tiff the TIFF block, starting at its byte-order mark
     * @return what the first IFD holds; empty if the header is not valid TIFF
     */
    public static TagScan parse(final byte[] tiff) {
        if (tiff == null || tiff.length < HEADER_SIZE) {
            return TagScan.empty();
        }
        ByteBuffer buffer = ByteBuffer.wrap(tiff);
        if (tiff[0] == 'I' && tiff[1] == 'I') {
            buffer.order(ByteOrder.LITTLE_ENDIAN);
        } else if (tiff[0] == 'M' && tiff[1] == 'M') {
            buffer.order(ByteOrder.BIG_ENDIAN);
        } else {
            logger.finer("unknown TIFF byte order");
            return TagScan.empty();
        }
        if (Short.toUnsignedInt(buffer.getShort(2)) != TIFF_MAGIC) {
            logger.finer("TIFF magic number mismatch");
            return TagScan.empty();
        }
        long ifdOffset = Integer.toUnsignedLong(buffer.getInt(4));
        return parseIfd(buffer, ifdOffset);
    }

    private static TagScan parseIfd(final ByteBuffer buffer, final long offset) {
        int limit = buffer.limit();
        if (offset + 2 > limit) {
            return TagScan.empty();
        }
        int entryCount = Short.toUnsignedInt(buffer.getShort((int) offset));
        long entriesStart = offset + 2;

        String timestamp = null;
        String model = null;
        String make = null;

        for (int i = 0; i < entryCount; i++) {
            long entryOffset = entriesStart + (long) i * ENTRY_SIZE;
            if (entryOffset + ENTRY_SIZE > limit) {
                continue;
            }
            int entry = (int) entryOffset;
            int tagId = Short.toUnsignedInt(buffer.getShort(entry));

            boolean wanted;
            switch (tagId) {
                case TAG_DATE_TIME:
                case TAG_DATE_TIME_ORIGINAL:
                case TAG_DATE_TIME_DIGITIZED:
                    wanted = (timestamp == null);
                    break;
                case TAG_MODEL:
                    wanted = (model == null);
                    break;
                case TAG_MAKE:
                    wanted = (make == null);
                    break;
                default:
                    wanted = false;
            }
            if (!wanted) {
                continue;
            }

            byte[] value = readValue(buffer, entry);
            if (value == null) {
                logger.finer("value of tag " + tagId + " lies outside the TIFF block");
                continue;
            }
            String text = StringUtils.trimPadding(
                StringUtils.decodeUtf8Lenient(value)
            );

            if (tagId == TAG_MODEL) {
                text = StringUtils.removeSpaces(text);
                if (!text.isEmpty()) {
                    model = text;
                }
            } else if (tagId == TAG_MAKE) {
                text = StringUtils.removeSpaces(text);
                if (!text.isEmpty()) {
                    make = text;
                }
            } else if (
                TagSearch.isUsableTimestampText(text) &&
                DateTimeNormalizer.isUsable(text)
            ) {
                timestamp = text;
            }
        }

        return new TagScan(timestamp, (model != null) ? model : make);
    }

    /**
     * Resolve an entry's value: inline in the entry when it fits in four
     * bytes, otherwise at the offset the entry gives.
     *
     * @return the value bytes, or null if they lie outside the buffer
     */
    private static byte[] readValue(final ByteBuffer buffer, final int entry) {
        int type = Short.toUnsignedInt(buffer.getShort(entry + 2));
        long count = Integer.toUnsignedLong(buffer.getInt(entry + 4));
        long size = count * typeSize(type);

        long start;
        if (size <= INLINE_VALUE_SIZE) {
            start = entry + 8L;
        } else {
            start = Integer.toUnsignedLong(buffer.getInt(entry + 8));
        }
        if (start + size > buffer.limit()) {
            return null;
        }
        byte[] value = new byte[(int) size];
        for (int i = 0; i < value.length; i++) {
            value[i] = buffer.get((int) start + i);
        }
        return value;
    }
}
