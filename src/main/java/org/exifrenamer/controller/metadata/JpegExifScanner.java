package org.exifrenamer.controller.metadata;

import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.logging.Logger;

/**
 * Stage 5: walks the marker segments of a JPEG by hand and parses the EXIF
 * block of the first APP1 segment that carries one.
 *
 * <p>Only application segments (APP0 to APP15) are stepped over; any other
 * marker, or running out of bytes, ends the walk without a result.  Files
 * that do not start with the start-of-image marker are not attempted.
 */
public class JpegExifScanner implements ExtractionStrategy {

    private static final Logger logger = Logger.getLogger(
        JpegExifScanner.class.getName()
    );

    static final int MARKER_PREFIX = 0xFF;
    static final int START_OF_IMAGE = 0xD8;
    static final int APP0 = 0xE0;
    static final int APP1 = 0xE1;
    static final int APP15 = 0xEF;

    static final byte[] EXIF_SIGNATURE = { 'E', 'x', 'i', 'f', 0, 0 };

    @Override
    public String getName() {
        return "jpeg-binary-scan";
    }

    @Override
    public TagScan scan(final ImageContext context) throws MetadataReadException {
        try (
            InputStream in = Files.newInputStream(context.getPath());
            DataInputStream data = new DataInputStream(new BufferedInputStream(in))
        ) {
            return scan(data);
        } catch (IOException ioe) {
            throw new MetadataReadException(
                "could not read " + context.getPath(),
                ioe
            );
        }
    }

    /**
     * @param data the file content, positioned at its first byte
     * @return the EXIF contents; empty if there is no EXIF APP1 segment
     * @throws MetadataReadException if the data is not a JPEG
     * @throws IOException if reading fails for a reason other than end of data
     */
    TagScan scan(final DataInputStream data)
        throws MetadataReadException, IOException
    {
        int first = data.read();
        int second = data.read();
        if (first != MARKER_PREFIX || second != START_OF_IMAGE) {
            throw new MetadataReadException("no start-of-image marker");
        }

        try {
            while (true) {
                int prefix = data.read();
                int type = data.read();
                if (prefix < 0 || type < 0 || prefix != MARKER_PREFIX) {
                    return TagScan.empty();
                }
                if (type == APP1) {
                    int payloadLength = data.readUnsignedShort() - 2;
                    if (payloadLength < 0) {
                        return TagScan.empty();
                    }
                    byte[] payload = new byte[payloadLength];
                    data.readFully(payload);
                    if (startsWithExifSignature(payload)) {
                        return TiffIfdParser.parse(
                            Arrays.copyOfRange(
                                payload,
                                EXIF_SIGNATURE.length,
                                payload.length
                            )
                        );
                    }
                    // APP1 is also used for XMP; keep walking.
                } else if (type >= APP0 && type <= APP15) {
                    int skip = data.readUnsignedShort() - 2;
                    if (skip < 0) {
                        return TagScan.empty();
                    }
                    data.skipNBytes(skip);
                } else {
                    logger.finer(
                        "stopping at marker 0x" + Integer.toHexString(type)
                    );
                    return TagScan.empty();
                }
            }
        } catch (EOFException eof) {
            logger.finer("ran out of data while walking segments");
            return TagScan.empty();
        }
    }

    private static boolean startsWithExifSignature(final byte[] payload) {
        if (payload.length < EXIF_SIGNATURE.length) {
            return false;
        }
        for (int i = 0; i < EXIF_SIGNATURE.length; i++) {
            if (payload[i] != EXIF_SIGNATURE[i]) {
                return false;
            }
        }
        return true;
    }
}
