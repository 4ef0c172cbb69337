package org.exifrenamer.controller.metadata;

import static org.exifrenamer.controller.metadata.ExifTestData.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.ByteArrayInputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.exifrenamer.model.SourceFile;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class JpegExifScannerTest {

    private final JpegExifScanner scanner = new JpegExifScanner();

    @TempDir
    Path tempFolder;

    @BeforeAll
    public static void quietLogging() {
        Logger.getLogger(JpegExifScanner.class.getName()).setLevel(Level.SEVERE);
        Logger.getLogger(TiffIfdParser.class.getName()).setLevel(Level.SEVERE);
    }

    private TagScan scanBytes(final byte[] bytes)
        throws MetadataReadException, IOException
    {
        return scanner.scan(new DataInputStream(new ByteArrayInputStream(bytes)));
    }

    @Test
    public void testFindsExifAfterOtherApplicationSegments() throws Exception {
        byte[] jpeg = new ExifTestData()
            .withJfifSegment()
            .withXmpSegmentFirst()
            .ascii(TAG_MODEL, "Canon EOS 5D")
            .ascii(TAG_DATE_TIME_ORIGINAL, "2021:04:30 09:00:00")
            .jpeg();

        TagScan scan = scanBytes(jpeg);
        assertEquals("2021:04:30 09:00:00", scan.rawTimestamp());
        assertEquals("CanonEOS5D", scan.cameraModel());
    }

    @Test
    public void testNoExifSegment() throws Exception {
        assertEquals(TagScan.empty(), scanBytes(ExifTestData.jpegWithoutExif()));
    }

    @Test
    public void testNotAJpeg() {
        byte[] png = { (byte) 0x89, 'P', 'N', 'G', '\r', '\n', 0x1A, '\n' };
        assertThrows(MetadataReadException.class, () -> scanBytes(png));
    }

    @Test
    public void testTruncatedSegment() throws Exception {
        byte[] jpeg = new ExifTestData()
            .ascii(TAG_DATE_TIME, "2021:04:30 09:00:00")
            .jpeg();
        byte[] truncated = Arrays.copyOf(jpeg, 12);

        assertFalse(scanBytes(truncated).hasTimestamp());
    }

    @Test
    public void testStopsAtNonApplicationMarker() throws Exception {
        // SOI, then a start-of-frame marker before any APP1.
        byte[] jpeg = { (byte) 0xFF, (byte) 0xD8, (byte) 0xFF, (byte) 0xC0, 0, 2 };
        assertEquals(TagScan.empty(), scanBytes(jpeg));
    }

    @Test
    public void testScanFromFile() throws Exception {
        Path file = new ExifTestData()
            .littleEndian()
            .ascii(TAG_DATE_TIME, "2019:01:02 03:04:05")
            .writeJpeg(tempFolder.resolve("IMG_0001.JPG"));

        TagScan scan = scanner.scan(new ImageContext(new SourceFile(file)));
        assertEquals("2019:01:02 03:04:05", scan.rawTimestamp());
    }

    @Test
    public void testMissingFile() {
        ImageContext context = new ImageContext(
            new SourceFile(tempFolder.resolve("gone.jpg"))
        );
        assertThrows(MetadataReadException.class, () -> scanner.scan(context));
    }

    @Test
    public void testGarbageFile() throws IOException {
        Path file = Files.write(tempFolder.resolve("junk.jpg"), new byte[] { 1, 2, 3, 4 });
        ImageContext context = new ImageContext(new SourceFile(file));
        assertThrows(MetadataReadException.class, () -> scanner.scan(context));
    }
}
