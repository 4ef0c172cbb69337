package org.exifrenamer.controller.metadata;

import static org.exifrenamer.controller.metadata.ExifTestData.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.util.logging.Level;
import java.util.logging.Logger;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

public class TiffIfdParserTest {

    @BeforeAll
    public static void quietLogging() {
        Logger.getLogger(TiffIfdParser.class.getName()).setLevel(Level.SEVERE);
    }

    @Test
    public void testBigEndian() {
        byte[] tiff = new ExifTestData()
            .ascii(TAG_MAKE, "Canon")
            .ascii(TAG_MODEL, "Canon EOS 5D")
            .ascii(TAG_DATE_TIME_ORIGINAL, "2021:04:30 09:00:00")
            .tiff();

        TagScan scan = TiffIfdParser.parse(tiff);
        assertEquals("2021:04:30 09:00:00", scan.rawTimestamp());
        assertEquals("CanonEOS5D", scan.cameraModel());
    }

    @Test
    public void testLittleEndian() {
        byte[] tiff = new ExifTestData()
            .littleEndian()
            .ascii(TAG_MODEL, "Pixel 7")
            .ascii(TAG_DATE_TIME, "2022:12:24 18:30:05")
            .tiff();

        TagScan scan = TiffIfdParser.parse(tiff);
        assertEquals("2022:12:24 18:30:05", scan.rawTimestamp());
        assertEquals("Pixel7", scan.cameraModel());
    }

    @Test
    public void testFirstTimestampInStoredOrderWins() {
        byte[] tiff = new ExifTestData()
            .ascii(TAG_DATE_TIME, "2021:05:01 10:00:00")
            .ascii(TAG_DATE_TIME_ORIGINAL, "2021:04:30 09:00:00")
            .tiff();

        assertEquals(
            "2021:05:01 10:00:00",
            TiffIfdParser.parse(tiff).rawTimestamp()
        );
    }

    @Test
    public void testUnreadableTimestampIsPassedOver() {
        byte[] tiff = new ExifTestData()
            .ascii(TAG_DATE_TIME, "0000:00:00 00:00:00")
            .ascii(TAG_DATE_TIME_ORIGINAL, "sometime last spring")
            .ascii(TAG_DATE_TIME_DIGITIZED, "2021:04:30 09:00:00")
            .tiff();

        assertEquals(
            "2021:04:30 09:00:00",
            TiffIfdParser.parse(tiff).rawTimestamp()
        );
    }

    @Test
    public void testMakeWhenNoModel() {
        byte[] tiff = new ExifTestData()
            .ascii(TAG_MAKE, "NIKON CORPORATION")
            .ascii(TAG_DATE_TIME, "2021:04:30 09:00:00")
            .tiff();

        assertEquals("NIKONCORPORATION", TiffIfdParser.parse(tiff).cameraModel());
    }

    @Test
    public void testInlineValue() {
        // Four bytes including the terminator fit in the entry itself.
        byte[] tiff = new ExifTestData().ascii(TAG_MODEL, "X10").tiff();

        TagScan scan = TiffIfdParser.parse(tiff);
        assertEquals("X10", scan.cameraModel());
        assertFalse(scan.hasTimestamp());
    }

    @Test
    public void testValueOutsideBlockIsSkipped() {
        byte[] tiff = new ExifTestData()
            .asciiOutOfBounds(TAG_DATE_TIME, 20)
            .ascii(TAG_DATE_TIME_ORIGINAL, "2021:04:30 09:00:00")
            .ascii(TAG_MODEL, "E-M1")
            .tiff();

        TagScan scan = TiffIfdParser.parse(tiff);
        assertEquals("2021:04:30 09:00:00", scan.rawTimestamp());
        assertEquals("E-M1", scan.cameraModel());
    }

    @Test
    public void testBadByteOrderMark() {
        byte[] tiff = new ExifTestData()
            .ascii(TAG_DATE_TIME, "2021:04:30 09:00:00")
            .tiff();
        tiff[0] = 'X';
        tiff[1] = 'X';

        assertEquals(TagScan.empty(), TiffIfdParser.parse(tiff));
    }

    @Test
    public void testBadMagicNumber() {
        byte[] tiff = new ExifTestData()
            .ascii(TAG_DATE_TIME, "2021:04:30 09:00:00")
            .tiff();
        tiff[3] = 43;

        TagScan scan = TiffIfdParser.parse(tiff);
        assertNull(scan.rawTimestamp());
        assertNull(scan.cameraModel());
    }

    @Test
    public void testTruncatedBlock() {
        assertEquals(TagScan.empty(), TiffIfdParser.parse(new byte[] { 'M', 'M', 0 }));
        assertEquals(TagScan.empty(), TiffIfdParser.parse(null));
    }

    @Test
    public void testTypeSizes() {
        assertEquals(1, TiffIfdParser.typeSize(2));
        assertEquals(2, TiffIfdParser.typeSize(3));
        assertEquals(4, TiffIfdParser.typeSize(4));
        assertEquals(8, TiffIfdParser.typeSize(5));
        assertEquals(1, TiffIfdParser.typeSize(99));
    }
}
