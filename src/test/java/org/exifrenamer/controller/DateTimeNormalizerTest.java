package org.exifrenamer.controller;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;
import org.exifrenamer.model.CanonicalTimestamp;
import org.junit.jupiter.api.Test;

public class DateTimeNormalizerTest {

    private static void assertNormalizes(final String raw, final String expected) {
        Optional<CanonicalTimestamp> ts = DateTimeNormalizer.normalize(raw);
        assertTrue(ts.isPresent(), "failed to normalize \"" + raw + "\"");
        assertEquals(expected, ts.get().getValue(), "wrong value for \"" + raw + "\"");
    }

    private static void assertRejects(final String raw) {
        assertFalse(
            DateTimeNormalizer.normalize(raw).isPresent(),
            "should not have normalized \"" + raw + "\""
        );
    }

    @Test
    public void testExifLayout() {
        assertNormalizes("2021:04:30 09:00:00", "20210430_090000");
    }

    @Test
    public void testDashAndSlashLayouts() {
        assertNormalizes("2021-04-30 09:00:00", "20210430_090000");
        assertNormalizes("2021/04/30 23:59:58", "20210430_235958");
    }

    @Test
    public void testFractionalSeconds() {
        assertNormalizes("2021:04:30 09:00:00.5", "20210430_090000");
        assertNormalizes("2021-04-30 09:00:00.123456", "20210430_090000");
        assertNormalizes("2021/04/30 09:00:07.999999999", "20210430_090007");
    }

    @Test
    public void testIsoLayouts() {
        assertNormalizes("2021-04-30T09:00:00", "20210430_090000");
        // The zone designator is accepted, not applied.
        assertNormalizes("2021-04-30T09:00:00Z", "20210430_090000");
    }

    @Test
    public void testMissingSecondsDefaultToZero() {
        assertNormalizes("2021:04:30 09:15", "20210430_091500");
        assertNormalizes("2021-04-30 09:15", "20210430_091500");
        assertNormalizes("2021/04/30 09:15", "20210430_091500");
    }

    @Test
    public void testSurroundingWhitespace() {
        assertNormalizes("  2021:04:30 09:00:00 ", "20210430_090000");
    }

    @Test
    public void testPlaceholderAndBlank() {
        assertRejects("0000:00:00 00:00:00");
        assertRejects("");
        assertRejects("    ");
        assertRejects(null);
    }

    @Test
    public void testUnrecognized() {
        assertRejects("yesterday");
        assertRejects("30/04/2021 09:00:00");
        assertRejects("2021:04:30");
        assertRejects("2021:04:30 09:00:00 +02:00");
        assertRejects("2021.04.30 09:00:00");
    }

    @Test
    public void testImpossibleDates() {
        assertRejects("2021:02:30 10:00:00");
        assertRejects("2021:13:01 10:00:00");
        assertRejects("2021:04:30 24:00:00");
        assertRejects("12345:04:30 09:00:00");
    }

    @Test
    public void testIsUsable() {
        assertTrue(DateTimeNormalizer.isUsable("2021:04:30 09:00:00"));
        assertFalse(DateTimeNormalizer.isUsable("0000:00:00 00:00:00"));
    }

    @Test
    public void testCanonicalFormRoundTrips() {
        DateTimeFormatter canonical = DateTimeFormatter.ofPattern("uuuuMMdd_HHmmss");
        DateTimeFormatter exif = DateTimeFormatter.ofPattern("uuuu:MM:dd HH:mm:ss");
        for (String raw : List.of(
            "1999:12:31 23:59:59",
            "2000:02:29 00:00:00",
            "2021:04:30 09:00:00"
        )) {
            String value = DateTimeNormalizer.normalize(raw).orElseThrow().getValue();
            assertEquals(raw, LocalDateTime.parse(value, canonical).format(exif));
        }
    }
}
