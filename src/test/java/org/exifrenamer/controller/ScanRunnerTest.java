package org.exifrenamer.controller;

import static org.exifrenamer.controller.metadata.ExifTestData.*;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.exifrenamer.controller.metadata.ExifTestData;
import org.exifrenamer.model.CancellationToken;
import org.exifrenamer.model.ExtractionFailureKind;
import org.exifrenamer.model.ScanReport;
import org.exifrenamer.model.SourceFile;
import org.exifrenamer.model.UserPreferences;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class ScanRunnerTest {

    private static final Logger packageLogger = Logger.getLogger("org.exifrenamer");

    private final MetadataExtractor extractor = new MetadataExtractor(
        new UserPreferences(),
        ext -> true
    );

    @TempDir
    Path tempFolder;

    @BeforeAll
    public static void quietLogging() {
        packageLogger.setLevel(Level.SEVERE);
    }

    private List<SourceFile> threeFiles() throws IOException {
        Path a = new ExifTestData()
            .ascii(TAG_DATE_TIME_ORIGINAL, "2021:04:30 09:00:00")
            .writeJpeg(tempFolder.resolve("a.jpg"));
        Path b = Files.createFile(tempFolder.resolve("b.jpg"));
        Path c = new ExifTestData()
            .ascii(TAG_DATE_TIME_ORIGINAL, "2021:04:30 09:00:01")
            .writeJpeg(tempFolder.resolve("c.jpg"));
        return List.of(new SourceFile(a), new SourceFile(b), new SourceFile(c));
    }

    @Test
    public void testOneOutcomePerFileInOrder() throws IOException {
        List<SourceFile> files = threeFiles();
        List<String> events = new ArrayList<>();

        ScanRunner runner = new ScanRunner(files, extractor);
        runner.setUpdater((current, total) -> events.add(current + "/" + total));
        ScanReport report = runner.execute();

        assertFalse(report.cancelled());
        assertEquals(3, report.outcomes().size());
        for (int i = 0; i < files.size(); i++) {
            assertEquals(files.get(i), report.outcomes().get(i).getSource());
        }
        assertEquals(2L, report.successCount());
        assertEquals(1L, report.failureCount());
        assertEquals(
            ExtractionFailureKind.DECODE_OR_READ_ERROR,
            report.outcomes().get(1).getFailureKind()
        );
        assertEquals(List.of("1/3", "2/3", "3/3"), events);
    }

    @Test
    public void testCancelledBetweenFiles() throws IOException {
        CancellationToken token = new CancellationToken();
        ScanRunner runner = new ScanRunner(threeFiles(), extractor);
        runner.setCancellationToken(token);
        runner.setUpdater((current, total) -> {
            if (current == 2) {
                token.cancel();
            }
        });

        ScanReport report = runner.execute();

        assertTrue(report.cancelled());
        assertEquals(2, report.outcomes().size());
    }
}
