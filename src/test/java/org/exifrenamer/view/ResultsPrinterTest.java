package org.exifrenamer.view;

import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import org.exifrenamer.model.CanonicalTimestamp;
import org.exifrenamer.model.ExtractionFailureKind;
import org.exifrenamer.model.ExtractionOutcome;
import org.exifrenamer.model.RenameOutcome;
import org.exifrenamer.model.RenameReport;
import org.exifrenamer.model.SourceFile;
import org.junit.jupiter.api.Test;

public class ResultsPrinterTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final ResultsPrinter printer = new ResultsPrinter(
        new PrintStream(buffer, true, StandardCharsets.UTF_8)
    );

    private String printed() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    public void testPreview() {
        CanonicalTimestamp ts = CanonicalTimestamp.of("20210430_090000");
        List<ExtractionOutcome> outcomes = List.of(
            ExtractionOutcome.success(new SourceFile(Paths.get("/p/a.jpg")), ts, "Canon"),
            ExtractionOutcome.success(new SourceFile(Paths.get("/p/b.jpg")), ts, "Canon"),
            ExtractionOutcome.failure(
                new SourceFile(Paths.get("/p/c.jpg")),
                ExtractionFailureKind.NO_USABLE_TIMESTAMP
            )
        );

        printer.printPreview(outcomes);

        String text = printed();
        assertTrue(text.contains("20210430_090000_Canon.jpg"), text);
        assertTrue(text.contains("20210430_090000_Canon_1.jpg"), text);
        assertTrue(text.contains("NOEXIF_c.jpg"), text);
        assertTrue(text.contains("2 of 3 file(s) can be renamed"), text);
    }

    @Test
    public void testRenameReport() {
        Path source = Paths.get("/p/b.jpg");
        RenameReport report = new RenameReport(
            1,
            1,
            List.of(
                RenameOutcome.succeeded(Paths.get("/p/a.jpg"), Paths.get("/p/x.jpg")),
                RenameOutcome.failed(source, null, "source no longer exists")
            ),
            false
        );

        printer.printRenameReport(report);

        String text = printed();
        assertTrue(text.contains("FAILED b.jpg: source no longer exists"), text);
        assertTrue(text.contains("Renamed 1 file(s), 1 failure(s)"), text);
    }
}
