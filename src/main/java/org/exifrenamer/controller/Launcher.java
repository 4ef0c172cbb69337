package org.exifrenamer.controller;

import static org.exifrenamer.model.util.Constants.*;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.logging.FileHandler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;
import org.exifrenamer.model.RenameReport;
import org.exifrenamer.model.ScanReport;
import org.exifrenamer.model.SourceFile;
import org.exifrenamer.model.UserPreferences;
import org.exifrenamer.view.ConsoleBatchListener;
import org.exifrenamer.view.ResultsPrinter;

/**
 * Command-line entry point.
 *
 * <pre>
 *   exifrenamer FOLDER [--dry-run] [--yes]
 * </pre>
 *
 * Logging strategy:
 * - Primary configuration comes from {@code /logging.properties}.
 * - A file log ({@code exifrenamer.log}) in the temp directory is added only
 *   when {@code -Dexifrenamer.debug=true} is set, or a fatal error occurs.
 */
public class Launcher {

    private static final Logger logger = Logger.getLogger(
        Launcher.class.getName()
    );

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_RENAME_FAILURES = 2;

    private static final String DRY_RUN_FLAG = "--dry-run";
    private static final String ASSUME_YES_FLAG = "--yes";

    private static volatile FileHandler fileHandler;

    static void initializeLoggingConfig() {
        try (
            InputStream in = Launcher.class.getResourceAsStream(
                LOGGING_PROPERTIES
            )
        ) {
            if (in == null) {
                logger.warning(
                    "logging.properties not found on classpath; using default JDK logging configuration."
                );
                return;
            }
            LogManager.getLogManager().readConfiguration(in);
        } catch (IOException | SecurityException e) {
            System.err.println("Failed to load logging configuration: " + e);
            logger.log(Level.WARNING, "Failed to load logging configuration", e);
        }
    }

    private static boolean isDebugEnabled() {
        return Boolean.parseBoolean(System.getProperty(DEBUG_PROPERTY, "false"));
    }

    private static Path resolveLogFilePath() {
        return Paths.get(System.getProperty("java.io.tmpdir", "."))
            .toAbsolutePath()
            .normalize()
            .resolve(LOG_FILENAME);
    }

    private static synchronized void ensureFileLoggingAttached() {
        if (fileHandler != null) {
            return;
        }
        Path logPath = resolveLogFilePath();
        try {
            // Overwrite each run (append=false)
            fileHandler = new FileHandler(logPath.toString(), false);
            fileHandler.setFormatter(new SimpleFormatter());
            fileHandler.setLevel(Level.ALL);
            Logger.getLogger("").addHandler(fileHandler);
            logger.info("File logging enabled: " + logPath);
        } catch (IOException ioe) {
            System.err.println(
                "Could not create log file at " + logPath + ": " + ioe.getMessage()
            );
        }
    }

    private static String stackTraceToString(Throwable t) {
        StringWriter sw = new StringWriter(4096);
        PrintWriter pw = new PrintWriter(sw);
        t.printStackTrace(pw);
        pw.flush();
        return sw.toString();
    }

    private static void logFatal(String context, Throwable t) {
        ensureFileLoggingAttached();

        logger.severe("FATAL: " + context);
        logger.severe(
            APPLICATION_NAME + " " + VERSION_NUMBER + ", Java " +
                System.getProperty("java.version") + ", " +
                System.getProperty("os.name")
        );
        logger.severe(stackTraceToString(t));
    }

    private static boolean confirm(final String question, final boolean assumeYes)
        throws IOException
    {
        if (assumeYes) {
            return true;
        }
        System.out.print(question + " [y/N] ");
        System.out.flush();
        BufferedReader in = new BufferedReader(
            new InputStreamReader(System.in, StandardCharsets.UTF_8)
        );
        String answer = in.readLine();
        return (answer != null) &&
            answer.trim().toLowerCase(Locale.ROOT).startsWith("y");
    }

    private static void usage() {
        System.err.println(
            "usage: exifrenamer FOLDER [" + DRY_RUN_FLAG + "] [" + ASSUME_YES_FLAG + "]"
        );
    }

    /**
     * Run one folder through scan, preview and (unless a dry run) rename.
     *
     * @return the process exit status
     */
    static int run(final String[] args, final UserPreferences prefs)
        throws IOException, InterruptedException, ExecutionException
    {
        Path folder = null;
        boolean dryRun = false;
        boolean assumeYes = false;
        for (String arg : args) {
            if (DRY_RUN_FLAG.equals(arg)) {
                dryRun = true;
            } else if (ASSUME_YES_FLAG.equals(arg)) {
                assumeYes = true;
            } else if (folder == null && !arg.startsWith("--")) {
                folder = Paths.get(arg);
            } else {
                usage();
                return EXIT_USAGE;
            }
        }
        if (folder == null) {
            usage();
            return EXIT_USAGE;
        }

        BatchSession session = new BatchSession(
            prefs,
            new ConsoleBatchListener(System.out)
        );
        try {
            List<SourceFile> files = session.selectFolder(folder);
            if (files.isEmpty()) {
                System.out.println("No image files in " + folder);
                return EXIT_OK;
            }
            if (
                files.size() > prefs.getAutoScanLimit() &&
                !confirm("Analyze " + files.size() + " files?", assumeYes)
            ) {
                return EXIT_OK;
            }

            ScanReport scan = session.startScan().get();
            ResultsPrinter printer = new ResultsPrinter(System.out);
            printer.printPreview(scan.outcomes());

            if (dryRun || scan.successCount() == 0) {
                return EXIT_OK;
            }
            if (!confirm("Rename " + scan.successCount() + " files?", assumeYes)) {
                return EXIT_OK;
            }

            RenameReport report = session.startRename().get();
            printer.printRenameReport(report);
            return (report.failureCount() > 0) ? EXIT_RENAME_FAILURES : EXIT_OK;
        } finally {
            session.shutDown();
        }
    }

    public static void main(String[] args) {
        initializeLoggingConfig();

        if (isDebugEnabled()) {
            ensureFileLoggingAttached();
            logger.info("Debug enabled via -D" + DEBUG_PROPERTY + "=true");
        }

        Thread.setDefaultUncaughtExceptionHandler((thread, throwable) ->
            logFatal("Uncaught exception in thread " + thread.getName(), throwable)
        );

        int status;
        try {
            logger.fine("=== " + APPLICATION_NAME + " " + VERSION_NUMBER + " ===");
            status = run(args, UserPreferences.getInstance());
        } catch (IOException ioe) {
            System.err.println(ioe.getMessage());
            logger.log(Level.FINE, "I/O failure", ioe);
            status = EXIT_USAGE;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            status = EXIT_USAGE;
        } catch (Throwable t) {
            logFatal("Exception in main()", t);
            status = EXIT_USAGE;
        }

        FileHandler handler = fileHandler;
        if (handler != null) {
            handler.close();
        }
        System.exit(status);
    }
}
