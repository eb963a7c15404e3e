// Generated code - Model: Auto (Cursor AI)
// Date: 2026-10-19
package org.img2book;

import org.img2book.core.AssemblyJob;
import org.img2book.core.AssemblySummary;
import org.img2book.core.JobSettings;
import org.img2book.error.AssemblyAbortedException;
import org.img2book.log.LoggerFactory;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Main application entry point.
 */
public class Img2BookApp {
    static final String GLOBAL_CONFIG_FILE = "img2book.properties";
    private static final long SHUTDOWN_WAIT_MS = 60_000;

    // java.util.logging only keeps weak references to configured loggers
    private static final List<Logger> LIBRARY_LOGGERS = new ArrayList<>();

    private final PrintStream out;
    private final PrintStream err;
    private volatile AssemblyJob currentJob;
    private volatile boolean shutdownRequested;

    public Img2BookApp(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        // PDFBox must not scan system fonts; no text is drawn
        System.setProperty("java.awt.headless", "true");
        System.setProperty("org.apache.pdfbox.forceSystemFontScan", "false");
        System.setProperty("pdfbox.fontcache", "false");

        Path configFile = Paths.get(args.length > 0 ? args[0] : GLOBAL_CONFIG_FILE);

        Img2BookApp app = new Img2BookApp(System.out, System.err);
        Runtime.getRuntime().addShutdownHook(new Thread(app::cancelRunningJob, "img2book-shutdown"));

        int exitCode = app.run(configFile);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    /**
     * Processes every job listed in the global configuration, one after the other.
     *
     * @param configFile The global properties file
     * @return 0 when every job completed, 1 otherwise
     */
    public int run(Path configFile) {
        out.println("=======================================");
        out.println("Img2Book - Image to PDF Page Assembler");
        out.println("=======================================");

        Properties globalProps = loadGlobalConfig(configFile);
        if (globalProps == null) {
            err.println("ERROR: Failed to load " + configFile);
            err.println("Please ensure " + configFile + " exists and is readable.");
            return 1;
        }

        configureLibraryLogLevels(globalProps);

        List<Path> jobConfigPaths = collectJobConfigPaths(globalProps);
        if (jobConfigPaths.isEmpty()) {
            err.println("ERROR: No job configuration files found in " + configFile);
            err.println("Please add at least one job.config.N property.");
            return 1;
        }

        out.println("Found " + jobConfigPaths.size() + " job configuration(s)");

        int successCount = 0;
        int failureCount = 0;

        for (int i = 0; i < jobConfigPaths.size(); i++) {
            Path jobConfigPath = jobConfigPaths.get(i);
            if (shutdownRequested) {
                int remaining = jobConfigPaths.size() - i;
                err.println("Shutdown requested - not starting the remaining " + remaining + " job(s)");
                failureCount += remaining;
                break;
            }

            out.println("\nProcessing job: " + jobConfigPath);

            if (!Files.isRegularFile(jobConfigPath)) {
                err.println("ERROR: Job config file not found: " + jobConfigPath.toAbsolutePath());
                failureCount++;
                continue;
            }

            try {
                AssemblyJob job = new AssemblyJob(JobSettings.load(jobConfigPath, globalProps), globalProps);
                currentJob = job;
                AssemblySummary summary = job.run();
                if (summary.getOutcome() == AssemblySummary.Outcome.COMPLETED) {
                    successCount++;
                    out.println("Completed: " + jobConfigPath);
                } else {
                    failureCount++;
                    out.println("Cancelled: " + jobConfigPath + " (" + summary.getInsertedCount() + " image(s) saved)");
                }
            } catch (AssemblyAbortedException e) {
                err.println("ERROR: Job " + jobConfigPath + " aborted: " + e.getMessage());
                err.println("  The document holds the " + e.getSummary().getDurableInsertedCount()
                        + " image(s) of the last successful checkpoint.");
                failureCount++;
            } catch (Exception e) {
                err.println("ERROR: Failed to process " + jobConfigPath + ": " + e.getMessage());
                failureCount++;
            } finally {
                currentJob = null;
            }
        }

        out.println("\n===================================");
        out.println("Processing Summary:");
        out.println("  Success: " + successCount);
        out.println("  Failed:  " + failureCount);
        out.println("===================================");

        return failureCount == 0 ? 0 : 1;
    }

    /**
     * Cancels the job in progress, if any, and waits for it to save and stop. No further job is started afterwards.
     */
    void cancelRunningJob() {
        shutdownRequested = true;
        AssemblyJob job = currentJob;
        if (job == null) {
            return;
        }
        err.println("\nInterrupted - saving progress...");
        job.cancel();
        try {
            if (!job.awaitCompletion(SHUTDOWN_WAIT_MS)) {
                err.println("WARNING: Job did not stop within " + (SHUTDOWN_WAIT_MS / 1000) + "s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    static Properties loadGlobalConfig(Path configFile) {
        if (!Files.isRegularFile(configFile)) {
            return null;
        }

        Properties props = new Properties();
        try (FileInputStream fis = new FileInputStream(configFile.toFile())) {
            props.load(fis);
            return props;
        } catch (IOException e) {
            System.err.println("Error reading " + configFile + ": " + e.getMessage());
            return null;
        }
    }

    static List<Path> collectJobConfigPaths(Properties globalProps) {
        List<Path> paths = new ArrayList<>();

        // Look for job.config.1, job.config.2, etc.
        int index = 1;
        while (true) {
            String value = globalProps.getProperty("job.config." + index);
            if (value == null || value.trim().isEmpty()) {
                break;
            }
            paths.add(Paths.get(value.trim()));
            index++;
        }

        return paths;
    }

    /**
     * Sets PDFBox and FontBox log levels from the pdfbox.log.level property (default: WARNING).
     */
    private static void configureLibraryLogLevels(Properties globalProps) {
        Level level = LoggerFactory.parseLogLevel(globalProps.getProperty("pdfbox.log.level"), Level.WARNING);
        for (String name : new String[] {"org.apache.pdfbox", "org.apache.fontbox"}) {
            Logger logger = Logger.getLogger(name);
            logger.setLevel(level);
            LIBRARY_LOGGERS.add(logger);
        }
    }
}
