// Generated code - Model: Auto (Cursor AI)
// Date: 2026-10-19
package org.img2book.core;

import org.apache.pdfbox.io.MemoryUsageSetting;
import org.img2book.layout.ContentGeometry;
import org.img2book.layout.ImageDimensionReader;
import org.img2book.log.BatchModeScope;
import org.img2book.log.LoggerFactory;
import org.img2book.pdf.PdfDocumentBootstrap;
import org.img2book.pdf.PdfDocumentSink;
import org.img2book.source.ImageFolderScanner;
import org.img2book.source.ImageSource;
import org.img2book.util.TemplateEngine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Handles the processing of a single job configuration: scans the image folder, opens the output PDF
 * and runs the assembly loop over it.
 */
public class AssemblyJob {
    private final JobSettings settings;
    private final Properties globalProps;
    private final CountDownLatch finished = new CountDownLatch(1);

    private volatile AssemblyEngine engine;
    private volatile boolean cancelRequested;

    public AssemblyJob(JobSettings settings, Properties globalProps) {
        this.settings = settings;
        this.globalProps = globalProps != null ? globalProps : new Properties();
    }

    /**
     * Runs the job.
     *
     * @return Summary of the completed or cancelled run
     * @throws IOException If the output directory or document cannot be prepared
     * @throws org.img2book.error.Img2BookException For an empty pool, bad geometry or a fatal persist failure
     */
    public AssemblySummary run() throws IOException {
        Logger logger = null;
        try {
            Files.createDirectories(settings.getOutputDir());
            Files.createDirectories(settings.getLogDir());

            String loggerName = "img2book." + LoggerFactory.sanitizeFilename(settings.getJobName());
            logger = LoggerFactory.createFileLogger(loggerName, settings.getLogDir(), settings.getJobName(), globalProps);

            logger.info("Starting job: " + settings.getJobName());
            for (String warning : settings.getWarnings()) {
                logger.warning(warning);
            }

            return assemble(logger);
        } catch (IOException | RuntimeException e) {
            if (logger != null) {
                logger.log(Level.SEVERE, "Job " + settings.getJobName() + " failed: " + e.getMessage(), e);
            }
            throw e;
        } finally {
            if (logger != null) {
                LoggerFactory.closeHandlers(logger);
            }
            finished.countDown();
        }
    }

    /**
     * Requests cooperative cancellation; the running loop stops before its next slot and saves.
     */
    public void cancel() {
        cancelRequested = true;
        AssemblyEngine current = engine;
        if (current != null) {
            current.cancel();
        }
    }

    /**
     * Waits until {@link #run()} has returned or thrown.
     *
     * @return true if the job finished within the timeout
     */
    public boolean awaitCompletion(long timeoutMs) throws InterruptedException {
        return finished.await(timeoutMs, TimeUnit.MILLISECONDS);
    }

    private AssemblySummary assemble(Logger logger) throws IOException {
        ImageFolderScanner scanner = new ImageFolderScanner(settings.getImageExtensions(), logger);
        List<Path> pool = scanner.scan(settings.getImageDir());
        ImageSource source = new ImageSource(pool);

        ContentGeometry geometry = settings.getPageGeometry().contentGeometry();
        logger.info("Page geometry: " + settings.getPageGeometry());

        String fileName = TemplateEngine.applyFilenameTemplate(settings.getOutputFilenameTemplate(),
                settings.getTargetCount(), folderName(settings.getImageDir()), LocalDate.now());
        Path outputFile = PdfDocumentBootstrap.resolveOutputFile(settings.getOutputDir(), fileName);

        MemoryUsageSetting memoryUsage = PdfDocumentBootstrap.memoryUsage(
                settings.getPdfMemoryMode(), settings.getPdfMaxMainMemoryMb());
        Level libraryLevel = LoggerFactory.parseLogLevel(globalProps.getProperty("pdfbox.log.level"), Level.WARNING);

        PdfDocumentBootstrap bootstrap = new PdfDocumentBootstrap(logger);
        AssemblyOptions options = settings.toAssemblyOptions(source.size());

        try (BatchModeScope batchMode = BatchModeScope.enter(libraryLevel);
             PdfDocumentSink sink = bootstrap.open(outputFile, settings.getPageGeometry(),
                     settings.isAppendExisting(), memoryUsage, settings.getSeparatorSpacing());
             AsyncProgressNotifier notifier = new AsyncProgressNotifier(
                     new ConsoleProgressListener(sink.describe()), logger)) {

            AssemblyEngine current = new AssemblyEngine(sink, new ImageDimensionReader(), notifier, logger);
            engine = current;
            if (cancelRequested) {
                current.cancel();
            }

            System.out.println("Inserting " + options.getTargetCount() + " image(s) from " + source.size()
                    + " file(s) into " + sink.describe());
            AssemblySummary summary = current.run(source, geometry, options);
            logger.info("PDF contains " + sink.getPageCount() + " page(s)");
            return summary;
        } finally {
            engine = null;
        }
    }

    private static String folderName(Path folder) {
        Path name = folder.toAbsolutePath().normalize().getFileName();
        return name != null ? name.toString() : "images";
    }
}
