// Generated code - Model: Auto (Cursor AI)
// Date: 2026-10-19
package org.img2book.pdf;

import org.apache.pdfbox.io.MemoryUsageSetting;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.img2book.layout.PageGeometry;
import org.img2book.log.LoggerFactory;
import org.img2book.util.TemplateEngine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.Logger;

/**
 * Opens the named output PDF the assembly loop writes into: resolves its location, creates the output
 * directory, and either starts a new document or reopens an existing one for appending.
 */
public class PdfDocumentBootstrap {
    public static final String DEFAULT_FILENAME = "generated";
    public static final long DEFAULT_MAX_MAIN_MEMORY_MB = 64;

    private final Logger logger;

    public PdfDocumentBootstrap(Logger logger) {
        this.logger = logger;
    }

    /**
     * Resolves the output file inside the output directory, sanitizing the name and adding ".pdf" when missing.
     */
    public static Path resolveOutputFile(Path outputDir, String fileName) {
        String name = fileName == null || fileName.trim().isEmpty() ? DEFAULT_FILENAME : fileName;
        String sanitized = LoggerFactory.sanitizeFilename(name);
        return outputDir.resolve(TemplateEngine.ensureExtension(sanitized, ".pdf"));
    }

    /**
     * Maps a memory mode name to a PDFBox memory setting.
     *
     * @param mode "main", "mixed" or "tempfile" (case-insensitive); anything else means "mixed"
     * @param maxMainMemoryMb Main-memory budget for "mixed", in megabytes
     */
    public static MemoryUsageSetting memoryUsage(String mode, long maxMainMemoryMb) {
        String normalized = mode == null ? "mixed" : mode.trim().toLowerCase(Locale.ROOT);
        long budget = (maxMainMemoryMb > 0 ? maxMainMemoryMb : DEFAULT_MAX_MAIN_MEMORY_MB) * 1024L * 1024L;
        switch (normalized) {
            case "main":
                return MemoryUsageSetting.setupMainMemoryOnly();
            case "tempfile":
                return MemoryUsageSetting.setupTempFileOnly();
            default:
                return MemoryUsageSetting.setupMixed(budget);
        }
    }

    /**
     * Opens the output document.
     *
     * @param outputFile Target PDF file
     * @param geometry Page size and margins for new pages
     * @param appendExisting Reopen the file if it exists instead of starting over
     * @param memoryUsage PDFBox memory setting for the document
     * @param separatorSpacing Vertical gap used by separators, in points
     * @return A sink ready for {@link PdfDocumentSink#ensureInsertionPoint()}
     * @throws IOException If the output directory cannot be created or the existing file cannot be read
     */
    public PdfDocumentSink open(Path outputFile, PageGeometry geometry, boolean appendExisting,
                                MemoryUsageSetting memoryUsage, float separatorSpacing) throws IOException {
        Path parent = outputFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        PDDocument document;
        if (Files.isRegularFile(outputFile) && appendExisting) {
            document = PDDocument.load(outputFile.toFile(), memoryUsage);
            logger.info("Reopened existing PDF for appending: " + outputFile.toAbsolutePath()
                    + " (" + document.getNumberOfPages() + " page(s))");
        } else {
            if (Files.isRegularFile(outputFile)) {
                logger.warning("Output file exists and will be replaced at the first checkpoint: " + outputFile.toAbsolutePath());
            }
            document = new PDDocument(memoryUsage);
            logger.info("Created new PDF document: " + outputFile.toAbsolutePath());
        }

        return new PdfDocumentSink(document, outputFile, geometry, separatorSpacing, logger);
    }
}
