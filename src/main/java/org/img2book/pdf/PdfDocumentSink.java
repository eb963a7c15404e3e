// Generated code - Model: Auto (Cursor AI)
// Date: 2026-10-19
package org.img2book.pdf;

import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.img2book.error.ImageInsertException;
import org.img2book.error.PersistException;
import org.img2book.layout.PageGeometry;
import org.img2book.sink.DocumentSink;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.imageio.ImageIO;

/**
 * PDF-backed document sink.
 * Content flows top-down from the top margin. Each image is centred in the content box; an image that does not fit
 * in what is left of the current page starts a new one, and an image taller than a whole content area gets a page
 * stretched vertically to hold it (page width is kept).
 */
public class PdfDocumentSink implements DocumentSink {
    public static final float DEFAULT_SEPARATOR_SPACING = 12f;

    private final PDDocument document;
    private final Path targetFile;
    private final Logger logger;

    private final float pageWidth;
    private final float pageHeight;
    private final float marginTop;
    private final float marginBottom;
    private final float marginLeft;
    private final float contentWidth;
    private final float separatorSpacing;

    // Current page state; currentPage is null after a page break until something is appended
    private PDPage currentPage;
    private float cursorY;
    private boolean currentPageHasContent;

    private long persistedSize;
    private int imagesAppended;

    public PdfDocumentSink(PDDocument document, Path targetFile, PageGeometry geometry,
                           float separatorSpacing, Logger logger) {
        this.document = document;
        this.targetFile = targetFile;
        this.logger = logger;
        this.pageWidth = (float) geometry.getPageWidth();
        this.pageHeight = (float) geometry.getPageHeight();
        this.marginTop = (float) geometry.getMarginTop();
        this.marginBottom = (float) geometry.getMarginBottom();
        this.marginLeft = (float) geometry.getMarginLeft();
        this.contentWidth = (float) geometry.contentGeometry().getContentWidth();
        this.separatorSpacing = separatorSpacing > 0 ? separatorSpacing : DEFAULT_SEPARATOR_SPACING;
        this.persistedSize = existingSize(targetFile);
    }

    @Override
    public void ensureInsertionPoint() {
        if (document.getNumberOfPages() == 0) {
            startNewPage(0f);
            logger.fine("Empty document - created first page as insertion point");
        }
    }

    @Override
    public void appendImage(Path imageFile, double width, double height) {
        // Load first so a bad file leaves the page layout untouched
        PDImageXObject pdImage = loadImage(imageFile);

        float scaledWidth = (float) width;
        float scaledHeight = (float) height;

        // Layout state to roll back to if drawing fails
        PDPage previousPage = currentPage;
        float previousCursorY = cursorY;
        boolean previousHasContent = currentPageHasContent;
        PDRectangle previousMediaBox = currentPage != null ? currentPage.getMediaBox() : null;
        COSBase previousContents = currentPage != null ? currentPage.getCOSObject().getItem(COSName.CONTENTS) : null;

        if (currentPage == null) {
            startNewPage(scaledHeight);
        } else if (currentPageHasContent && cursorY - scaledHeight < marginBottom) {
            startNewPage(scaledHeight);
        } else if (!currentPageHasContent && cursorY - scaledHeight < marginBottom) {
            stretchCurrentPage(scaledHeight);
        }

        float x = marginLeft + (contentWidth - scaledWidth) / 2f;
        float y = cursorY - scaledHeight;

        try {
            drawImage(currentPage, pdImage, x, y, scaledWidth, scaledHeight);
        } catch (IOException | RuntimeException e) {
            if (currentPage != previousPage) {
                document.removePage(currentPage);
            } else {
                currentPage.setMediaBox(previousMediaBox);
                currentPage.getCOSObject().setItem(COSName.CONTENTS, previousContents);
            }
            currentPage = previousPage;
            cursorY = previousCursorY;
            currentPageHasContent = previousHasContent;
            throw new ImageInsertException(imageFile, e);
        }

        cursorY = y;
        currentPageHasContent = true;
        imagesAppended++;

        if (logger.isLoggable(Level.FINEST)) {
            logger.finest("Drew " + imageFile.getFileName() + " at (" + x + ", " + y + ") size "
                    + scaledWidth + "x" + scaledHeight + " on page " + document.getNumberOfPages());
        }
    }

    /**
     * Draws the image on the page with its lower-left corner at (x, y).
     */
    void drawImage(PDPage page, PDImageXObject image, float x, float y, float width, float height) throws IOException {
        try (PDPageContentStream contentStream = new PDPageContentStream(
                document, page, PDPageContentStream.AppendMode.APPEND, true)) {
            contentStream.drawImage(image, x, y, width, height);
        }
    }

    @Override
    public void appendPageBreak() {
        currentPage = null;
        currentPageHasContent = false;
    }

    @Override
    public void appendSeparator() {
        if (currentPage == null) {
            startNewPage(0f);
        }
        cursorY -= separatorSpacing;
        currentPageHasContent = true;
        if (cursorY <= marginBottom) {
            appendPageBreak();
        }
    }

    @Override
    public void persist() {
        Path tempFile = targetFile.resolveSibling(targetFile.getFileName() + ".tmp");
        try {
            Path parent = targetFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }

            document.save(tempFile.toFile());
            moveIntoPlace(tempFile);

            persistedSize = Files.size(targetFile);
            logger.fine("Saved " + document.getNumberOfPages() + " page(s) to " + targetFile.toAbsolutePath()
                    + " (" + persistedSize + " bytes)");
        } catch (IOException | RuntimeException e) {
            deleteTempFile(tempFile);
            throw new PersistException("Failed to save PDF to " + targetFile.toAbsolutePath() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public long sizeBytes() {
        return persistedSize;
    }

    @Override
    public String describe() {
        return targetFile.toAbsolutePath().toString();
    }

    @Override
    public void close() {
        try {
            document.close();
        } catch (IOException e) {
            logger.warning("Failed to close PDF document " + targetFile + ": " + e.getMessage());
        }
    }

    public int getPageCount() {
        return document.getNumberOfPages();
    }

    public int getImagesAppended() {
        return imagesAppended;
    }

    /**
     * Adds a page tall enough for content of the given height and moves the cursor to its top margin.
     */
    private void startNewPage(float requiredContentHeight) {
        float height = Math.max(pageHeight, requiredContentHeight + marginTop + marginBottom);
        PDPage page = new PDPage(new PDRectangle(pageWidth, height));
        document.addPage(page);
        currentPage = page;
        cursorY = height - marginTop;
        currentPageHasContent = false;
    }

    /**
     * Grows the (still empty) current page so that content of the given height fits below the top margin.
     */
    private void stretchCurrentPage(float requiredContentHeight) {
        float height = Math.max(pageHeight, requiredContentHeight + marginTop + marginBottom);
        currentPage.setMediaBox(new PDRectangle(pageWidth, height));
        cursorY = height - marginTop;
        logger.fine("Stretched page " + document.getNumberOfPages() + " to " + height + " points for an oversized image");
    }

    private PDImageXObject loadImage(Path imageFile) {
        if (!Files.isRegularFile(imageFile)) {
            throw new ImageInsertException(imageFile, "file not found");
        }
        try {
            return PDImageXObject.createFromFileByContent(imageFile.toFile(), document);
        } catch (IllegalArgumentException e) {
            // Not a type PDFBox embeds directly (e.g. WebP) - decode through ImageIO instead
            return decodeWithImageIO(imageFile, e);
        } catch (IOException | RuntimeException e) {
            throw new ImageInsertException(imageFile, e);
        }
    }

    private PDImageXObject decodeWithImageIO(Path imageFile, IllegalArgumentException unsupported) {
        try {
            BufferedImage image = ImageIO.read(imageFile.toFile());
            if (image == null) {
                throw new ImageInsertException(imageFile, unsupported);
            }
            logger.finest("Embedding " + imageFile.getFileName() + " through ImageIO (" + unsupported.getMessage() + ")");
            return LosslessFactory.createFromImage(document, image);
        } catch (ImageInsertException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new ImageInsertException(imageFile, e);
        }
    }

    private void moveIntoPlace(Path tempFile) throws IOException {
        try {
            Files.move(tempFile, targetFile, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            logger.fine("Atomic move not supported for " + targetFile + ", falling back to replace");
            Files.move(tempFile, targetFile, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void deleteTempFile(Path tempFile) {
        try {
            Files.deleteIfExists(tempFile);
        } catch (IOException e) {
            logger.warning("Failed to delete temporary file " + tempFile + ": " + e.getMessage());
        }
    }

    private long existingSize(Path file) {
        try {
            return Files.isRegularFile(file) ? Files.size(file) : 0L;
        } catch (IOException e) {
            logger.warning("Cannot read size of " + file + ": " + e.getMessage());
            return 0L;
        }
    }
}
