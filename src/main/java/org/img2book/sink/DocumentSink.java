// Generated code - Model: Auto (Cursor AI)
// Date: 2026-10-19
package org.img2book.sink;

import org.img2book.error.ImageInsertException;
import org.img2book.error.PersistException;

import java.nio.file.Path;

/**
 * An in-progress output document that images are appended to.
 * Implementations are single-writer: they are not thread-safe and the assembly engine is their only caller during a run.
 */
public interface DocumentSink extends AutoCloseable {

    /**
     * Makes sure the document has a position content can be appended at.
     * An entirely empty document gets a single empty block; otherwise nothing changes.
     */
    void ensureInsertionPoint();

    /**
     * Inserts an image at the current end of content, scaled to the given size and centred horizontally.
     *
     * @param imageFile The image to embed
     * @param width Target width in points
     * @param height Target height in points
     * @throws ImageInsertException if the file is malformed or unreadable; the document is left unchanged
     */
    void appendImage(Path imageFile, double width, double height) throws ImageInsertException;

    /**
     * Terminates the current page; the next appended content starts on a new page.
     */
    void appendPageBreak();

    /**
     * Inserts a plain block separator without breaking the page.
     */
    void appendSeparator();

    /**
     * Durably saves the current document state. Calling it twice without an intervening mutation rewrites the same content.
     *
     * @throws PersistException if the document cannot be written
     */
    void persist() throws PersistException;

    /**
     * @return Size in bytes of the last persisted state, or 0 if nothing was persisted yet
     */
    long sizeBytes();

    /**
     * @return Human-readable location of the backing store, for logs and summaries
     */
    String describe();

    /**
     * Releases the document. Does not persist.
     */
    @Override
    void close();
}
