// Generated code - Model: Auto (Cursor AI)
// Date: 2026-10-19
package org.img2book.error;

import java.nio.file.Path;

/**
 * Raised when a single image cannot be read or embedded.
 * The assembly loop treats this as recoverable and moves on to the next slot.
 */
public class ImageInsertException extends Img2BookException {
    private final Path path;

    public ImageInsertException(Path path, Throwable cause) {
        super("Failed to insert image " + path + (cause != null ? ": " + cause.getMessage() : ""), cause);
        this.path = path;
    }

    public ImageInsertException(Path path, String reason) {
        super("Failed to insert image " + path + ": " + reason);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
