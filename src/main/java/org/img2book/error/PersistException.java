// Generated code - Model: Auto (Cursor AI)
// Date: 2026-10-19
package org.img2book.error;

/**
 * Raised when the document cannot be saved to its backing store.
 */
public class PersistException extends Img2BookException {

    public PersistException(String message, Throwable cause) {
        super(message, cause);
    }
}
