// Generated code - Model: Auto (Cursor AI)
// Date: 2026-10-19
package org.img2book.error;

/**
 * Base class for all errors raised while assembling a document.
 */
public abstract class Img2BookException extends RuntimeException {

    protected Img2BookException(String message) {
        super(message);
    }

    protected Img2BookException(String message, Throwable cause) {
        super(message, cause);
    }
}
