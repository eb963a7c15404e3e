// Generated code - Model: Auto (Cursor AI)
// Date: 2026-10-19
package org.img2book.error;

/**
 * Raised when an image source is built from a pool with no images in it.
 */
public class EmptyPoolException extends Img2BookException {

    public EmptyPoolException(String message) {
        super(message);
    }
}
