// Generated code - Model: Auto (Cursor AI)
// Date: 2026-10-19
package org.img2book.error;

/**
 * Raised when a content width or an image dimension is not strictly positive.
 */
public class InvalidGeometryException extends Img2BookException {

    public InvalidGeometryException(String message) {
        super(message);
    }
}
