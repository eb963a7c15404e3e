// Generated code - Model: Auto (Cursor AI)
// Date: 2026-10-19
package org.img2book.layout;

import org.img2book.error.InvalidGeometryException;

/**
 * Computes the size of an inserted image so that it spans the content width with its aspect ratio preserved.
 */
public final class LayoutEngine {

    private LayoutEngine() {
    }

    /**
     * @param intrinsicWidth Image width in pixels
     * @param intrinsicHeight Image height in pixels
     * @param contentWidth Available content width in points
     * @return The scaled size, whose width is always the content width
     * @throws InvalidGeometryException if any argument is not strictly positive
     */
    public static ScaledSize fitToWidth(double intrinsicWidth, double intrinsicHeight, double contentWidth) {
        if (!(contentWidth > 0)) {
            throw new InvalidGeometryException("Content width must be > 0 but was " + contentWidth);
        }
        if (!(intrinsicWidth > 0) || !(intrinsicHeight > 0)) {
            throw new InvalidGeometryException("Image dimensions must be > 0 but were "
                    + intrinsicWidth + "x" + intrinsicHeight);
        }
        double scale = contentWidth / intrinsicWidth;
        return new ScaledSize(contentWidth, intrinsicHeight * scale);
    }
}
