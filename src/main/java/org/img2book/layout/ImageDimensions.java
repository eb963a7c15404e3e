// Generated code - Model: Auto (Cursor AI)
// Date: 2026-10-19
package org.img2book.layout;

/**
 * Intrinsic pixel size of a source image.
 */
public final class ImageDimensions {
    private final int width;
    private final int height;

    public ImageDimensions(int width, int height) {
        this.width = width;
        this.height = height;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
