// Generated code - Model: Auto (Cursor AI)
// Date: 2026-10-19
package org.img2book.layout;

/**
 * Target width and height of an inserted image, in points.
 */
public final class ScaledSize {
    private final double width;
    private final double height;

    public ScaledSize(double width, double height) {
        this.width = width;
        this.height = height;
    }

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    @Override
    public String toString() {
        return String.format(java.util.Locale.ROOT, "%.2fx%.2f", width, height);
    }
}
