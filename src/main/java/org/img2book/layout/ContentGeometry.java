// Generated code - Model: Auto (Cursor AI)
// Date: 2026-10-19
package org.img2book.layout;

/**
 * Space available for content on a page once margins are removed, in points.
 * A content height of zero or less means the height is unconstrained.
 * The width is not validated here: the assembly engine checks it before the first insertion.
 */
public final class ContentGeometry {
    private final double contentWidth;
    private final double contentHeight;

    public ContentGeometry(double contentWidth, double contentHeight) {
        this.contentWidth = contentWidth;
        this.contentHeight = contentHeight;
    }

    public static ContentGeometry widthOnly(double contentWidth) {
        return new ContentGeometry(contentWidth, 0);
    }

    public double getContentWidth() {
        return contentWidth;
    }

    public double getContentHeight() {
        return contentHeight;
    }

    public boolean isHeightConstrained() {
        return contentHeight > 0;
    }

    @Override
    public String toString() {
        return "ContentGeometry{" +
                "contentWidth=" + contentWidth +
                ", contentHeight=" + (isHeightConstrained() ? String.valueOf(contentHeight) : "unconstrained") +
                '}';
    }
}
