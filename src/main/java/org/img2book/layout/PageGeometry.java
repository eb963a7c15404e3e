// Generated code - Model: Auto (Cursor AI)
// Date: 2026-10-19
package org.img2book.layout;

import org.img2book.error.ConfigurationException;

import java.util.Locale;

/**
 * Page size and margins, in points (72 points = 1 inch).
 * Computed once before a run; the content geometry derived from it is what the layout uses.
 */
public final class PageGeometry {
    private static final double POINTS_PER_INCH = 72.0;
    private static final double MM_PER_INCH = 25.4;

    public static final double DEFAULT_MARGIN_CM = 2.0;

    private final double pageWidth;
    private final double pageHeight;
    private final double marginTop;
    private final double marginBottom;
    private final double marginLeft;
    private final double marginRight;

    public PageGeometry(double pageWidth, double pageHeight,
                        double marginTop, double marginBottom, double marginLeft, double marginRight) {
        this.pageWidth = pageWidth;
        this.pageHeight = pageHeight;
        this.marginTop = marginTop;
        this.marginBottom = marginBottom;
        this.marginLeft = marginLeft;
        this.marginRight = marginRight;
    }

    /**
     * A4 portrait with 2 cm margins on every side.
     */
    public static PageGeometry a4WithDefaultMargins() {
        return named("A4", DEFAULT_MARGIN_CM, DEFAULT_MARGIN_CM, DEFAULT_MARGIN_CM, DEFAULT_MARGIN_CM);
    }

    /**
     * Builds a geometry from a named paper size and margins given in centimetres.
     *
     * @param paperSize A3, A4, A5, LETTER or LEGAL (case-insensitive)
     */
    public static PageGeometry named(String paperSize, double topCm, double bottomCm, double leftCm, double rightCm) {
        String size = paperSize == null ? "A4" : paperSize.trim().toUpperCase(Locale.ROOT);
        double width;
        double height;
        switch (size) {
            case "A3":
                width = mmToPoints(297);
                height = mmToPoints(420);
                break;
            case "A4":
                width = mmToPoints(210);
                height = mmToPoints(297);
                break;
            case "A5":
                width = mmToPoints(148);
                height = mmToPoints(210);
                break;
            case "LETTER":
                width = 8.5 * POINTS_PER_INCH;
                height = 11 * POINTS_PER_INCH;
                break;
            case "LEGAL":
                width = 8.5 * POINTS_PER_INCH;
                height = 14 * POINTS_PER_INCH;
                break;
            default:
                throw new ConfigurationException("Unknown page size: " + paperSize + " (expected A3, A4, A5, LETTER or LEGAL)");
        }
        return new PageGeometry(width, height,
                cmToPoints(topCm), cmToPoints(bottomCm), cmToPoints(leftCm), cmToPoints(rightCm));
    }

    public static double cmToPoints(double cm) {
        return cm * 10 / MM_PER_INCH * POINTS_PER_INCH;
    }

    public static double mmToPoints(double mm) {
        return mm / MM_PER_INCH * POINTS_PER_INCH;
    }

    /**
     * @return Page size minus margins. Either value may be zero or negative when margins exceed the page.
     */
    public ContentGeometry contentGeometry() {
        return new ContentGeometry(pageWidth - marginLeft - marginRight, pageHeight - marginTop - marginBottom);
    }

    public double getPageWidth() {
        return pageWidth;
    }

    public double getPageHeight() {
        return pageHeight;
    }

    public double getMarginTop() {
        return marginTop;
    }

    public double getMarginBottom() {
        return marginBottom;
    }

    public double getMarginLeft() {
        return marginLeft;
    }

    public double getMarginRight() {
        return marginRight;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%.1fx%.1fpt (margins t=%.1f b=%.1f l=%.1f r=%.1f)",
                pageWidth, pageHeight, marginTop, marginBottom, marginLeft, marginRight);
    }
}
