// Generated code - Model: Auto (Cursor AI)
// Date: 2026-10-19
package org.img2book.util;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

/**
 * Formatting helpers for console and log output.
 */
public final class Formats {

    private Formats() {
    }

    /**
     * Formats a byte count with thousands separators, e.g. 1234567 -> "1,234,567".
     */
    public static String formatBytes(long bytes) {
        DecimalFormat format = new DecimalFormat("#,##0", DecimalFormatSymbols.getInstance(Locale.ROOT));
        return format.format(bytes);
    }

    /**
     * Formats a duration in milliseconds to a human-readable string.
     * Only displays non-zero units (hours, minutes, seconds, milliseconds).
     * 
     * @param durationMs Duration in milliseconds
     * @return Formatted string (e.g., "1h 23m 45s 123ms" or "45s 123ms" or "123ms")
     */
    public static String formatDuration(long durationMs) {
        if (durationMs <= 0) {
            return "0ms";
        }

        long hours = durationMs / 3_600_000;
        long minutes = (durationMs % 3_600_000) / 60_000;
        long seconds = (durationMs % 60_000) / 1_000;
        long milliseconds = durationMs % 1_000;

        StringBuilder sb = new StringBuilder();
        appendUnit(sb, hours, "h");
        appendUnit(sb, minutes, "m");
        appendUnit(sb, seconds, "s");
        appendUnit(sb, milliseconds, "ms");
        return sb.toString();
    }

    private static void appendUnit(StringBuilder sb, long value, String unit) {
        if (value <= 0) {
            return;
        }
        if (sb.length() > 0) {
            sb.append(' ');
        }
        sb.append(value).append(unit);
    }
}
