// Generated code - Model: Auto (Cursor AI)
// Date: 2026-10-19
package org.img2book.util;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Simple template engine for replacing placeholders in output file names.
 */
public class TemplateEngine {
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    /**
     * Applies the output filename template by replacing placeholders.
     * 
     * @param template The template string with ${count}, ${folder}, ${date} placeholders
     * @param targetCount Number of images requested for the document
     * @param folderName Name of the image folder
     * @param date Date to substitute for ${date}
     * @return The template with placeholders replaced
     */
    public static String applyFilenameTemplate(String template, int targetCount, String folderName, LocalDate date) {
        String result = template == null ? "" : template;
        result = result.replace("${count}", String.valueOf(targetCount));
        result = result.replace("${folder}", folderName == null ? "" : folderName);
        result = result.replace("${date}", date.format(DATE_FORMAT));
        return result;
    }

    /**
     * Appends the extension unless the name already ends with it (case-insensitive).
     */
    public static String ensureExtension(String fileName, String extension) {
        String dotted = extension.startsWith(".") ? extension : "." + extension;
        if (fileName.toLowerCase(java.util.Locale.ROOT).endsWith(dotted.toLowerCase(java.util.Locale.ROOT))) {
            return fileName;
        }
        return fileName + dotted;
    }
}
