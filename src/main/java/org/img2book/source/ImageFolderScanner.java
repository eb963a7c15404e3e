// Generated code - Model: Auto (Cursor AI)
// Date: 2026-10-19
package org.img2book.source;

import org.img2book.error.ConfigurationException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lists the image files of a folder (non-recursive) that match an extension filter.
 */
public class ImageFolderScanner {
    public static final String DEFAULT_EXTENSIONS = "png";

    private final Set<String> extensions;
    private final Logger logger;

    public ImageFolderScanner(Collection<String> extensions, Logger logger) {
        this.logger = logger;
        this.extensions = new LinkedHashSet<>();
        for (String extension : extensions) {
            String normalized = normalizeExtension(extension);
            if (!normalized.isEmpty()) {
                this.extensions.add(normalized);
            }
        }
        if (this.extensions.isEmpty()) {
            this.extensions.add(DEFAULT_EXTENSIONS);
        }
    }

    /**
     * Parses a comma-separated extension list such as "png, .jpg,WEBP".
     *
     * @param extensionList The raw list, may be null or blank
     * @return The extensions, lower-cased and without leading dots
     */
    public static Set<String> parseExtensions(String extensionList) {
        Set<String> result = new LinkedHashSet<>();
        if (extensionList == null || extensionList.trim().isEmpty()) {
            result.add(DEFAULT_EXTENSIONS);
            return result;
        }
        for (String part : extensionList.split(",")) {
            String normalized = normalizeExtension(part);
            if (!normalized.isEmpty()) {
                result.add(normalized);
            }
        }
        if (result.isEmpty()) {
            result.add(DEFAULT_EXTENSIONS);
        }
        return result;
    }

    /**
     * Returns all matching regular files directly inside the folder, as absolute paths sorted by file name.
     *
     * @param folder The folder to scan
     * @return The matching files, possibly empty
     */
    public List<Path> scan(Path folder) {
        if (folder == null || !Files.exists(folder)) {
            throw new ConfigurationException("Image folder not found: " + folder);
        }
        if (!Files.isDirectory(folder)) {
            throw new ConfigurationException("Image folder is not a directory: " + folder);
        }

        try (Stream<Path> entries = Files.list(folder)) {
            List<Path> files = entries
                .filter(Files::isRegularFile)
                .filter(this::matchesExtension)
                .map(p -> p.toAbsolutePath().normalize())
                .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                .collect(Collectors.toList());
            logger.info("Found " + files.size() + " image file(s) " + extensions + " in " + folder.toAbsolutePath());
            return files;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to list image folder " + folder + ": " + e.getMessage(), e);
        }
    }

    private boolean matchesExtension(Path file) {
        String name = file.getFileName().toString();
        int dotIndex = name.lastIndexOf('.');
        if (dotIndex <= 0 || dotIndex == name.length() - 1) {
            return false;
        }
        return extensions.contains(name.substring(dotIndex + 1).toLowerCase(Locale.ROOT));
    }

    private static String normalizeExtension(String extension) {
        if (extension == null) {
            return "";
        }
        String trimmed = extension.trim().toLowerCase(Locale.ROOT);
        while (trimmed.startsWith(".")) {
            trimmed = trimmed.substring(1);
        }
        return trimmed;
    }
}
