package org.img2book.source;

import org.img2book.TestImages;
import org.img2book.error.ConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

class ImageFolderScannerTest {

    @TempDir
    Path tempDir;

    private Logger logger;

    @BeforeEach
    void setUp() {
        logger = Logger.getAnonymousLogger();
        logger.setLevel(Level.OFF);
    }

    @Test
    void testParseExtensions() {
        assertEquals(Set.of("png", "jpg", "webp"), ImageFolderScanner.parseExtensions("png, .jpg,WEBP"));
        assertEquals(Set.of("png"), ImageFolderScanner.parseExtensions(null));
        assertEquals(Set.of("png"), ImageFolderScanner.parseExtensions("  "));
        assertEquals(Set.of("png"), ImageFolderScanner.parseExtensions(", ,"));
    }

    @Test
    void testScanReturnsMatchingFilesSortedByName() throws IOException {
        TestImages.writePng(tempDir, "c.png", 2, 2);
        TestImages.writePng(tempDir, "a.PNG", 2, 2);
        TestImages.writeJpeg(tempDir, "b.jpg", 2, 2);
        Files.writeString(tempDir.resolve("notes.txt"), "not an image");
        Files.createDirectories(tempDir.resolve("nested.png"));

        ImageFolderScanner scanner = new ImageFolderScanner(Set.of("png"), logger);
        List<Path> files = scanner.scan(tempDir);

        assertEquals(2, files.size());
        assertEquals("a.PNG", files.get(0).getFileName().toString());
        assertEquals("c.png", files.get(1).getFileName().toString());
        assertTrue(files.get(0).isAbsolute());
    }

    @Test
    void testScanIsNotRecursive() throws IOException {
        Path sub = Files.createDirectories(tempDir.resolve("sub"));
        TestImages.writePng(sub, "deep.png", 2, 2);

        List<Path> files = new ImageFolderScanner(Set.of("png"), logger).scan(tempDir);

        assertTrue(files.isEmpty());
    }

    @Test
    void testScanWithSeveralExtensions() throws IOException {
        TestImages.writePng(tempDir, "a.png", 2, 2);
        TestImages.writeJpeg(tempDir, "b.jpg", 2, 2);

        ImageFolderScanner scanner = new ImageFolderScanner(ImageFolderScanner.parseExtensions("png,jpg"), logger);

        assertEquals(2, scanner.scan(tempDir).size());
    }

    @Test
    void testMissingFolderIsConfigurationError() {
        ImageFolderScanner scanner = new ImageFolderScanner(Set.of("png"), logger);

        assertThrows(ConfigurationException.class, () -> scanner.scan(tempDir.resolve("missing")));
    }

    @Test
    void testFileInsteadOfFolderIsConfigurationError() throws IOException {
        Path file = TestImages.writePng(tempDir, "a.png", 2, 2);
        ImageFolderScanner scanner = new ImageFolderScanner(Set.of("png"), logger);

        assertThrows(ConfigurationException.class, () -> scanner.scan(file));
    }
}
