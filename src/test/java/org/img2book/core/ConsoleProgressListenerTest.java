package org.img2book.core;

import org.img2book.error.ImageInsertException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleProgressListenerTest {

    private ByteArrayOutputStream outBytes;
    private ByteArrayOutputStream errBytes;
    private ConsoleProgressListener listener;

    @BeforeEach
    void setUp() {
        outBytes = new ByteArrayOutputStream();
        errBytes = new ByteArrayOutputStream();
        listener = new ConsoleProgressListener(new PrintStream(outBytes, true, StandardCharsets.UTF_8),
                new PrintStream(errBytes, true, StandardCharsets.UTF_8), "/out/generated.pdf");
    }

    private String out() {
        return outBytes.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testProgressLine() {
        listener.onProgress(new ProgressEvent(50, 50000, 1_234_567));

        assertEquals("Inserted 50 / 50000 ... File size: 1,234,567 bytes", out().trim());
    }

    @Test
    void testFailureGoesToErrorStream() {
        Path image = Path.of("/pool/broken.png");
        listener.onItemFailed(image, new ImageInsertException(image, new IOException("Unexpected EOF")));

        assertEquals("", out());
        assertTrue(errBytes.toString(StandardCharsets.UTF_8).contains("WARNING: Failed to insert broken.png: Unexpected EOF"));
    }

    @Test
    void testCompletedSummary() {
        listener.onSummary(new AssemblySummary(AssemblySummary.Outcome.COMPLETED, 5, 5, 4, 1, 1, 1, 4, 2048, 1500));

        String text = out();
        assertTrue(text.startsWith("Done. Inserted 4 images. Size: 2,048 bytes"));
        assertTrue(text.contains("Failed:    1"));
        assertTrue(text.contains("Duration:  1s 500ms"));
        assertTrue(text.contains("Saved:     /out/generated.pdf"));
        assertFalse(text.contains("Durable"));
    }

    @Test
    void testAbortedSummaryShowsDurableCount() {
        listener.onSummary(new AssemblySummary(AssemblySummary.Outcome.ABORTED, 10, 4, 4, 0, 0, 1, 2, 100, 10));

        String text = out();
        assertTrue(text.startsWith("ABORTED."));
        assertTrue(text.contains("Durable:   2"));
    }

    @Test
    void testReplacementAttemptsAreShownWhenTheyDiffer() {
        listener.onSummary(new AssemblySummary(AssemblySummary.Outcome.CANCELLED, 10, 3, 3, 0, 2, 1, 3, 100, 10));

        String text = out();
        assertTrue(text.startsWith("Cancelled."));
        assertTrue(text.contains("Failed:    0 (2 failed attempts)"));
    }
}
