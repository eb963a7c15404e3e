package org.img2book.core;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.img2book.TestImages;
import org.img2book.error.EmptyPoolException;
import org.img2book.error.InvalidGeometryException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class AssemblyJobTest {

    @TempDir
    Path tempDir;

    private Path imageDir;
    private Path outputDir;

    @BeforeEach
    void setUp() throws IOException {
        imageDir = Files.createDirectories(tempDir.resolve("images"));
        outputDir = tempDir.resolve("out");
    }

    private Properties jobProps(int targetCount) {
        Properties props = new Properties();
        props.setProperty("image.dir", imageDir.toString());
        props.setProperty("target.count", String.valueOf(targetCount));
        props.setProperty("checkpoint.batch.size", "2");
        props.setProperty("output.dir", outputDir.toString());
        props.setProperty("pdf.memory.mode", "main");
        return props;
    }

    @Test
    void testBuildsPdfWithOnePagePerImage() throws IOException, InterruptedException {
        TestImages.writePng(imageDir, "a.png", 60, 40);
        TestImages.writePng(imageDir, "b.png", 40, 60);

        AssemblyJob job = new AssemblyJob(JobSettings.from("cycle", jobProps(5), null), new Properties());
        AssemblySummary summary = job.run();

        assertEquals(AssemblySummary.Outcome.COMPLETED, summary.getOutcome());
        assertEquals(5, summary.getInsertedCount());
        assertEquals(3, summary.getCheckpointCount());

        Path pdf = outputDir.resolve("generated.pdf");
        assertEquals(Files.size(pdf), summary.getSizeBytes());
        try (PDDocument document = PDDocument.load(pdf.toFile())) {
            assertEquals(5, document.getNumberOfPages());
        }
        assertTrue(Files.isRegularFile(outputDir.resolve("cycle.log")));
        assertTrue(job.awaitCompletion(0));
    }

    @Test
    void testCorruptFilesAreSkipped() throws IOException {
        TestImages.writePng(imageDir, "a.png", 20, 20);
        TestImages.writeGarbage(imageDir, "b.png");

        AssemblySummary summary = new AssemblyJob(JobSettings.from("skip", jobProps(5), null), null).run();

        assertEquals(AssemblySummary.Outcome.COMPLETED, summary.getOutcome());
        assertEquals(3, summary.getInsertedCount());
        assertEquals(2, summary.getFailedCount());
        try (PDDocument document = PDDocument.load(outputDir.resolve("generated.pdf").toFile())) {
            assertEquals(3, document.getNumberOfPages());
        }
    }

    @Test
    void testReplacePolicyFillsEverySlot() throws IOException {
        TestImages.writePng(imageDir, "a.png", 20, 20);
        TestImages.writeGarbage(imageDir, "b.png");
        Properties props = jobProps(4);
        props.setProperty("failure.policy", "replace");

        AssemblySummary summary = new AssemblyJob(JobSettings.from("replace", props, null), null).run();

        assertEquals(4, summary.getInsertedCount());
        assertEquals(0, summary.getFailedCount());
        assertTrue(summary.getFailedAttempts() > 0);
    }

    @Test
    void testSeparatorModeAndFilenameTemplate() throws IOException {
        TestImages.writePng(imageDir, "a.png", 200, 20);
        Properties props = jobProps(3);
        props.setProperty("page.break.per.image", "false");
        props.setProperty("output.filename.template", "${folder}-${count}");

        AssemblySummary summary = new AssemblyJob(JobSettings.from("strip", props, null), null).run();

        assertEquals(3, summary.getInsertedCount());
        try (PDDocument document = PDDocument.load(outputDir.resolve("images-3.pdf").toFile())) {
            assertEquals(1, document.getNumberOfPages());
        }
    }

    @Test
    void testEmptyFolderFailsBeforeCreatingDocument() {
        AssemblyJob job = new AssemblyJob(JobSettings.from("empty", jobProps(5), null), null);

        assertThrows(EmptyPoolException.class, job::run);
        assertFalse(Files.exists(outputDir.resolve("generated.pdf")));
    }

    @Test
    void testMarginsWiderThanPageFailWithoutWriting() throws IOException {
        TestImages.writePng(imageDir, "a.png", 20, 20);
        Properties props = jobProps(5);
        props.setProperty("page.margin.left.cm", "15");
        props.setProperty("page.margin.right.cm", "15");

        AssemblyJob job = new AssemblyJob(JobSettings.from("narrow", props, null), null);

        assertThrows(InvalidGeometryException.class, job::run);
        assertFalse(Files.exists(outputDir.resolve("generated.pdf")));
    }

    @Test
    void testCancelledBeforeStartSavesEmptyDocument() throws IOException {
        TestImages.writePng(imageDir, "a.png", 20, 20);
        AssemblyJob job = new AssemblyJob(JobSettings.from("cancel", jobProps(100), null), null);
        job.cancel();

        AssemblySummary summary = job.run();

        assertEquals(AssemblySummary.Outcome.CANCELLED, summary.getOutcome());
        assertEquals(0, summary.getInsertedCount());
        assertTrue(Files.isRegularFile(outputDir.resolve("generated.pdf")));
    }

    @Test
    void testAppendExistingGrowsPreviousOutput() throws IOException {
        TestImages.writePng(imageDir, "a.png", 20, 20);
        Properties props = jobProps(2);
        props.setProperty("output.append.existing", "true");

        new AssemblyJob(JobSettings.from("append", props, null), null).run();
        new AssemblyJob(JobSettings.from("append", props, null), null).run();

        try (PDDocument document = PDDocument.load(outputDir.resolve("generated.pdf").toFile())) {
            assertEquals(4, document.getNumberOfPages());
        }
    }
}
