package org.img2book.core;

import org.img2book.error.ConfigurationException;
import org.img2book.layout.PageGeometry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class JobSettingsTest {

    @TempDir
    Path tempDir;

    private static Properties jobProps() {
        Properties props = new Properties();
        props.setProperty("image.dir", "images");
        props.setProperty("target.count", "500");
        return props;
    }

    @Test
    void testDefaults() {
        JobSettings settings = JobSettings.from("sample", jobProps(), new Properties());

        assertEquals("sample", settings.getJobName());
        assertEquals(Paths.get("images"), settings.getImageDir());
        assertEquals(500, settings.getTargetCount());
        assertEquals(CheckpointPolicy.DEFAULT_BATCH_SIZE, settings.getCheckpointBatchSize());
        assertTrue(settings.isPageBreakPerImage());
        assertEquals(Set.of("png"), settings.getImageExtensions());
        assertEquals(FailurePolicy.SKIP, settings.getFailurePolicy());
        assertEquals(Paths.get("output"), settings.getOutputDir());
        assertEquals(Paths.get("output"), settings.getLogDir());
        assertEquals("generated", settings.getOutputFilenameTemplate());
        assertFalse(settings.isAppendExisting());
        assertEquals("mixed", settings.getPdfMemoryMode());
        assertEquals(PageGeometry.a4WithDefaultMargins().getPageWidth(), settings.getPageGeometry().getPageWidth(), 1e-9);
        assertTrue(settings.getWarnings().isEmpty());
    }

    @Test
    void testGlobalDefaultsApplyWhenJobIsSilent() {
        Properties global = new Properties();
        global.setProperty("default.checkpoint.batch.size", "25");
        global.setProperty("default.output.dir", "out");
        global.setProperty("default.page.size", "LETTER");
        global.setProperty("default.failure.policy", "replace");

        JobSettings settings = JobSettings.from("sample", jobProps(), global);

        assertEquals(25, settings.getCheckpointBatchSize());
        assertEquals(Paths.get("out"), settings.getOutputDir());
        assertEquals(612.0, settings.getPageGeometry().getPageWidth(), 1e-9);
        assertEquals(FailurePolicy.REPLACE, settings.getFailurePolicy());
    }

    @Test
    void testJobValuesOverrideGlobalDefaults() {
        Properties global = new Properties();
        global.setProperty("default.checkpoint.batch.size", "25");
        Properties job = jobProps();
        job.setProperty("checkpoint.batch.size", "10");
        job.setProperty("page.break.per.image", "false");
        job.setProperty("page.margin.cm", "1");
        job.setProperty("page.margin.left.cm", "3");

        JobSettings settings = JobSettings.from("sample", job, global);

        assertEquals(10, settings.getCheckpointBatchSize());
        assertFalse(settings.isPageBreakPerImage());
        assertEquals(PageGeometry.cmToPoints(1), settings.getPageGeometry().getMarginTop(), 1e-9);
        assertEquals(PageGeometry.cmToPoints(3), settings.getPageGeometry().getMarginLeft(), 1e-9);
    }

    @Test
    void testMissingMandatoryKeys() {
        Properties noDir = jobProps();
        noDir.remove("image.dir");
        Properties noCount = jobProps();
        noCount.remove("target.count");

        assertThrows(ConfigurationException.class, () -> JobSettings.from("a", noDir, null));
        assertThrows(ConfigurationException.class, () -> JobSettings.from("b", noCount, null));
    }

    @Test
    void testInvalidCountsAreRejected() {
        Properties zero = jobProps();
        zero.setProperty("target.count", "0");
        Properties text = jobProps();
        text.setProperty("target.count", "many");
        Properties badBatch = jobProps();
        badBatch.setProperty("checkpoint.batch.size", "-5");

        assertThrows(ConfigurationException.class, () -> JobSettings.from("a", zero, null));
        assertThrows(ConfigurationException.class, () -> JobSettings.from("b", text, null));
        assertThrows(ConfigurationException.class, () -> JobSettings.from("c", badBatch, null));
    }

    @Test
    void testBadOptionalValuesBecomeWarnings() {
        Properties job = jobProps();
        job.setProperty("separator.spacing.pt", "wide");
        job.setProperty("failure.policy", "retry");

        JobSettings settings = JobSettings.from("sample", job, null);

        assertEquals(2, settings.getWarnings().size());
        assertEquals(FailurePolicy.SKIP, settings.getFailurePolicy());
    }

    @Test
    void testUnknownPageSizeIsRejected() {
        Properties job = jobProps();
        job.setProperty("page.size", "tabloid");

        assertThrows(ConfigurationException.class, () -> JobSettings.from("sample", job, null));
    }

    @Test
    void testReplacementAttemptsDefaultToRestOfPool() {
        Properties job = jobProps();
        job.setProperty("failure.policy", "REPLACE");

        JobSettings settings = JobSettings.from("sample", job, null);

        assertEquals(9, settings.effectiveMaxReplacementAttempts(10));
        assertEquals(0, settings.effectiveMaxReplacementAttempts(1));
        assertEquals(10, settings.toAssemblyOptions(10).attemptsPerSlot());

        job.setProperty("failure.max.replacement.attempts", "2");
        assertEquals(2, JobSettings.from("sample", job, null).effectiveMaxReplacementAttempts(10));
    }

    @Test
    void testMaxIntReplacementAttemptsStayPositive() {
        Properties job = jobProps();
        job.setProperty("failure.policy", "REPLACE");
        job.setProperty("failure.max.replacement.attempts", "2147483647");

        AssemblyOptions options = JobSettings.from("sample", job, null).toAssemblyOptions(10);

        assertEquals(Integer.MAX_VALUE, options.attemptsPerSlot());
    }

    @Test
    void testLoadUsesFileNameAsJobName() throws IOException {
        Path file = tempDir.resolve("weekly-scans.properties");
        Files.writeString(file, "image.dir=scans\ntarget.count=12\n");

        JobSettings settings = JobSettings.load(file, new Properties());

        assertEquals("weekly-scans", settings.getJobName());
        assertEquals(12, settings.getTargetCount());
    }

    @Test
    void testLoadPrefersExplicitJobName() throws IOException {
        Path file = tempDir.resolve("job1.properties");
        Files.writeString(file, "job.name=Holiday album\nimage.dir=scans\ntarget.count=12\n");

        assertEquals("Holiday album", JobSettings.load(file, new Properties()).getJobName());
    }
}
