// Generated code - Model: Auto (Cursor AI)
// Date: 2026-10-19
package org.img2book.core;

import org.img2book.error.ConfigurationException;
import org.img2book.layout.PageGeometry;
import org.img2book.pdf.PdfDocumentBootstrap;
import org.img2book.pdf.PdfDocumentSink;
import org.img2book.source.ImageFolderScanner;

import java.io.FileInputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.Set;

/**
 * Settings of one assembly job.
 * Each value comes from the job file, else from the global {@code default.*} key, else from a built-in default.
 */
public class JobSettings {
    private final String jobName;
    private final Path imageDir;
    private final int targetCount;
    private final int checkpointBatchSize;
    private final boolean pageBreakPerImage;
    private final Set<String> imageExtensions;
    private final FailurePolicy failurePolicy;
    private final int maxReplacementAttempts; // -1 means "pool size"
    private final Path outputDir;
    private final String outputFilenameTemplate;
    private final boolean appendExisting;
    private final PageGeometry pageGeometry;
    private final float separatorSpacing;
    private final Path logDir;
    private final String pdfMemoryMode;
    private final long pdfMaxMainMemoryMb;

    // Non-fatal problems found while resolving, logged once the job logger exists
    private final List<String> warnings;

    private JobSettings(String jobName, Properties jobProps, Properties globalProps) {
        List<String> problems = new ArrayList<>();
        this.jobName = jobName;

        String imageDirValue = require(jobProps, "image.dir");
        this.imageDir = Paths.get(imageDirValue);

        this.targetCount = requirePositiveInt(jobProps, "target.count");

        String batchValue = resolve(jobProps, "checkpoint.batch.size", globalProps, "default.checkpoint.batch.size", null);
        if (batchValue == null) {
            this.checkpointBatchSize = CheckpointPolicy.DEFAULT_BATCH_SIZE;
        } else {
            this.checkpointBatchSize = parsePositiveInt("checkpoint.batch.size", batchValue);
        }

        this.pageBreakPerImage = "true".equalsIgnoreCase(
                resolve(jobProps, "page.break.per.image", globalProps, "default.page.break.per.image", "true"));

        this.imageExtensions = ImageFolderScanner.parseExtensions(
                resolve(jobProps, "image.extensions", globalProps, "default.image.extensions", ImageFolderScanner.DEFAULT_EXTENSIONS));

        String policyValue = resolve(jobProps, "failure.policy", globalProps, "default.failure.policy", "skip");
        this.failurePolicy = FailurePolicy.parse(policyValue, FailurePolicy.SKIP);
        if (!failurePolicy.name().equalsIgnoreCase(policyValue.trim())) {
            problems.add("Unknown failure.policy '" + policyValue + "', using " + failurePolicy);
        }
        this.maxReplacementAttempts = parseInt(jobProps.getProperty("failure.max.replacement.attempts"), -1,
                "failure.max.replacement.attempts", problems);

        this.outputDir = Paths.get(resolve(jobProps, "output.dir", globalProps, "default.output.dir", "output"));
        this.outputFilenameTemplate = value(jobProps, "output.filename.template", PdfDocumentBootstrap.DEFAULT_FILENAME);
        this.appendExisting = "true".equalsIgnoreCase(
                resolve(jobProps, "output.append.existing", globalProps, "default.output.append.existing", "false"));

        String pageSize = resolve(jobProps, "page.size", globalProps, "default.page.size", "A4");
        double margin = parseDouble(resolve(jobProps, "page.margin.cm", globalProps, "default.page.margin.cm", null),
                PageGeometry.DEFAULT_MARGIN_CM, "page.margin.cm", problems);
        this.pageGeometry = PageGeometry.named(pageSize,
                parseDouble(jobProps.getProperty("page.margin.top.cm"), margin, "page.margin.top.cm", problems),
                parseDouble(jobProps.getProperty("page.margin.bottom.cm"), margin, "page.margin.bottom.cm", problems),
                parseDouble(jobProps.getProperty("page.margin.left.cm"), margin, "page.margin.left.cm", problems),
                parseDouble(jobProps.getProperty("page.margin.right.cm"), margin, "page.margin.right.cm", problems));

        this.separatorSpacing = (float) parseDouble(jobProps.getProperty("separator.spacing.pt"),
                PdfDocumentSink.DEFAULT_SEPARATOR_SPACING, "separator.spacing.pt", problems);

        String logDirValue = resolve(jobProps, "log.dir", globalProps, "default.log.dir", null);
        this.logDir = logDirValue != null ? Paths.get(logDirValue) : outputDir;

        this.pdfMemoryMode = resolve(jobProps, "pdf.memory.mode", globalProps, "default.pdf.memory.mode", "mixed");
        this.pdfMaxMainMemoryMb = parseInt(jobProps.getProperty("pdf.max.main.memory.mb"),
                (int) PdfDocumentBootstrap.DEFAULT_MAX_MAIN_MEMORY_MB, "pdf.max.main.memory.mb", problems);

        this.warnings = Collections.unmodifiableList(problems);
    }

    /**
     * Loads a job file.
     *
     * @param jobConfigPath The job properties file; its file name (without extension) becomes the job name
     * @param globalProps Global properties holding the default.* fallbacks
     */
    public static JobSettings load(Path jobConfigPath, Properties globalProps) throws IOException {
        Properties jobProps = new Properties();
        try (FileInputStream fis = new FileInputStream(jobConfigPath.toFile())) {
            jobProps.load(fis);
        }
        String fileName = jobConfigPath.getFileName().toString();
        int dotIndex = fileName.lastIndexOf('.');
        String defaultName = dotIndex > 0 ? fileName.substring(0, dotIndex) : fileName;
        return from(value(jobProps, "job.name", defaultName), jobProps, globalProps);
    }

    public static JobSettings from(String jobName, Properties jobProps, Properties globalProps) {
        return new JobSettings(jobName, jobProps, globalProps != null ? globalProps : new Properties());
    }

    private static String value(Properties props, String key, String defaultValue) {
        String value = props.getProperty(key);
        return value != null && !value.trim().isEmpty() ? value.trim() : defaultValue;
    }

    private static String resolve(Properties jobProps, String key, Properties globalProps, String globalKey, String defaultValue) {
        String jobValue = value(jobProps, key, null);
        if (jobValue != null) {
            return jobValue;
        }
        return value(globalProps, globalKey, defaultValue);
    }

    private static String require(Properties props, String key) {
        String value = value(props, key, null);
        if (value == null) {
            throw new ConfigurationException("Missing mandatory property '" + key + "'");
        }
        return value;
    }

    private static int requirePositiveInt(Properties props, String key) {
        return parsePositiveInt(key, require(props, key));
    }

    private static int parsePositiveInt(String key, String value) {
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed <= 0) {
                throw new ConfigurationException(key + " must be > 0 but was " + parsed);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Invalid " + key + " value: " + value, e);
        }
    }

    private static int parseInt(String value, int defaultValue, String key, List<String> problems) {
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            problems.add("Invalid " + key + " value '" + value + "', using " + defaultValue);
            return defaultValue;
        }
    }

    private static double parseDouble(String value, double defaultValue, String key, List<String> problems) {
        if (value == null || value.trim().isEmpty()) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            problems.add("Invalid " + key + " value '" + value + "', using " + defaultValue);
            return defaultValue;
        }
    }

    /**
     * @param poolSize Number of images found in the pool
     * @return Replacement tries per slot, defaulting to one pass over the rest of the pool
     */
    public int effectiveMaxReplacementAttempts(int poolSize) {
        if (maxReplacementAttempts >= 0) {
            return maxReplacementAttempts;
        }
        return Math.max(0, poolSize - 1);
    }

    public AssemblyOptions toAssemblyOptions(int poolSize) {
        return new AssemblyOptions(targetCount, new CheckpointPolicy(checkpointBatchSize), pageBreakPerImage,
                failurePolicy, effectiveMaxReplacementAttempts(poolSize));
    }

    public String getJobName() {
        return jobName;
    }

    public Path getImageDir() {
        return imageDir;
    }

    public int getTargetCount() {
        return targetCount;
    }

    public int getCheckpointBatchSize() {
        return checkpointBatchSize;
    }

    public boolean isPageBreakPerImage() {
        return pageBreakPerImage;
    }

    public Set<String> getImageExtensions() {
        return imageExtensions;
    }

    public FailurePolicy getFailurePolicy() {
        return failurePolicy;
    }

    public Path getOutputDir() {
        return outputDir;
    }

    public String getOutputFilenameTemplate() {
        return outputFilenameTemplate;
    }

    public boolean isAppendExisting() {
        return appendExisting;
    }

    public PageGeometry getPageGeometry() {
        return pageGeometry;
    }

    public float getSeparatorSpacing() {
        return separatorSpacing;
    }

    public Path getLogDir() {
        return logDir;
    }

    public String getPdfMemoryMode() {
        return pdfMemoryMode;
    }

    public long getPdfMaxMainMemoryMb() {
        return pdfMaxMainMemoryMb;
    }

    public List<String> getWarnings() {
        return warnings;
    }
}
