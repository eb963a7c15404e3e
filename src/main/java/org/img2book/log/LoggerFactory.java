// Generated code - Model: Auto (Cursor AI)
// Date: 2026-10-19
package org.img2book.log;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Properties;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Factory for creating per-job file loggers.
 */
public class LoggerFactory {
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    /**
     * Creates a logger that writes to {@code <logDir>/<jobName>.log}.
     *
     * @param loggerName The name for the logger
     * @param logDir The directory where the log file should be created
     * @param jobName The job name (will be sanitized for filename)
     * @param globalProps Global properties to read the log.level setting from
     * @return A Logger instance configured to write to a file
     */
    public static Logger createFileLogger(String loggerName, Path logDir, String jobName, Properties globalProps) {
        Level logLevel = parseLogLevel(globalProps != null ? globalProps.getProperty("log.level") : null, Level.INFO);

        Logger logger = Logger.getLogger(loggerName);
        logger.setLevel(logLevel);
        logger.setUseParentHandlers(false); // Console output goes through System.out

        // A logger name is reused when the same job runs twice in one JVM
        closeHandlers(logger);

        try {
            Files.createDirectories(logDir);
            Path logFile = logDir.resolve(sanitizeFilename(jobName) + ".log");

            FileHandler fileHandler = new FileHandler(logFile.toString(), true);
            fileHandler.setFormatter(new LineFormatter());
            fileHandler.setLevel(logLevel);
            logger.addHandler(fileHandler);
        } catch (IOException e) {
            // Fall back to the parent (console) handlers so messages are not lost
            logger.setUseParentHandlers(true);
            logger.log(Level.SEVERE, "Failed to create file logger in " + logDir + ": " + e.getMessage(), e);
        }
        return logger;
    }

    /**
     * Flushes and closes every handler attached to the logger.
     */
    public static void closeHandlers(Logger logger) {
        for (Handler handler : logger.getHandlers()) {
            handler.flush();
            handler.close();
            logger.removeHandler(handler);
        }
    }

    /**
     * Parses a log level string to a Level object.
     *
     * @param levelStr The log level string (SEVERE, WARNING, INFO, FINE, FINER, FINEST, ALL, OFF)
     * @param defaultLevel Level returned when the string is blank or invalid
     * @return The corresponding Level object
     */
    public static Level parseLogLevel(String levelStr, Level defaultLevel) {
        if (levelStr == null || levelStr.trim().isEmpty()) {
            return defaultLevel;
        }

        try {
            return Level.parse(levelStr.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return defaultLevel;
        }
    }

    /**
     * Sanitizes a string to be safe for use as a filename.
     * Replaces invalid characters with underscores and collapses whitespace.
     */
    public static String sanitizeFilename(String filename) {
        if (filename == null) {
            return "unknown";
        }

        String sanitized = filename.replaceAll("[\\\\/:*?\"<>|]", "_");
        sanitized = sanitized.trim().replaceAll("\\s+", " ");

        // Leading/trailing dots and spaces are rejected on Windows
        sanitized = sanitized.replaceAll("^[\\.\\s]+|[\\.\\s]+$", "");

        if (sanitized.isEmpty()) {
            return "unknown";
        }
        return sanitized;
    }

    /**
     * Outputs: [yyyy-MM-dd HH:mm:ss] LEVEL message
     */
    private static class LineFormatter extends Formatter {
        @Override
        public String format(LogRecord record) {
            String timestamp = LocalDateTime.now().format(DATE_FORMAT);
            String level = record.getLevel().getName();
            String message = formatMessage(record);

            if (record.getThrown() != null) {
                StringWriter sw = new StringWriter();
                record.getThrown().printStackTrace(new PrintWriter(sw));
                return String.format("[%s] %s %s%n%s%n", timestamp, level, message, sw);
            }

            return String.format("[%s] %s %s%n", timestamp, level, message);
        }
    }
}
