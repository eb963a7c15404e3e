// Generated code - Model: Auto (Cursor AI)
// Date: 2026-10-19
package org.img2book.log;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Quiets library loggers for the duration of a batch run and restores them afterwards.
 * Thousands of embedded images make PDFBox and FontBox chatty; use with try-with-resources so the previous
 * levels come back on every exit path.
 */
public class BatchModeScope implements AutoCloseable {
    public static final List<String> LIBRARY_LOGGERS = Arrays.asList(
        "org.apache.pdfbox",
        "org.apache.pdfbox.pdmodel.font",
        "org.apache.fontbox",
        "org.apache.fontbox.ttf"
    );

    private final List<SavedLevel> saved = new ArrayList<>();
    private boolean closed;

    private BatchModeScope(List<String> loggerNames, Level quietLevel) {
        for (String name : loggerNames) {
            Logger logger = Logger.getLogger(name);
            saved.add(new SavedLevel(logger, logger.getLevel(), logger.getUseParentHandlers()));
            logger.setLevel(quietLevel);
            logger.setUseParentHandlers(false);
        }
    }

    /**
     * Enters batch mode for the PDFBox/FontBox loggers.
     *
     * @param quietLevel Level the library loggers are raised to while the scope is open
     */
    public static BatchModeScope enter(Level quietLevel) {
        return new BatchModeScope(LIBRARY_LOGGERS, quietLevel);
    }

    public static BatchModeScope enter(List<String> loggerNames, Level quietLevel) {
        return new BatchModeScope(loggerNames, quietLevel);
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        for (SavedLevel entry : saved) {
            entry.logger.setLevel(entry.level);
            entry.logger.setUseParentHandlers(entry.useParentHandlers);
        }
    }

    // Holds a strong reference: java.util.logging keeps loggers only weakly
    private static class SavedLevel {
        final Logger logger;
        final Level level;
        final boolean useParentHandlers;

        SavedLevel(Logger logger, Level level, boolean useParentHandlers) {
            this.logger = logger;
            this.level = level;
            this.useParentHandlers = useParentHandlers;
        }
    }
}
