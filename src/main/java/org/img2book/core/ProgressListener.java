// Generated code - Model: Auto (Cursor AI)
// Date: 2026-10-19
package org.img2book.core;

import org.img2book.error.ImageInsertException;

import java.nio.file.Path;

/**
 * Receives progress notifications from an assembly run.
 * Notifications are informational: an exception thrown from a listener never stops the run.
 */
public interface ProgressListener {

    ProgressListener NONE = new ProgressListener() {
    };

    default void onProgress(ProgressEvent event) {
    }

    default void onItemFailed(Path imageFile, ImageInsertException cause) {
    }

    default void onSummary(AssemblySummary summary) {
    }
}
