// Generated code - Model: Auto (Cursor AI)
// Date: 2026-10-19
package org.img2book.core;

import org.img2book.error.ImageInsertException;
import org.img2book.util.Formats;

import java.io.PrintStream;
import java.nio.file.Path;

/**
 * Prints status lines and the final summary to the console.
 */
public class ConsoleProgressListener implements ProgressListener {
    private final PrintStream out;
    private final PrintStream err;
    private final String documentLocation;

    public ConsoleProgressListener(String documentLocation) {
        this(System.out, System.err, documentLocation);
    }

    public ConsoleProgressListener(PrintStream out, PrintStream err, String documentLocation) {
        this.out = out;
        this.err = err;
        this.documentLocation = documentLocation;
    }

    @Override
    public void onProgress(ProgressEvent event) {
        out.println("Inserted " + event.getInsertedCount() + " / " + event.getTargetCount()
                + " ... File size: " + Formats.formatBytes(event.getSizeBytes()) + " bytes");
    }

    @Override
    public void onItemFailed(Path imageFile, ImageInsertException cause) {
        err.println("WARNING: Failed to insert " + imageFile.getFileName() + ": "
                + (cause.getCause() != null ? cause.getCause().getMessage() : cause.getMessage()));
    }

    @Override
    public void onSummary(AssemblySummary summary) {
        String status;
        switch (summary.getOutcome()) {
            case CANCELLED:
                status = "Cancelled.";
                break;
            case ABORTED:
                status = "ABORTED.";
                break;
            default:
                status = "Done.";
        }
        out.println(status + " Inserted " + summary.getInsertedCount() + " images. Size: "
                + Formats.formatBytes(summary.getSizeBytes()) + " bytes");
        out.println("  Attempted: " + summary.getAttemptedCount() + " / " + summary.getTargetCount());
        out.println("  Inserted:  " + summary.getInsertedCount());
        out.println("  Failed:    " + summary.getFailedCount()
                + (summary.getFailedAttempts() != summary.getFailedCount()
                    ? " (" + summary.getFailedAttempts() + " failed attempts)" : ""));
        if (summary.getOutcome() == AssemblySummary.Outcome.ABORTED) {
            out.println("  Durable:   " + summary.getDurableInsertedCount() + " (last successful checkpoint)");
        }
        out.println("  Duration:  " + Formats.formatDuration(summary.getElapsedMs()));
        out.println("  Saved:     " + documentLocation);
    }
}
