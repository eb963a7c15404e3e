// Generated code - Model: Auto (Cursor AI)
// Date: 2026-10-19
package org.img2book.error;

import org.img2book.core.AssemblySummary;

/**
 * Thrown when an assembly run stops on a fatal error.
 * The attached summary reflects the counters at the moment of the abort;
 * the last durable state is the one described by {@link AssemblySummary#getDurableInsertedCount()}.
 */
public class AssemblyAbortedException extends Img2BookException {
    private final transient AssemblySummary summary;

    public AssemblyAbortedException(AssemblySummary summary, Throwable cause) {
        super("Assembly aborted after " + summary.getInsertedCount() + " insertions ("
                + summary.getDurableInsertedCount() + " durable): "
                + (cause != null ? cause.getMessage() : "unknown cause"), cause);
        this.summary = summary;
    }

    public AssemblySummary getSummary() {
        return summary;
    }
}
