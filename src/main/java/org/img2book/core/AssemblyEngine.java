// Generated code - Model: Auto (Cursor AI)
// Date: 2026-10-19
package org.img2book.core;

import org.img2book.error.AssemblyAbortedException;
import org.img2book.error.ImageInsertException;
import org.img2book.error.InvalidGeometryException;
import org.img2book.error.PersistException;
import org.img2book.layout.ContentGeometry;
import org.img2book.layout.ImageDimensionReader;
import org.img2book.layout.ImageDimensions;
import org.img2book.layout.LayoutEngine;
import org.img2book.layout.ScaledSize;
import org.img2book.sink.DocumentSink;
import org.img2book.source.ImageSource;

import java.nio.file.Path;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives the insertion loop: one image per slot, drawn cyclically from the pool, with a durable checkpoint
 * every batch of successful insertions and a final one at the end.
 * <p>
 * Per-image failures are counted and reported, never propagated. A failed persist stops the run at once
 * with an {@link AssemblyAbortedException}; the last successful checkpoint stays the durable state.
 * <p>
 * Not reusable concurrently: one engine drives one sink at a time. {@link #cancel()} is the only method
 * meant to be called from another thread.
 */
public class AssemblyEngine {
    private final DocumentSink sink;
    private final ImageDimensionReader dimensionReader;
    private final ProgressListener listener;
    private final Logger logger;

    private volatile boolean cancelRequested;

    public AssemblyEngine(DocumentSink sink, ImageDimensionReader dimensionReader,
                          ProgressListener listener, Logger logger) {
        this.sink = sink;
        this.dimensionReader = dimensionReader;
        this.listener = listener != null ? listener : ProgressListener.NONE;
        this.logger = logger;
    }

    /**
     * Asks a running assembly to stop before its next slot. The run then persists once more and returns
     * a {@link AssemblySummary.Outcome#CANCELLED} summary.
     */
    public void cancel() {
        cancelRequested = true;
    }

    public boolean isCancelRequested() {
        return cancelRequested;
    }

    /**
     * Runs the assembly loop.
     *
     * @param source Cyclic image pool
     * @param geometry Content area of a page; its width must be > 0
     * @param options Target count, checkpoint cadence, page break and failure policies
     * @return Summary of a completed or cancelled run
     * @throws InvalidGeometryException if the content width is not positive (nothing is touched)
     * @throws AssemblyAbortedException if the document could not be persisted or the sink failed unexpectedly
     */
    public AssemblySummary run(ImageSource source, ContentGeometry geometry, AssemblyOptions options) {
        if (!(geometry.getContentWidth() > 0)) {
            throw new InvalidGeometryException("Invalid content width " + geometry.getContentWidth()
                    + ". Check page size/margins.");
        }

        RunProgress progress = new RunProgress(options.getTargetCount());
        long startTime = System.currentTimeMillis();
        CheckpointPolicy checkpointPolicy = options.getCheckpointPolicy();

        logger.info("Starting assembly: " + options.getTargetCount() + " image(s) from a pool of " + source.size()
                + ", " + geometry + ", checkpoint " + checkpointPolicy
                + ", " + (options.isPageBreakPerImage() ? "page break" : "separator") + " after each image"
                + ", failure policy " + options.getFailurePolicy());

        boolean cancelled = false;
        try {
            sink.ensureInsertionPoint();

            for (int slot = 1; slot <= options.getTargetCount(); slot++) {
                if (cancelRequested) {
                    cancelled = true;
                    logger.warning("Cancellation requested - stopping before slot " + slot + " of " + options.getTargetCount());
                    break;
                }

                progress.recordAttempt();
                if (!fillSlot(slot, source, geometry, options, progress)) {
                    continue;
                }

                if (checkpointPolicy.isDue(progress.getInsertedCount())) {
                    sink.persist();
                    progress.recordCheckpoint();
                    ProgressEvent event = new ProgressEvent(progress.getInsertedCount(), options.getTargetCount(), sink.sizeBytes());
                    logger.info("Checkpoint " + progress.getCheckpointCount() + ": inserted " + event.getInsertedCount()
                            + " / " + event.getTargetCount() + ", file size " + event.getSizeBytes() + " bytes");
                    notifyProgress(event);
                }
            }

            // Final checkpoint, also taken after a cancellation
            sink.persist();
            progress.recordCheckpoint();
        } catch (PersistException e) {
            throw abort(progress, startTime, e);
        } catch (RuntimeException e) {
            // Unexpected sink failure outside image insertion: the document state is unknown
            throw abort(progress, startTime, e);
        }

        AssemblySummary summary = AssemblySummary.of(
                cancelled ? AssemblySummary.Outcome.CANCELLED : AssemblySummary.Outcome.COMPLETED,
                progress, sink.sizeBytes(), System.currentTimeMillis() - startTime);
        logger.info("Assembly " + summary.getOutcome().name().toLowerCase() + ": attempted " + summary.getAttemptedCount()
                + ", inserted " + summary.getInsertedCount() + ", failed " + summary.getFailedCount()
                + " (" + summary.getFailedAttempts() + " failed attempt(s)), " + summary.getCheckpointCount()
                + " checkpoint(s), " + summary.getSizeBytes() + " bytes at " + sink.describe());
        notifySummary(summary);
        return summary;
    }

    /**
     * Tries to fill one slot, replacing failed images with the next pool entries when the policy allows it.
     *
     * @return true if an image was inserted
     */
    private boolean fillSlot(int slot, ImageSource source, ContentGeometry geometry,
                             AssemblyOptions options, RunProgress progress) {
        int attemptsAllowed = options.attemptsPerSlot();

        for (int attempt = 1; attempt <= attemptsAllowed; attempt++) {
            Path imageFile = source.next();
            InsertionOutcome outcome = insert(imageFile, geometry);

            if (outcome.isInserted()) {
                progress.recordInserted();
                if (options.isPageBreakPerImage()) {
                    sink.appendPageBreak();
                } else {
                    sink.appendSeparator();
                }
                if (logger.isLoggable(Level.FINE)) {
                    logger.fine("Slot " + slot + ": inserted " + imageFile.getFileName() + " at " + outcome.getSize());
                }
                return true;
            }

            progress.recordFailedAttempt();
            ImageInsertException failure = outcome.getFailure();
            logger.warning("Slot " + slot + ": " + failure.getMessage()
                    + (attempt < attemptsAllowed ? " - trying next image" : " - skipping slot"));
            notifyItemFailed(imageFile, failure);
        }

        progress.recordFailedSlot();
        return false;
    }

    private InsertionOutcome insert(Path imageFile, ContentGeometry geometry) {
        try {
            ImageDimensions intrinsic = dimensionReader.read(imageFile);
            ScaledSize size = LayoutEngine.fitToWidth(intrinsic.getWidth(), intrinsic.getHeight(), geometry.getContentWidth());
            sink.appendImage(imageFile, size.getWidth(), size.getHeight());
            return InsertionOutcome.inserted(imageFile, size);
        } catch (ImageInsertException e) {
            return InsertionOutcome.failed(imageFile, e);
        } catch (InvalidGeometryException e) {
            return InsertionOutcome.failed(imageFile, new ImageInsertException(imageFile, e));
        }
    }

    private AssemblyAbortedException abort(RunProgress progress, long startTime, RuntimeException cause) {
        AssemblySummary summary = AssemblySummary.of(AssemblySummary.Outcome.ABORTED, progress,
                sink.sizeBytes(), System.currentTimeMillis() - startTime);
        logger.log(Level.SEVERE, "Assembly aborted after " + summary.getInsertedCount() + " insertion(s); last durable checkpoint covers "
                + summary.getDurableInsertedCount() + ": " + cause.getMessage(), cause);
        notifySummary(summary);
        return new AssemblyAbortedException(summary, cause);
    }

    private void notifyProgress(ProgressEvent event) {
        try {
            listener.onProgress(event);
        } catch (RuntimeException e) {
            logger.warning("Progress listener failed: " + e.getMessage());
        }
    }

    private void notifyItemFailed(Path imageFile, ImageInsertException cause) {
        try {
            listener.onItemFailed(imageFile, cause);
        } catch (RuntimeException e) {
            logger.warning("Progress listener failed: " + e.getMessage());
        }
    }

    private void notifySummary(AssemblySummary summary) {
        try {
            listener.onSummary(summary);
        } catch (RuntimeException e) {
            logger.warning("Progress listener failed: " + e.getMessage());
        }
    }
}
