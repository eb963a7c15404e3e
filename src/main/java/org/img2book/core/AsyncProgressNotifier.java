// Generated code - Model: Auto (Cursor AI)
// Date: 2026-10-19
package org.img2book.core;

import org.img2book.error.ImageInsertException;

import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Forwards notifications to a delegate listener on a single background thread, so the assembly loop never
 * waits on a slow or failing listener. Delivery order is preserved.
 */
public class AsyncProgressNotifier implements ProgressListener, AutoCloseable {
    private static final long DEFAULT_DRAIN_TIMEOUT_MS = 5_000;

    private final ProgressListener delegate;
    private final Logger logger;
    private final ExecutorService executor;
    private final long drainTimeoutMs;

    public AsyncProgressNotifier(ProgressListener delegate, Logger logger) {
        this(delegate, logger, DEFAULT_DRAIN_TIMEOUT_MS);
    }

    public AsyncProgressNotifier(ProgressListener delegate, Logger logger, long drainTimeoutMs) {
        this.delegate = delegate;
        this.logger = logger;
        this.drainTimeoutMs = drainTimeoutMs;
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "img2book-progress");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public void onProgress(ProgressEvent event) {
        dispatch(() -> delegate.onProgress(event));
    }

    @Override
    public void onItemFailed(Path imageFile, ImageInsertException cause) {
        dispatch(() -> delegate.onItemFailed(imageFile, cause));
    }

    @Override
    public void onSummary(AssemblySummary summary) {
        dispatch(() -> delegate.onSummary(summary));
    }

    /**
     * Stops accepting notifications and waits a bounded time for queued ones to be delivered.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
                logger.warning("Progress notifications still pending after " + drainTimeoutMs + "ms - dropping them");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void dispatch(Runnable notification) {
        try {
            executor.execute(() -> {
                try {
                    notification.run();
                } catch (RuntimeException e) {
                    logger.log(Level.WARNING, "Progress listener failed: " + e.getMessage(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            logger.fine("Notification dropped, notifier already closed");
        }
    }
}
