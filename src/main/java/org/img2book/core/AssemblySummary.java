// Generated code - Model: Auto (Cursor AI)
// Date: 2026-10-19
package org.img2book.core;

/**
 * Final account of an assembly run, produced on completion, cancellation and fatal abort alike.
 */
public final class AssemblySummary {

    public enum Outcome {
        COMPLETED,
        CANCELLED,
        ABORTED
    }

    private final Outcome outcome;
    private final int targetCount;
    private final int attemptedCount;
    private final int insertedCount;
    private final int failedCount;
    private final int failedAttempts;
    private final int checkpointCount;
    private final int durableInsertedCount;
    private final long sizeBytes;
    private final long elapsedMs;

    public AssemblySummary(Outcome outcome, int targetCount, int attemptedCount, int insertedCount,
                           int failedCount, int failedAttempts, int checkpointCount,
                           int durableInsertedCount, long sizeBytes, long elapsedMs) {
        this.outcome = outcome;
        this.targetCount = targetCount;
        this.attemptedCount = attemptedCount;
        this.insertedCount = insertedCount;
        this.failedCount = failedCount;
        this.failedAttempts = failedAttempts;
        this.checkpointCount = checkpointCount;
        this.durableInsertedCount = durableInsertedCount;
        this.sizeBytes = sizeBytes;
        this.elapsedMs = elapsedMs;
    }

    static AssemblySummary of(Outcome outcome, RunProgress progress, long sizeBytes, long elapsedMs) {
        return new AssemblySummary(outcome, progress.getTargetCount(), progress.getAttemptedCount(),
                progress.getInsertedCount(), progress.getFailedCount(), progress.getFailedAttempts(),
                progress.getCheckpointCount(), progress.getDurableInsertedCount(), sizeBytes, elapsedMs);
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public int getTargetCount() {
        return targetCount;
    }

    /** Slots the loop started, including failed ones. */
    public int getAttemptedCount() {
        return attemptedCount;
    }

    public int getInsertedCount() {
        return insertedCount;
    }

    /** Slots that ended without an image. */
    public int getFailedCount() {
        return failedCount;
    }

    /** Every failed insertion attempt, including those a replacement later made up for. */
    public int getFailedAttempts() {
        return failedAttempts;
    }

    public int getCheckpointCount() {
        return checkpointCount;
    }

    /** Insertions covered by the last successful persist. */
    public int getDurableInsertedCount() {
        return durableInsertedCount;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    public long getElapsedMs() {
        return elapsedMs;
    }

    public boolean isComplete() {
        return outcome == Outcome.COMPLETED && insertedCount == targetCount;
    }

    @Override
    public String toString() {
        return "AssemblySummary{" +
                "outcome=" + outcome +
                ", targetCount=" + targetCount +
                ", attemptedCount=" + attemptedCount +
                ", insertedCount=" + insertedCount +
                ", failedCount=" + failedCount +
                ", failedAttempts=" + failedAttempts +
                ", checkpointCount=" + checkpointCount +
                ", durableInsertedCount=" + durableInsertedCount +
                ", sizeBytes=" + sizeBytes +
                ", elapsedMs=" + elapsedMs +
                '}';
    }
}
