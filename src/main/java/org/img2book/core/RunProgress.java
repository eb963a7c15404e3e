// Generated code - Model: Auto (Cursor AI)
// Date: 2026-10-19
package org.img2book.core;

/**
 * Mutable counters of a single assembly run. All counters only ever grow.
 */
public class RunProgress {
    private final int targetCount;
    private int attemptedCount;       // slots started
    private int insertedCount;        // slots filled
    private int failedCount;          // slots left empty
    private int failedAttempts;       // individual image failures, including replaced ones
    private int checkpointCount;      // successful persists
    private int durableInsertedCount; // insertedCount at the last successful persist

    public RunProgress(int targetCount) {
        this.targetCount = targetCount;
    }

    void recordAttempt() {
        attemptedCount++;
    }

    void recordInserted() {
        insertedCount++;
    }

    void recordFailedAttempt() {
        failedAttempts++;
    }

    void recordFailedSlot() {
        failedCount++;
    }

    void recordCheckpoint() {
        checkpointCount++;
        durableInsertedCount = insertedCount;
    }

    public int getTargetCount() {
        return targetCount;
    }

    public int getAttemptedCount() {
        return attemptedCount;
    }

    public int getInsertedCount() {
        return insertedCount;
    }

    public int getFailedCount() {
        return failedCount;
    }

    public int getFailedAttempts() {
        return failedAttempts;
    }

    public int getCheckpointCount() {
        return checkpointCount;
    }

    public int getDurableInsertedCount() {
        return durableInsertedCount;
    }
}
