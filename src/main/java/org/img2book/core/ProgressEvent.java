// Generated code - Model: Auto (Cursor AI)
// Date: 2026-10-19
package org.img2book.core;

/**
 * Emitted after each successful checkpoint.
 */
public final class ProgressEvent {
    private final int insertedCount;
    private final int targetCount;
    private final long sizeBytes;

    public ProgressEvent(int insertedCount, int targetCount, long sizeBytes) {
        this.insertedCount = insertedCount;
        this.targetCount = targetCount;
        this.sizeBytes = sizeBytes;
    }

    public int getInsertedCount() {
        return insertedCount;
    }

    public int getTargetCount() {
        return targetCount;
    }

    public long getSizeBytes() {
        return sizeBytes;
    }

    @Override
    public String toString() {
        return "ProgressEvent{" +
                "insertedCount=" + insertedCount +
                ", targetCount=" + targetCount +
                ", sizeBytes=" + sizeBytes +
                '}';
    }
}
