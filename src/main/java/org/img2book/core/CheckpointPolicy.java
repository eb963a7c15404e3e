// Generated code - Model: Auto (Cursor AI)
// Date: 2026-10-19
package org.img2book.core;

/**
 * Persist the document every {@code batchSize} successful insertions.
 */
public final class CheckpointPolicy {
    public static final int DEFAULT_BATCH_SIZE = 50;

    private final int batchSize;

    public CheckpointPolicy(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Checkpoint batch size must be > 0 but was " + batchSize);
        }
        this.batchSize = batchSize;
    }

    public int getBatchSize() {
        return batchSize;
    }

    /**
     * @return true when a checkpoint is due after reaching the given number of successful insertions
     */
    public boolean isDue(int insertedCount) {
        return insertedCount > 0 && insertedCount % batchSize == 0;
    }

    @Override
    public String toString() {
        return "every " + batchSize + " insertion(s)";
    }
}
