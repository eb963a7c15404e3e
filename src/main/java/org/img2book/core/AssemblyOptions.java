// Generated code - Model: Auto (Cursor AI)
// Date: 2026-10-19
package org.img2book.core;

/**
 * Per-run settings of the assembly loop.
 */
public final class AssemblyOptions {
    private final int targetCount;
    private final CheckpointPolicy checkpointPolicy;
    private final boolean pageBreakPerImage;
    private final FailurePolicy failurePolicy;
    private final int maxReplacementAttempts;

    /**
     * @param targetCount Number of slots to fill, 0 or more
     * @param maxReplacementAttempts Extra tries per slot under {@link FailurePolicy#REPLACE}; ignored for SKIP
     */
    public AssemblyOptions(int targetCount, CheckpointPolicy checkpointPolicy, boolean pageBreakPerImage,
                           FailurePolicy failurePolicy, int maxReplacementAttempts) {
        if (targetCount < 0) {
            throw new IllegalArgumentException("Target count must be >= 0 but was " + targetCount);
        }
        if (checkpointPolicy == null) {
            throw new IllegalArgumentException("Checkpoint policy is required");
        }
        this.targetCount = targetCount;
        this.checkpointPolicy = checkpointPolicy;
        this.pageBreakPerImage = pageBreakPerImage;
        this.failurePolicy = failurePolicy != null ? failurePolicy : FailurePolicy.SKIP;
        // Integer.MAX_VALUE is accepted as "unlimited"; keep 1 + attempts within int range
        this.maxReplacementAttempts = Math.min(Math.max(0, maxReplacementAttempts), Integer.MAX_VALUE - 1);
    }

    public AssemblyOptions(int targetCount, CheckpointPolicy checkpointPolicy, boolean pageBreakPerImage) {
        this(targetCount, checkpointPolicy, pageBreakPerImage, FailurePolicy.SKIP, 0);
    }

    public int getTargetCount() {
        return targetCount;
    }

    public CheckpointPolicy getCheckpointPolicy() {
        return checkpointPolicy;
    }

    public boolean isPageBreakPerImage() {
        return pageBreakPerImage;
    }

    public FailurePolicy getFailurePolicy() {
        return failurePolicy;
    }

    public int getMaxReplacementAttempts() {
        return maxReplacementAttempts;
    }

    /**
     * @return How many images a single slot may try before it is given up
     */
    int attemptsPerSlot() {
        return failurePolicy == FailurePolicy.REPLACE ? 1 + maxReplacementAttempts : 1;
    }
}
