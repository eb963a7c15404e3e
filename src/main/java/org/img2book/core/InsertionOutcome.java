// Generated code - Model: Auto (Cursor AI)
// Date: 2026-10-19
package org.img2book.core;

import org.img2book.error.ImageInsertException;
import org.img2book.layout.ScaledSize;

import java.nio.file.Path;

/**
 * Result of one attempt to insert an image: either inserted at a size, or failed with a cause.
 */
public final class InsertionOutcome {
    private final Path imageFile;
    private final ScaledSize size;
    private final ImageInsertException failure;

    private InsertionOutcome(Path imageFile, ScaledSize size, ImageInsertException failure) {
        this.imageFile = imageFile;
        this.size = size;
        this.failure = failure;
    }

    public static InsertionOutcome inserted(Path imageFile, ScaledSize size) {
        return new InsertionOutcome(imageFile, size, null);
    }

    public static InsertionOutcome failed(Path imageFile, ImageInsertException failure) {
        return new InsertionOutcome(imageFile, null, failure);
    }

    public boolean isInserted() {
        return failure == null;
    }

    public Path getImageFile() {
        return imageFile;
    }

    /**
     * @return The size the image was inserted at, or null for a failed attempt
     */
    public ScaledSize getSize() {
        return size;
    }

    /**
     * @return The failure cause, or null for a successful attempt
     */
    public ImageInsertException getFailure() {
        return failure;
    }
}
