// Generated code - Model: Auto (Cursor AI)
// Date: 2026-10-19
package org.img2book.source;

import org.img2book.error.EmptyPoolException;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Cyclic, deterministic access to a fixed pool of image paths.
 * The pool is copied at construction and never re-scanned, so the order is stable for the whole run.
 */
public class ImageSource {
    private final List<Path> pool;
    private int cursor; // 0-based index of the next path to hand out

    public ImageSource(List<Path> pool) {
        if (pool == null || pool.isEmpty()) {
            throw new EmptyPoolException("Image pool is empty - at least one image file is required");
        }
        List<Path> copy = new ArrayList<>(pool.size());
        for (Path path : pool) {
            if (path == null) {
                throw new IllegalArgumentException("Image pool contains a null path");
            }
            copy.add(path);
        }
        this.pool = Collections.unmodifiableList(copy);
        this.cursor = 0;
    }

    /**
     * Returns the path at the cursor and advances it, wrapping to the first image after the last one.
     *
     * @return The next image path (never null)
     */
    public Path next() {
        Path path = pool.get(cursor);
        cursor++;
        if (cursor >= pool.size()) {
            cursor = 0;
        }
        return path;
    }

    public int size() {
        return pool.size();
    }

    public List<Path> paths() {
        return pool;
    }

    /**
     * @return 0-based index of the path the next call to {@link #next()} will return
     */
    public int position() {
        return cursor;
    }
}
