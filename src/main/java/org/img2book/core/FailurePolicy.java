// Generated code - Model: Auto (Cursor AI)
// Date: 2026-10-19
package org.img2book.core;

import java.util.Locale;

/**
 * What the assembly loop does with a slot whose image could not be inserted.
 */
public enum FailurePolicy {
    /** The slot is consumed; fewer than the requested number of images may end up in the document. */
    SKIP,
    /** The slot is retried with the following pool entries, up to a bounded number of replacements. */
    REPLACE;

    public static FailurePolicy parse(String value, FailurePolicy defaultPolicy) {
        if (value == null || value.trim().isEmpty()) {
            return defaultPolicy;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return defaultPolicy;
        }
    }
}
