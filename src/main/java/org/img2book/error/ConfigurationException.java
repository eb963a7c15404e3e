// Generated code - Model: Auto (Cursor AI)
// Date: 2026-10-19
package org.img2book.error;

public class ConfigurationException extends Img2BookException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
