package photolib.ext.crop.service;

import java.io.IOException;

/**
 * Exception thrown when the photo record store cannot be read or written.
 * Distinguishes persistence failures from geometry errors, which are never exceptional.
 *
 * @since 0.1.0
 */
public class RecordStoreException extends IOException {

    /**
     * Constructs a new record store exception with the specified detail message.
     *
     * @param message the detail message
     */
    public RecordStoreException(String message) {
        super(message);
    }

    /**
     * Constructs a new record store exception with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause the cause
     */
    public RecordStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
